package com.registry.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the registry.
 *
 * Metrics exposed:
 * - registrations, resolutions and promotions by outcome
 * - integrity failures by task and model
 * - operation latency
 * - promotions currently holding an alias lock
 */
public class RegistryMetrics {

    // Metric names
    public static final String REGISTRATIONS = "registry.registrations";
    public static final String RESOLUTIONS = "registry.resolutions";
    public static final String PROMOTIONS = "registry.promotions";
    public static final String INTEGRITY_FAILURES = "registry.integrity.failures";
    public static final String OPERATION_DURATION = "registry.operation.duration";
    public static final String PROMOTIONS_IN_FLIGHT = "registry.promotions.in_flight";

    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry registry;
    private final AtomicInteger promotionsInFlight = new AtomicInteger();

    public RegistryMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(PROMOTIONS_IN_FLIGHT, promotionsInFlight, AtomicInteger::get)
            .description("Promotions currently in progress")
            .register(registry);
    }

    /**
     * Metrics backed by a private registry, for use outside a Spring context.
     */
    public static RegistryMetrics standalone() {
        return new RegistryMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void registration(String task, String outcome) {
        Counter.builder(REGISTRATIONS)
            .tag("task", task)
            .tag("outcome", outcome)
            .description("Version registrations")
            .register(registry)
            .increment();
    }

    public void resolution(String task, String outcome) {
        Counter.builder(RESOLUTIONS)
            .tag("task", task)
            .tag("outcome", outcome)
            .description("Reference resolutions")
            .register(registry)
            .increment();
    }

    public void promotion(String task, String alias, String outcome) {
        Counter.builder(PROMOTIONS)
            .tag("task", task)
            .tag("alias", alias)
            .tag("outcome", outcome)
            .description("Alias promotions")
            .register(registry)
            .increment();
    }

    public void integrityFailure(String task, String model) {
        Counter.builder(INTEGRITY_FAILURES)
            .tag("task", task)
            .tag("model", model)
            .description("Versions whose stored bytes no longer match the manifest")
            .register(registry)
            .increment();
    }

    public void promotionStarted() {
        promotionsInFlight.incrementAndGet();
    }

    public void promotionFinished() {
        promotionsInFlight.decrementAndGet();
    }

    // ========== Timing ==========

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, String operation, String outcome) {
        sample.stop(Timer.builder(OPERATION_DURATION)
            .tag("operation", operation)
            .tag("outcome", outcome)
            .description("Registry operation latency")
            .register(registry));
    }
}
