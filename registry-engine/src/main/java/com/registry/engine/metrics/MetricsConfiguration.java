package com.registry.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the registry.
 *
 * Configures:
 * - Common tags for all metrics
 * - The registry metrics facade
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "artifact-registry");
    }

    @Bean
    public RegistryMetrics registryMetrics(MeterRegistry meterRegistry) {
        return new RegistryMetrics(meterRegistry);
    }
}
