package com.registry.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs of a registry operation carry its coordinates.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forVersion(task, model, version)) {
 *     log.info("Registering"); // Automatically includes task, model, version
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [http-nio-8080-exec-1] INFO  c.r.e.s.VersionStore - Registered version
 *   task=churn model=xgb version=v3 traceId=1f2e3d4c
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK = "task";
    public static final String MODEL = "model";
    public static final String VERSION = "version";
    public static final String ALIAS = "alias";
    public static final String ACTOR = "actor";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for task-level operations such as listings.
     */
    public static LoggingContext forTask(String task) {
        return forVersion(task, null, null);
    }

    /**
     * Create a logging context for operations on a model or one of its versions.
     */
    public static LoggingContext forVersion(String task, String model, String version) {
        LoggingContext ctx = new LoggingContext();
        put(TASK, task);
        put(MODEL, model);
        put(VERSION, version);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for alias mutations.
     */
    public static LoggingContext forAlias(String task, String model, String alias, String actor) {
        LoggingContext ctx = forVersion(task, model, null);
        put(ALIAS, alias);
        put(ACTOR, actor);
        return ctx;
    }

    /**
     * Add the resolved version to the current context.
     */
    public static void setVersion(String version) {
        put(VERSION, version);
    }

    /**
     * Adopt a caller supplied trace ID for the current thread.
     */
    public static void setTraceId(String traceId) {
        put(TRACE_ID, traceId);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TASK);
        MDC.remove(MODEL);
        MDC.remove(VERSION);
        MDC.remove(ALIAS);
        MDC.remove(ACTOR);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
