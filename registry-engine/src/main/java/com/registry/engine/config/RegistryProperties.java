package com.registry.engine.config;

import com.registry.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Externalized configuration under the {@code registry} prefix.
 *
 * <pre>
 * registry:
 *   root: /srv/registry        # required for local and shared backends
 *   backend: local             # local | shared | memory
 *   strict-verify: true
 *   required-files: [model.bin]
 *   lock-timeout: 10s
 *   audit-retry:
 *     max-attempts: 3
 *   io-retry:
 *     max-attempts: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "registry")
public record RegistryProperties(
    String root,
    @DefaultValue("local") BackendKind backend,
    @DefaultValue("true") boolean strictVerify,
    @DefaultValue List<String> requiredFiles,
    @DefaultValue("10s") Duration lockTimeout,
    @DefaultValue Retry auditRetry,
    @DefaultValue Retry ioRetry
) {

    public enum BackendKind {
        LOCAL,
        SHARED,
        MEMORY
    }

    /**
     * Retry settings, mapped onto {@link RetryPolicy}.
     */
    public record Retry(
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("50ms") Duration initialBackoff,
        @DefaultValue("2s") Duration maxBackoff,
        @DefaultValue("2.0") double backoffMultiplier,
        @DefaultValue("0.1") double jitterFactor
    ) {
        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, backoffMultiplier, jitterFactor);
        }
    }

    public RegistrySettings toSettings() {
        return new RegistrySettings(strictVerify, requiredFiles, lockTimeout, auditRetry.toPolicy());
    }
}
