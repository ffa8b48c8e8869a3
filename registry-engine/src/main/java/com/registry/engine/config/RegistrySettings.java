package com.registry.engine.config;

import com.registry.core.model.RetryPolicy;

import java.time.Duration;
import java.util.List;

/**
 * Engine behaviour independent of the storage medium.
 *
 * @param strictVerify Re-verify the manifest on every resolve and show
 * @param requiredFiles File names every registration must contain
 * @param lockTimeout Longest wait for an alias or audit lock
 * @param auditRetryPolicy Retries of the audit append after an alias moved
 */
public record RegistrySettings(
    boolean strictVerify,
    List<String> requiredFiles,
    Duration lockTimeout,
    RetryPolicy auditRetryPolicy
) {
    public RegistrySettings {
        requiredFiles = requiredFiles == null ? List.of() : List.copyOf(requiredFiles);
        if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
        if (auditRetryPolicy == null) {
            throw new IllegalArgumentException("auditRetryPolicy is required");
        }
    }

    /**
     * Strict verification, no required files, 10s lock timeout, default retries.
     */
    public static RegistrySettings defaults() {
        return new RegistrySettings(true, List.of(), Duration.ofSeconds(10), RetryPolicy.defaultPolicy());
    }

    public RegistrySettings withStrictVerify(boolean strict) {
        return new RegistrySettings(strict, requiredFiles, lockTimeout, auditRetryPolicy);
    }

    public RegistrySettings withRequiredFiles(List<String> files) {
        return new RegistrySettings(strictVerify, files, lockTimeout, auditRetryPolicy);
    }

    public RegistrySettings withAuditRetryPolicy(RetryPolicy policy) {
        return new RegistrySettings(strictVerify, requiredFiles, lockTimeout, policy);
    }

    public RegistrySettings withLockTimeout(Duration timeout) {
        return new RegistrySettings(strictVerify, requiredFiles, timeout, auditRetryPolicy);
    }
}
