package com.registry.engine.promotion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.RegistryException;
import com.registry.core.exception.RegistryValidationException;
import com.registry.core.exception.StorageException;
import com.registry.core.model.AliasPointer;
import com.registry.core.model.AuditEntry;
import com.registry.core.model.Identifiers;
import com.registry.core.model.RegistryLayout;
import com.registry.core.model.RetryPolicy;
import com.registry.core.model.VersionId;
import com.registry.core.storage.StorageBackend;
import com.registry.core.storage.StorageLock;
import com.registry.engine.audit.AuditLog;
import com.registry.engine.resolve.AliasResolver;
import com.registry.engine.store.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Moves aliases between versions.
 *
 * State machine per (task, model, alias):
 * <pre>
 * UNSET --promote(v)--> POINTS_TO(v) --promote(v')--> POINTS_TO(v')
 * </pre>
 * There is no transition back to UNSET and no ordering between alias names.
 *
 * Every promotion:
 * - checks the target exists and the audit log is readable before mutating anything
 * - holds the alias lock while reading the old pointer and writing the new one
 * - writes the pointer atomically, then appends exactly one audit entry
 *
 * If the audit append keeps failing after the alias was written, the alias
 * stays moved and a {@link StorageException} reports the missing entry.
 */
public class PromotionEngine {

    private static final Logger log = LoggerFactory.getLogger(PromotionEngine.class);

    public static final String CTX_AUDIT_RECORDED = "auditRecorded";

    private final StorageBackend backend;
    private final VersionStore versionStore;
    private final AliasResolver aliasResolver;
    private final AuditLog auditLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration lockTimeout;
    private final RetryPolicy auditRetryPolicy;

    public PromotionEngine(
            StorageBackend backend,
            VersionStore versionStore,
            AliasResolver aliasResolver,
            AuditLog auditLog,
            ObjectMapper objectMapper,
            Clock clock,
            Duration lockTimeout,
            RetryPolicy auditRetryPolicy) {
        this.backend = backend;
        this.versionStore = versionStore;
        this.aliasResolver = aliasResolver;
        this.auditLog = auditLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.lockTimeout = lockTimeout;
        this.auditRetryPolicy = auditRetryPolicy;
    }

    /**
     * Point an alias at an existing version.
     *
     * Promoting to the version the alias already points at is recorded as an
     * UPDATE with {@code from == to}.
     *
     * @throws RegistryValidationException on a malformed identifier or empty actor
     * @throws NotFoundException if the target version does not exist; nothing is mutated
     * @throws StorageException if the lock, the alias write or the audit append fails, or the
     *         audit log is corrupted; in the last case nothing is mutated
     */
    public PromotionOutcome promote(
            String task,
            String model,
            String alias,
            String version,
            String actor,
            String reason) {
        VersionId target = VersionId.of(task, model, version);
        Identifiers.requireValid("alias", alias);
        if (actor == null || actor.isBlank()) {
            throw new RegistryValidationException("actor", "cannot be empty");
        }

        if (!versionStore.exists(target)) {
            throw new NotFoundException("Version", target.toString())
                .withCoordinates(task, model, version)
                .with(RegistryException.CTX_ALIAS, alias);
        }

        try (StorageLock lock = backend.lock(RegistryLayout.aliasLockPath(task, model, alias), lockTimeout)) {
            String previous = aliasResolver.readAlias(task, model, alias)
                .map(AliasPointer::version)
                .orElse(null);
            auditLog.requireReadable(task, model);
            Instant now = clock.instant();

            AliasPointer pointer = new AliasPointer(version, alias, now, actor);
            backend.writeAtomic(RegistryLayout.aliasPath(task, model, alias), toJson(pointer));
            log.info("Alias {} of {}/{} moved {} -> {} by {}",
                alias, task, model, previous == null ? "(unset)" : previous, version, actor);

            AuditEntry entry = AuditEntry.promotion(now, actor, alias, previous, version, reason);
            AuditEntry logged = appendAudit(target, alias, entry);
            return new PromotionOutcome(target, alias, previous, logged);
        }
    }

    private AuditEntry appendAudit(VersionId target, String alias, AuditEntry entry) {
        try {
            return auditLog.append(target.task(), target.model(), entry, auditRetryPolicy);
        } catch (StorageException e) {
            log.error("Alias {} of {}/{} points at {} but its audit entry was not recorded",
                alias, target.task(), target.model(), target.version(), e);
            throw auditNotRecorded(target, alias, e);
        }
    }

    private static StorageException auditNotRecorded(VersionId target, String alias, StorageException cause) {
        return (StorageException) new StorageException(
            "Alias '" + alias + "' now points at " + target.version()
                + " but the audit entry could not be recorded", cause)
            .withCoordinates(target.task(), target.model(), target.version())
            .with(RegistryException.CTX_ALIAS, alias)
            .with(CTX_AUDIT_RECORDED, "false");
    }

    private byte[] toJson(AliasPointer pointer) {
        try {
            return objectMapper.writeValueAsString(pointer).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize alias pointer", e);
        }
    }
}
