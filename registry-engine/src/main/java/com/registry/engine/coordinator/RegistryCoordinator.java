package com.registry.engine.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.core.exception.IntegrityException;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.RegistryException;
import com.registry.core.exception.StorageException;
import com.registry.core.json.RegistryJson;
import com.registry.core.model.AliasPointer;
import com.registry.core.model.AuditEntry;
import com.registry.core.model.Identifiers;
import com.registry.core.model.ManifestMismatch;
import com.registry.core.model.RegistryLayout;
import com.registry.core.model.StoragePath;
import com.registry.core.model.VersionId;
import com.registry.core.storage.StorageBackend;
import com.registry.engine.audit.AuditLog;
import com.registry.engine.config.RegistrySettings;
import com.registry.engine.integrity.ManifestCalculator;
import com.registry.engine.logging.LoggingContext;
import com.registry.engine.metrics.RegistryMetrics;
import com.registry.engine.promotion.PromotionEngine;
import com.registry.engine.promotion.PromotionOutcome;
import com.registry.engine.resolve.AliasResolver;
import com.registry.engine.resolve.ResolvedReference;
import com.registry.engine.service.RegistryService;
import com.registry.engine.store.StoredVersion;
import com.registry.engine.store.VersionStore;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Registry coordinator: the single entry point behind {@link RegistryService}.
 * Sequences the version store, resolver and promotion engine, and wraps
 * every operation in a logging context and metrics.
 *
 * Holds no mutable state of its own; everything lives in the storage
 * backend bound at construction.
 */
public class RegistryCoordinator implements RegistryService {

    private static final Logger log = LoggerFactory.getLogger(RegistryCoordinator.class);

    static final String DEFAULT_REGISTRATION_REASON = "set at registration";

    private final StorageBackend backend;
    private final VersionStore versionStore;
    private final AliasResolver aliasResolver;
    private final PromotionEngine promotionEngine;
    private final AuditLog auditLog;
    private final RegistrySettings settings;
    private final RegistryMetrics metrics;

    public RegistryCoordinator(
            StorageBackend backend,
            VersionStore versionStore,
            AliasResolver aliasResolver,
            PromotionEngine promotionEngine,
            AuditLog auditLog,
            RegistrySettings settings,
            RegistryMetrics metrics) {
        this.backend = backend;
        this.versionStore = versionStore;
        this.aliasResolver = aliasResolver;
        this.promotionEngine = promotionEngine;
        this.auditLog = auditLog;
        this.settings = settings;
        this.metrics = metrics;
    }

    /**
     * Wire a coordinator and its components over one backend.
     */
    public static RegistryCoordinator create(
            StorageBackend backend,
            RegistrySettings settings,
            Clock clock,
            RegistryMetrics metrics) {
        ObjectMapper objectMapper = RegistryJson.newObjectMapper();
        VersionStore versionStore = new VersionStore(
            backend, new ManifestCalculator(), objectMapper, clock, settings.requiredFiles());
        AliasResolver aliasResolver = new AliasResolver(backend, objectMapper);
        AuditLog auditLog = new AuditLog(backend, objectMapper, settings.lockTimeout());
        PromotionEngine promotionEngine = new PromotionEngine(
            backend, versionStore, aliasResolver, auditLog, objectMapper, clock,
            settings.lockTimeout(), settings.auditRetryPolicy());
        return new RegistryCoordinator(
            backend, versionStore, aliasResolver, promotionEngine, auditLog, settings, metrics);
    }

    @Override
    public RegistrationResult register(RegisterRequest request) {
        try (var ctx = LoggingContext.forVersion(request.task(), request.model(), request.version())) {
            Timer.Sample sample = metrics.startTimer();
            String outcome = RegistryMetrics.OUTCOME_SUCCESS;
            try {
                log.info("Registering version {}/{}/{} by {}",
                    request.task(), request.model(), request.version(), request.actor());

                VersionId id = VersionId.of(request.task(), request.model(), request.version());
                String alias = blankToNull(request.setAlias());
                if (alias != null) {
                    // Reject a bad alias before anything is committed
                    Identifiers.requireValid("setAlias", alias);
                }

                StoredVersion stored = versionStore.register(
                    id,
                    request.artifacts(),
                    request.metadata(),
                    request.metrics(),
                    request.featureSchema(),
                    request.actor()
                );

                PromotionResult aliasSet = null;
                if (alias != null) {
                    String reason = request.reason() != null ? request.reason() : DEFAULT_REGISTRATION_REASON;
                    try {
                        aliasSet = promoteTimed(new PromoteRequest(
                            id.task(), id.model(), alias, id.version(), request.actor(), reason));
                    } catch (RegistryException e) {
                        log.warn("Version {} is committed at {} but alias {} was not set: {}",
                            id, stored.location(), alias, e.getMessage());
                        throw e.withCoordinates(id.task(), id.model(), id.version())
                            .with(RegistryException.CTX_ALIAS, alias)
                            .with(CTX_VERSION_COMMITTED, "true");
                    }
                }

                return new RegistrationResult(id, stored.location(), stored.manifest(), aliasSet);
            } catch (RegistryException e) {
                outcome = outcomeOf(e);
                throw e;
            } finally {
                metrics.registration(tagOf(request.task()), outcome);
                metrics.stopTimer(sample, "register", outcome);
            }
        }
    }

    @Override
    public ResolvedVersion resolve(String task, String ref, boolean verify) {
        try (var ctx = LoggingContext.forTask(task)) {
            Timer.Sample sample = metrics.startTimer();
            String outcome = RegistryMetrics.OUTCOME_SUCCESS;
            try {
                return resolveVerified(task, ref, verify);
            } catch (RegistryException e) {
                outcome = outcomeOf(e);
                throw e;
            } finally {
                metrics.resolution(tagOf(task), outcome);
                metrics.stopTimer(sample, "resolve", outcome);
            }
        }
    }

    @Override
    public VersionDetails show(String task, String ref, boolean verify) {
        try (var ctx = LoggingContext.forTask(task)) {
            ResolvedVersion resolved = resolveVerified(task, ref, verify);
            VersionId id = resolved.versionId();
            return new VersionDetails(
                resolved,
                versionStore.readMetadata(id),
                versionStore.readManifest(id),
                versionStore.listFiles(id)
            );
        }
    }

    @Override
    public PromotionResult promote(PromoteRequest request) {
        try (var ctx = LoggingContext.forAlias(request.task(), request.model(), request.alias(), request.actor())) {
            return promoteTimed(request);
        }
    }

    @Override
    public VerificationResult verify(String task, String ref) {
        try (var ctx = LoggingContext.forTask(task)) {
            ResolvedReference resolved = aliasResolver.resolve(task, ref);
            VersionId id = resolved.versionId();
            LoggingContext.setVersion(id.version());

            List<ManifestMismatch> mismatches = versionStore.verify(id);
            if (mismatches.isEmpty()) {
                log.info("Version {} verified", id);
            } else {
                metrics.integrityFailure(id.task(), id.model());
                log.error("Version {} failed verification: {}", id,
                    mismatches.stream().map(ManifestMismatch::describe).toList());
            }
            return new VerificationResult(id, backend.locate(resolved.path()), mismatches.isEmpty(), mismatches);
        }
    }

    @Override
    public List<String> listModels(String task) {
        Identifiers.requireValid("task", task);
        return backend.listChildren(RegistryLayout.modelsRoot(task));
    }

    @Override
    public List<String> listVersions(String task, String model) {
        requireModel(task, model);
        return versionStore.listVersions(task, model);
    }

    @Override
    public List<AliasPointer> listAliases(String task, String model) {
        requireModel(task, model);
        return aliasResolver.listAliases(task, model);
    }

    @Override
    public List<AuditEntry> auditTrail(String task, String model) {
        requireModel(task, model);
        return auditLog.readAll(task, model);
    }

    @Override
    public RegistryStatus status() {
        String root = backend.locate(StoragePath.root());
        try {
            backend.listChildren(RegistryLayout.tasksRoot());
            return new RegistryStatus(backend.kind(), root, true, "ok");
        } catch (StorageException e) {
            log.warn("Storage backend {} at {} is unavailable: {}", backend.kind(), root, e.getMessage());
            return new RegistryStatus(backend.kind(), root, false, e.getMessage());
        }
    }

    public RegistrySettings settings() {
        return settings;
    }

    // ========== Internals ==========

    private ResolvedVersion resolveVerified(String task, String ref, boolean verify) {
        ResolvedReference resolved = aliasResolver.resolve(task, ref);
        VersionId id = resolved.versionId();
        LoggingContext.setVersion(id.version());

        ManifestStatus status = ManifestStatus.NOT_CHECKED;
        if (verify || settings.strictVerify()) {
            List<ManifestMismatch> mismatches = versionStore.verify(id);
            if (!mismatches.isEmpty()) {
                metrics.integrityFailure(id.task(), id.model());
                log.error("Refusing to resolve {} to corrupted version {}", ref, id);
                throw new IntegrityException(id.toString(), mismatches)
                    .withCoordinates(id.task(), id.model(), id.version());
            }
            status = ManifestStatus.VERIFIED;
        }
        log.debug("Resolved {} in task {} to {} ({})", ref, task, id.version(), status);
        return new ResolvedVersion(id, backend.locate(resolved.path()), resolved.alias(), status);
    }

    private PromotionResult promoteTimed(PromoteRequest request) {
        Timer.Sample sample = metrics.startTimer();
        String outcome = RegistryMetrics.OUTCOME_SUCCESS;
        metrics.promotionStarted();
        try {
            PromotionOutcome promoted = promotionEngine.promote(
                request.task(),
                request.model(),
                request.alias(),
                request.version(),
                request.actor(),
                request.reason()
            );
            return new PromotionResult(
                promoted.alias(),
                promoted.previous(),
                promoted.target().version(),
                promoted.auditEntry()
            );
        } catch (RegistryException e) {
            outcome = outcomeOf(e);
            throw e;
        } finally {
            metrics.promotionFinished();
            metrics.promotion(tagOf(request.task()), tagOf(request.alias()), outcome);
            metrics.stopTimer(sample, "promote", outcome);
        }
    }

    private void requireModel(String task, String model) {
        Identifiers.requireValid("task", task);
        Identifiers.requireValid("model", model);
        if (!backend.exists(RegistryLayout.modelRoot(task, model))) {
            throw new NotFoundException("Model", task + "/" + model)
                .withCoordinates(task, model, null);
        }
    }

    private static String outcomeOf(RegistryException e) {
        return e.getErrorCode().toLowerCase(Locale.ROOT);
    }

    // Tags must not carry arbitrary caller input
    private static String tagOf(String identifier) {
        return Identifiers.isValid(identifier) ? identifier : "invalid";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
