package com.registry.core.model;

/**
 * Storage path conventions, identical across all backends:
 *
 * <pre>
 * tasks/&lt;task&gt;/models/&lt;model&gt;/
 *   versions/&lt;version&gt;/       artifacts, manifest.sha256, metadata.json
 *   aliases/&lt;alias&gt;.json
 *   audit/promotions.jsonl
 *   .staging/                 uncommitted registrations
 *   .locks/                   advisory lock files
 * </pre>
 */
public final class RegistryLayout {

    public static final String TASKS = "tasks";
    public static final String MODELS = "models";
    public static final String VERSIONS = "versions";
    public static final String ALIASES = "aliases";
    public static final String AUDIT = "audit";
    public static final String PROMOTIONS_LOG = "promotions.jsonl";
    public static final String STAGING = ".staging";
    public static final String LOCKS = ".locks";

    public static final String METRICS_FILE = "metrics.json";
    public static final String FEATURE_SCHEMA_FILE = "feature_schema.json";

    private RegistryLayout() {
    }

    public static StoragePath tasksRoot() {
        return StoragePath.of(TASKS);
    }

    public static StoragePath modelsRoot(String task) {
        return tasksRoot().resolve(task, MODELS);
    }

    public static StoragePath modelRoot(String task, String model) {
        return modelsRoot(task).resolve(model);
    }

    public static StoragePath versionsRoot(String task, String model) {
        return modelRoot(task, model).resolve(VERSIONS);
    }

    public static StoragePath versionPath(VersionId id) {
        return versionsRoot(id.task(), id.model()).resolve(id.version());
    }

    public static StoragePath aliasesRoot(String task, String model) {
        return modelRoot(task, model).resolve(ALIASES);
    }

    public static StoragePath aliasPath(String task, String model, String alias) {
        return aliasesRoot(task, model).resolve(AliasPointer.fileName(alias));
    }

    public static StoragePath auditLogPath(String task, String model) {
        return modelRoot(task, model).resolve(AUDIT, PROMOTIONS_LOG);
    }

    public static StoragePath stagingPath(String task, String model, String stagingId) {
        return modelRoot(task, model).resolve(STAGING, stagingId);
    }

    public static StoragePath aliasLockPath(String task, String model, String alias) {
        return modelRoot(task, model).resolve(LOCKS, "alias-" + alias + ".lock");
    }

    public static StoragePath auditLockPath(String task, String model) {
        return modelRoot(task, model).resolve(LOCKS, "audit.lock");
    }

    /**
     * Whether a file name is written by the registry itself and may not be
     * supplied as an artifact.
     */
    public static boolean isReservedFileName(String fileName) {
        return Manifest.FILE_NAME.equals(fileName)
            || VersionMetadata.FILE_NAME.equals(fileName);
    }
}
