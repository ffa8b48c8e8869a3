package com.registry.core.model;

/**
 * Fully qualified coordinates of a version: (task, model, version).
 */
public record VersionId(String task, String model, String version) {

    /**
     * Create validated coordinates.
     */
    public static VersionId of(String task, String model, String version) {
        return new VersionId(
            Identifiers.requireValid("task", task),
            Identifiers.requireValid("model", model),
            Identifiers.requireValid("version", version)
        );
    }

    /**
     * Reference string that resolves to exactly this version.
     */
    public String toRef() {
        return model + ModelRef.SEPARATOR + version;
    }

    @Override
    public String toString() {
        return task + "/" + model + "/" + version;
    }
}
