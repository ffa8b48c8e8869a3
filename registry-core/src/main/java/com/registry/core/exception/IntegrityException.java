package com.registry.core.exception;

import com.registry.core.model.ManifestMismatch;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when stored bytes no longer match the manifest of a version.
 * Signals tampering or corruption; never tolerated silently.
 */
public class IntegrityException extends RegistryException {

    public static final String ERROR_CODE = "INTEGRITY_FAILED";

    private final List<ManifestMismatch> mismatches;

    public IntegrityException(String versionId, List<ManifestMismatch> mismatches) {
        super(ERROR_CODE, String.format(
            "Integrity check failed for %s: %s",
            versionId,
            mismatches.stream().map(ManifestMismatch::describe).collect(Collectors.joining("; "))
        ));
        this.mismatches = List.copyOf(mismatches);
    }

    public List<ManifestMismatch> getMismatches() {
        return mismatches;
    }
}
