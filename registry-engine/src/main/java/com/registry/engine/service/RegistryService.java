package com.registry.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.registry.core.model.AliasPointer;
import com.registry.core.model.ArtifactSet;
import com.registry.core.model.AuditEntry;
import com.registry.core.model.Manifest;
import com.registry.core.model.ManifestMismatch;
import com.registry.core.model.VersionId;
import com.registry.core.model.VersionMetadata;

import java.util.List;

/**
 * Core service of the artifact registry.
 * Registers immutable versions, resolves references and moves aliases.
 */
public interface RegistryService {

    /**
     * Context key set to {@code "true"} on a registration failure that
     * happened after the version was committed, i.e. while setting its alias.
     */
    String CTX_VERSION_COMMITTED = "versionCommitted";

    /**
     * Register a new immutable version, optionally pointing an alias at it.
     *
     * If the alias cannot be set, the version stays committed and the
     * exception carries {@link #CTX_VERSION_COMMITTED}; a retry would get
     * AlreadyExists, so callers promote instead.
     *
     * @param request The registration request
     * @return Where the version was committed and its manifest
     */
    RegistrationResult register(RegisterRequest request);

    /**
     * Resolve a {@code model} or {@code model@qualifier} reference.
     *
     * @param task The task
     * @param ref The reference
     * @param verify Re-verify the manifest even when strict verification is off
     * @return The resolved version
     */
    ResolvedVersion resolve(String task, String ref, boolean verify);

    /**
     * Resolve a reference and load its metadata, manifest and file list.
     *
     * @param task The task
     * @param ref The reference
     * @param verify Re-verify the manifest even when strict verification is off
     */
    VersionDetails show(String task, String ref, boolean verify);

    /**
     * Point an alias at an existing version and record the move.
     *
     * @param request The promotion request
     * @return Previous and new target of the alias
     */
    PromotionResult promote(PromoteRequest request);

    /**
     * Re-hash a version and compare it with its manifest. Mismatches are
     * reported in the result, not thrown.
     *
     * @param task The task
     * @param ref The reference
     */
    VerificationResult verify(String task, String ref);

    List<String> listModels(String task);

    List<String> listVersions(String task, String model);

    List<AliasPointer> listAliases(String task, String model);

    /**
     * Promotion history of a model, oldest first.
     */
    List<AuditEntry> auditTrail(String task, String model);

    /**
     * Probe the storage backend.
     */
    RegistryStatus status();

    /**
     * Request to register a version.
     */
    record RegisterRequest(
        String task,
        String model,
        String version,
        ArtifactSet artifacts,
        VersionMetadata metadata,
        JsonNode metrics,
        JsonNode featureSchema,
        String actor,
        String setAlias,
        String reason
    ) {}

    record RegistrationResult(
        VersionId versionId,
        String path,
        Manifest manifest,
        PromotionResult aliasSet
    ) {}

    /**
     * Whether the manifest was checked during resolution.
     */
    enum ManifestStatus {
        VERIFIED,
        NOT_CHECKED
    }

    record ResolvedVersion(
        VersionId versionId,
        String path,
        String alias,
        ManifestStatus manifestStatus
    ) {}

    record VersionDetails(
        ResolvedVersion resolved,
        VersionMetadata metadata,
        Manifest manifest,
        List<String> files
    ) {}

    /**
     * Request to move an alias.
     */
    record PromoteRequest(
        String task,
        String model,
        String alias,
        String version,
        String actor,
        String reason
    ) {}

    /**
     * @param previous Former target, or null if the alias was created
     * @param current New target
     */
    record PromotionResult(
        String alias,
        String previous,
        String current,
        AuditEntry auditEntry
    ) {}

    record VerificationResult(
        VersionId versionId,
        String path,
        boolean ok,
        List<ManifestMismatch> mismatches
    ) {}

    record RegistryStatus(
        String backend,
        String root,
        boolean available,
        String detail
    ) {}
}
