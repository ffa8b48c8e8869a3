package com.registry.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.core.exception.AlreadyExistsException;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.RegistryException;
import com.registry.core.exception.RegistryValidationException;
import com.registry.core.exception.StorageException;
import com.registry.core.model.ArtifactSet;
import com.registry.core.model.Manifest;
import com.registry.core.model.ManifestMismatch;
import com.registry.core.model.RegistryLayout;
import com.registry.core.model.StoragePath;
import com.registry.core.model.VersionId;
import com.registry.core.model.VersionMetadata;
import com.registry.core.storage.ContentSource;
import com.registry.core.storage.StorageBackend;
import com.registry.engine.integrity.ManifestCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Write-once store of versions.
 *
 * A registration stages every file under {@code .staging/<version>-<uuid>}
 * and publishes it with one atomic directory commit, so a version is either
 * complete and verifiable or invisible. Committed versions are never
 * modified or deleted.
 */
public class VersionStore {

    private static final Logger log = LoggerFactory.getLogger(VersionStore.class);

    private final StorageBackend backend;
    private final ManifestCalculator manifestCalculator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final List<String> requiredFiles;

    public VersionStore(
            StorageBackend backend,
            ManifestCalculator manifestCalculator,
            ObjectMapper objectMapper,
            Clock clock,
            Collection<String> requiredFiles) {
        this.backend = backend;
        this.manifestCalculator = manifestCalculator;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.requiredFiles = List.copyOf(requiredFiles);
    }

    /**
     * Register a new immutable version.
     *
     * @param id Coordinates of the new version
     * @param artifacts Artifact files; must not use reserved names
     * @param metadata Caller-supplied provenance; identity fields are overwritten
     * @param metrics Optional content of {@code metrics.json}
     * @param featureSchema Optional content of {@code feature_schema.json}
     * @param actor Who registers the version
     * @throws RegistryValidationException on invalid input
     * @throws AlreadyExistsException if the version exists, also when the content is identical
     * @throws StorageException if the backend fails; nothing becomes visible
     */
    public StoredVersion register(
            VersionId id,
            ArtifactSet artifacts,
            VersionMetadata metadata,
            JsonNode metrics,
            JsonNode featureSchema,
            String actor) {
        if (artifacts == null || artifacts.isEmpty()) {
            throw new RegistryValidationException("artifacts", "at least one artifact file is required");
        }
        if (actor == null || actor.isBlank()) {
            throw new RegistryValidationException("actor", "cannot be empty");
        }
        for (String name : artifacts.fileNames()) {
            if (RegistryLayout.isReservedFileName(name)) {
                throw new RegistryValidationException("artifacts",
                    name + " is written by the registry and cannot be supplied");
            }
        }

        StoragePath finalPath = RegistryLayout.versionPath(id);
        if (backend.exists(finalPath)) {
            throw alreadyExists(id);
        }

        Instant registeredAt = clock.instant();
        VersionMetadata stamped = (metadata == null ? VersionMetadata.empty() : metadata)
            .withRegistration(id, registeredAt, actor);

        SortedMap<String, ContentSource> files = new TreeMap<>(artifacts.asMap());
        putDerived(files, RegistryLayout.METRICS_FILE, metrics);
        putDerived(files, RegistryLayout.FEATURE_SCHEMA_FILE, featureSchema);
        files.put(VersionMetadata.FILE_NAME, ContentSource.of(toJson(stamped)));
        requireFiles(files);

        Manifest manifest = manifestCalculator.computeManifest(files);
        StoragePath staging = RegistryLayout.stagingPath(
            id.task(), id.model(), id.version() + "-" + UUID.randomUUID());

        try {
            files.forEach((name, content) -> backend.writeNew(staging.resolve(name), content));
            backend.writeNew(staging.resolve(Manifest.FILE_NAME), manifest.toBytes());
            backend.commitDirectory(staging, finalPath);
        } catch (AlreadyExistsException e) {
            // Lost the race against a concurrent registration of the same version
            RegistryException duplicate = alreadyExists(id);
            duplicate.initCause(e);
            discardStaging(staging, duplicate);
            throw duplicate;
        } catch (RuntimeException e) {
            discardStaging(staging, e);
            throw e;
        }

        log.info("Registered version {} with {} files at {}", id, manifest.size(), backend.locate(finalPath));
        return new StoredVersion(id, finalPath, backend.locate(finalPath), manifest, stamped);
    }

    public boolean exists(VersionId id) {
        return backend.exists(RegistryLayout.versionPath(id));
    }

    /**
     * Path of a committed version.
     *
     * @throws NotFoundException if the version does not exist
     */
    public StoragePath getVersionPath(VersionId id) {
        StoragePath path = RegistryLayout.versionPath(id);
        if (!backend.exists(path)) {
            throw (NotFoundException) new NotFoundException("Version", id.toString())
                .withCoordinates(id.task(), id.model(), id.version());
        }
        return path;
    }

    /**
     * Re-hash every stored file of a version and compare with its manifest.
     *
     * @return Mismatches; empty when the version is intact
     * @throws NotFoundException if the version does not exist
     */
    public List<ManifestMismatch> verify(VersionId id) {
        StoragePath path = getVersionPath(id);
        SortedMap<String, ContentSource> stored = readTree(path);
        if (stored.remove(Manifest.FILE_NAME) == null) {
            return List.of(ManifestMismatch.unreadableManifest(Manifest.FILE_NAME + " is missing"));
        }
        Manifest manifest;
        try {
            manifest = Manifest.parse(backend.readAll(path.resolve(Manifest.FILE_NAME)));
        } catch (IllegalArgumentException e) {
            return List.of(ManifestMismatch.unreadableManifest(e.getMessage()));
        }
        List<ManifestMismatch> mismatches = manifestCalculator.verifyManifest(stored, manifest);
        if (!mismatches.isEmpty()) {
            log.warn("Version {} failed verification with {} mismatches", id, mismatches.size());
        }
        return mismatches;
    }

    /**
     * Manifest as stored with the version.
     *
     * @throws StorageException if the stored manifest is not parseable
     */
    public Manifest readManifest(VersionId id) {
        byte[] bytes = backend.readAll(getVersionPath(id).resolve(Manifest.FILE_NAME));
        try {
            return Manifest.parse(bytes);
        } catch (IllegalArgumentException e) {
            throw (StorageException) new StorageException("Unreadable manifest of " + id, e)
                .withCoordinates(id.task(), id.model(), id.version());
        }
    }

    public VersionMetadata readMetadata(VersionId id) {
        byte[] bytes = backend.readAll(getVersionPath(id).resolve(VersionMetadata.FILE_NAME));
        try {
            return objectMapper.readValue(bytes, VersionMetadata.class);
        } catch (IOException e) {
            throw (StorageException) new StorageException("Unreadable metadata of " + id, e)
                .withCoordinates(id.task(), id.model(), id.version());
        }
    }

    /**
     * Relative names of every file stored with a version, manifest included.
     */
    public List<String> listFiles(VersionId id) {
        return new ArrayList<>(readTree(getVersionPath(id)).keySet());
    }

    /**
     * Committed version identifiers of a model, in ascending name order.
     */
    public List<String> listVersions(String task, String model) {
        return backend.listChildren(RegistryLayout.versionsRoot(task, model));
    }

    private SortedMap<String, ContentSource> readTree(StoragePath root) {
        SortedMap<String, ContentSource> files = new TreeMap<>();
        collect(root, root, files);
        return files;
    }

    private void collect(StoragePath root, StoragePath dir, SortedMap<String, ContentSource> files) {
        for (String name : backend.listChildren(dir)) {
            StoragePath child = dir.resolve(name);
            List<String> grandChildren = backend.listChildren(child);
            if (grandChildren.isEmpty()) {
                files.put(child.relativeTo(root), () -> backend.openRead(child));
            } else {
                collect(root, child, files);
            }
        }
    }

    private void putDerived(SortedMap<String, ContentSource> files, String fileName, JsonNode content) {
        if (content == null || content.isNull()) {
            return;
        }
        if (files.containsKey(fileName)) {
            throw new RegistryValidationException("artifacts",
                fileName + " supplied both as an artifact and as derived metadata");
        }
        files.put(fileName, ContentSource.of(toJson(content)));
    }

    private void requireFiles(SortedMap<String, ContentSource> files) {
        List<String> missing = requiredFiles.stream()
            .filter(name -> !files.containsKey(name))
            .toList();
        if (!missing.isEmpty()) {
            throw new RegistryValidationException("artifacts", "missing required files " + missing);
        }
    }

    private byte[] toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new RegistryValidationException("metadata", "not serializable: " + e.getOriginalMessage());
        }
    }

    private void discardStaging(StoragePath staging, RuntimeException failure) {
        try {
            backend.discard(staging);
        } catch (RuntimeException cleanup) {
            log.warn("Failed to discard staging area {}: {}", staging, cleanup.getMessage());
            failure.addSuppressed(cleanup);
        }
    }

    private static RegistryException alreadyExists(VersionId id) {
        return new AlreadyExistsException("Version", id.toString())
            .withCoordinates(id.task(), id.model(), id.version());
    }
}
