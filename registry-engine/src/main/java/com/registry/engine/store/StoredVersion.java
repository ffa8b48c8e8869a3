package com.registry.engine.store;

import com.registry.core.model.Manifest;
import com.registry.core.model.StoragePath;
import com.registry.core.model.VersionId;
import com.registry.core.model.VersionMetadata;

/**
 * A committed version as written by {@link VersionStore#register}.
 *
 * @param location Backend locator of the version directory
 */
public record StoredVersion(
    VersionId id,
    StoragePath path,
    String location,
    Manifest manifest,
    VersionMetadata metadata
) {
}
