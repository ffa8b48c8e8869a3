package com.registry.engine.resolve;

import com.registry.core.model.StoragePath;
import com.registry.core.model.VersionId;

/**
 * Outcome of resolving a reference.
 *
 * @param alias Alias the reference went through, or null for a literal version
 */
public record ResolvedReference(VersionId versionId, StoragePath path, String alias) {

    public boolean viaAlias() {
        return alias != null;
    }
}
