package com.registry.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoragePathTest {

    @Test
    void resolve_shouldSplitSlashSeparatedParts() {
        StoragePath path = StoragePath.of("tasks", "ct/models").resolve("pbmc");

        assertEquals(List.of("tasks", "ct", "models", "pbmc"), path.segments());
        assertEquals("tasks/ct/models/pbmc", path.toString());
        assertEquals("pbmc", path.name());
    }

    @Test
    void parent_ofRoot_shouldBeRoot() {
        assertTrue(StoragePath.root().parent().isRoot());
        assertEquals(StoragePath.of("a"), StoragePath.of("a", "b").parent());
    }

    @Test
    void relativeTo_shouldJoinRemainingSegments() {
        StoragePath version = RegistryLayout.versionPath(new VersionId("ct", "pbmc", "v1"));
        StoragePath file = version.resolve("tokenizer/vocab.txt");

        assertTrue(file.startsWith(version));
        assertEquals("tokenizer/vocab.txt", file.relativeTo(version));
        assertThrows(IllegalArgumentException.class, () -> version.relativeTo(file));
    }

    @Test
    void layout_shouldFollowRegistryDirectoryConvention() {
        assertEquals("tasks/ct/models/pbmc/versions/v1",
            RegistryLayout.versionPath(new VersionId("ct", "pbmc", "v1")).toString());
        assertEquals("tasks/ct/models/pbmc/aliases/production.json",
            RegistryLayout.aliasPath("ct", "pbmc", "production").toString());
        assertEquals("tasks/ct/models/pbmc/audit/promotions.jsonl",
            RegistryLayout.auditLogPath("ct", "pbmc").toString());
    }
}
