package com.registry.engine.storage;

import com.registry.core.model.StoragePath;
import com.registry.core.storage.StorageBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class LocalFilesystemStorageBackendTest extends StorageBackendContract {

    @TempDir
    Path root;

    @Override
    protected StorageBackend createBackend() {
        return new LocalFilesystemStorageBackend(root);
    }

    @Test
    @DisplayName("Files land under the root following the path segments")
    void layoutOnDisk() {
        backend.writeNew(StoragePath.of("tasks/t/models/m/file.txt"), bytes("x"));

        assertThat(root.resolve("tasks/t/models/m/file.txt")).hasContent("x");
        assertThat(backend.locate(StoragePath.of("tasks/t"))).isEqualTo(root.resolve("tasks/t").toAbsolutePath().toString());
    }

    @Test
    @DisplayName("writeAtomic leaves no temp files behind")
    void noTempFiles() throws Exception {
        StoragePath path = StoragePath.of("aliases/prod.json");
        for (int i = 0; i < 5; i++) {
            backend.writeAtomic(path, bytes("v" + i));
        }

        try (Stream<Path> files = Files.list(root.resolve("aliases"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("prod.json");
        }
    }

    @Test
    @DisplayName("Paths cannot escape the root")
    void rejectsTraversal() {
        assertThatThrownBy(() -> backend.readAll(StoragePath.of("tasks/../../etc/passwd")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
