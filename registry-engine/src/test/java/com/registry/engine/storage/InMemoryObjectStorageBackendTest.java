package com.registry.engine.storage;

import com.registry.core.exception.StorageException;
import com.registry.core.model.StoragePath;
import com.registry.core.storage.StorageBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InMemoryObjectStorageBackendTest extends StorageBackendContract {

    @Override
    protected StorageBackend createBackend() {
        return new InMemoryObjectStorageBackend("test-bucket");
    }

    @Test
    @DisplayName("A commit writes a single marker object and copies nothing")
    void commitIsOneConditionalPut() {
        InMemoryObjectStorageBackend store = (InMemoryObjectStorageBackend) backend;
        StoragePath staging = StoragePath.of("m/.staging/s1");
        store.writeNew(staging.resolve("a"), bytes("1"));
        store.writeNew(staging.resolve("b"), bytes("2"));
        int before = store.objectCount();

        store.commitDirectory(staging, StoragePath.of("m/versions/v1"));

        assertThat(store.objectCount()).isEqualTo(before + 1);
    }

    @Test
    @DisplayName("Committed objects cannot be discarded through their staging prefix")
    void refusesToDiscardCommitted() {
        StoragePath staging = StoragePath.of("m/.staging/s1");
        backend.writeNew(staging.resolve("a"), bytes("1"));
        backend.commitDirectory(staging, StoragePath.of("m/versions/v1"));

        assertThatThrownBy(() -> backend.discard(staging)).isInstanceOf(StorageException.class);
        assertThat(backend.readAll(StoragePath.of("m/versions/v1/a"))).isEqualTo(bytes("1"));
    }

    @Test
    @DisplayName("Locators use the memory scheme and bucket")
    void locate() {
        assertThat(backend.locate(StoragePath.of("tasks/t"))).isEqualTo("memory://test-bucket/tasks/t");
    }
}
