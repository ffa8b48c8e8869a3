package com.registry.engine.storage;

import com.registry.core.exception.StorageException;
import com.registry.core.model.RetryPolicy;
import com.registry.core.model.StoragePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * Storage backend for shared network filesystems (NFS, Lustre, GPFS).
 *
 * Same layout and commit protocol as {@link LocalFilesystemStorageBackend}, plus:
 * - file content is fsynced before it is renamed or published
 * - parent directories are fsynced after renames so commits survive a client crash
 * - transient I/O errors are retried with exponential backoff
 *
 * Outcomes that are answers rather than failures (missing file, existing
 * target) are never retried.
 */
public class SharedFilesystemStorageBackend extends LocalFilesystemStorageBackend {

    private static final Logger log = LoggerFactory.getLogger(SharedFilesystemStorageBackend.class);

    private final RetryPolicy retryPolicy;

    public SharedFilesystemStorageBackend(Path root, RetryPolicy retryPolicy) {
        super(root);
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String kind() {
        return "shared";
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    protected <T> T io(String operation, StoragePath path, IoAction<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.run();
            } catch (IOException e) {
                if (!retryPolicy.hasMoreAttempts(attempt)) {
                    throw new StorageException(operation, locate(path), e);
                }
                Duration backoff = retryPolicy.computeBackoff(attempt);
                log.warn("Transient I/O failure during {} on {} (attempt {}/{}), retrying in {} ms: {}",
                    operation, path, attempt, retryPolicy.maxAttempts(), backoff.toMillis(), e.toString());
                sleep(backoff, operation, path, e);
                attempt++;
            }
        }
    }

    @Override
    protected void syncFile(FileChannel channel) throws IOException {
        channel.force(true);
    }

    @Override
    protected void syncDirectory(Path dir) throws IOException {
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        }
    }

    private void sleep(Duration backoff, String operation, StoragePath path, IOException cause) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            StorageException interrupted = new StorageException(operation, locate(path), cause);
            interrupted.addSuppressed(e);
            throw interrupted;
        }
    }
}
