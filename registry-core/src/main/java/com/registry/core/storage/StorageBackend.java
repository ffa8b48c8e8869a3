package com.registry.core.storage;

import com.registry.core.model.StoragePath;

import java.io.InputStream;
import java.time.Duration;
import java.util.List;

/**
 * Byte-oriented store over a hierarchical namespace.
 * Every registry invariant (immutability, no partial versions, no torn
 * alias files) reduces to the atomicity guarantees of this contract.
 *
 * Names beginning with '.' are reserved for bookkeeping (staging areas,
 * temporary files, lock files) and are never returned by
 * {@link #listChildren(StoragePath)}.
 *
 * Failures of the underlying medium surface as
 * {@link com.registry.core.exception.StorageException}.
 */
public interface StorageBackend {

    /**
     * Short name of the backend kind, e.g. {@code local}.
     */
    String kind();

    /**
     * Check whether a file or directory exists at the path.
     * For committed directories this is the existence signal of the commit.
     */
    boolean exists(StoragePath path);

    /**
     * Read the complete content of a file.
     *
     * @throws com.registry.core.exception.NotFoundException if nothing is stored at the path
     */
    byte[] readAll(StoragePath path);

    /**
     * Open a file for streaming reads. The caller closes the stream.
     *
     * @throws com.registry.core.exception.NotFoundException if nothing is stored at the path
     */
    InputStream openRead(StoragePath path);

    /**
     * Write a file that must not exist yet, copying it from the source. Never overwrites.
     * The source may be opened more than once when the write is retried.
     *
     * @throws com.registry.core.exception.AlreadyExistsException if the path already holds content
     */
    void writeNew(StoragePath path, ContentSource content);

    default void writeNew(StoragePath path, byte[] content) {
        writeNew(path, ContentSource.of(content));
    }

    /**
     * Replace a file so that readers observe either the old or the new
     * content in full, never a partial write.
     */
    void writeAtomic(StoragePath path, byte[] content);

    /**
     * Append bytes to a file, creating it if absent, as a single write that
     * never interleaves with concurrent appends. A failed append leaves the
     * file as it was, or reports that it could not restore it.
     */
    void append(StoragePath path, byte[] content);

    /**
     * List the names of the direct children of a directory.
     *
     * @return Names in ascending order; empty if the path does not exist or is a file
     */
    List<String> listChildren(StoragePath path);

    /**
     * Atomically make a fully written staging area visible at its final path.
     * Either every file becomes visible at once or nothing does.
     *
     * @throws com.registry.core.exception.AlreadyExistsException if the final path already exists
     * @throws com.registry.core.exception.NotFoundException if the staging area does not exist
     */
    void commitDirectory(StoragePath stagingPath, StoragePath finalPath);

    /**
     * Remove an uncommitted staging area. Absent paths are ignored.
     */
    void discard(StoragePath stagingPath);

    /**
     * Acquire an advisory lock scoped to the path, waiting at most {@code timeout}.
     * Exclusive across threads, and across processes where the medium supports it.
     *
     * @throws com.registry.core.exception.StorageException if the lock is not acquired in time
     */
    StorageLock lock(StoragePath lockPath, Duration timeout);

    /**
     * External locator of a path, e.g. an absolute filesystem path or object URI.
     */
    String locate(StoragePath path);
}
