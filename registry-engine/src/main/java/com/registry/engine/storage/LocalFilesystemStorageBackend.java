package com.registry.engine.storage;

import com.registry.core.exception.AlreadyExistsException;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.StorageException;
import com.registry.core.model.StoragePath;
import com.registry.core.storage.ContentSource;
import com.registry.core.storage.StorageBackend;
import com.registry.core.storage.StorageLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Storage backend over a local POSIX filesystem.
 *
 * Guarantees:
 * - directory commit is a single {@code rename(2)}, which fails if the target exists
 * - atomic writes go through a temp file in the same directory and a rename
 * - appends are one write on an {@code O_APPEND} channel under an exclusive file lock;
 *   a failed append is truncated away before the error is reported
 * - locks combine a JVM lock table (FileLock is per process) with {@link FileLock};
 *   they are not reentrant
 *
 * Does not fsync; see {@link SharedFilesystemStorageBackend} for durability.
 */
public class LocalFilesystemStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalFilesystemStorageBackend.class);

    private static final long LOCK_POLL_MILLIS = 10;

    private final Path root;
    private final Map<String, Semaphore> jvmLocks = new ConcurrentHashMap<>();

    public LocalFilesystemStorageBackend(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageException("init", this.root.toString(), e);
        }
        log.info("Using {} storage at {}", kind(), this.root);
    }

    @Override
    public String kind() {
        return "local";
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean exists(StoragePath path) {
        Path file = toFile(path);
        return io("exists", path, () -> Files.exists(file));
    }

    @Override
    public byte[] readAll(StoragePath path) {
        Path file = toFile(path);
        return io("read", path, () -> {
            try {
                return Files.readAllBytes(file);
            } catch (NoSuchFileException e) {
                throw new NotFoundException("Path", path.toString());
            }
        });
    }

    @Override
    public InputStream openRead(StoragePath path) {
        Path file = toFile(path);
        return io("read", path, () -> {
            try {
                return Files.newInputStream(file);
            } catch (NoSuchFileException e) {
                throw new NotFoundException("Path", path.toString());
            }
        });
    }

    @Override
    public void writeNew(StoragePath path, ContentSource content) {
        Path file = toFile(path);
        io("writeNew", path, () -> {
            Files.createDirectories(file.getParent());
            FileChannel channel;
            try {
                channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (FileAlreadyExistsException e) {
                throw new AlreadyExistsException("Path", path.toString());
            }
            try (channel; InputStream in = content.open()) {
                // The wrapper is not closed; closing it would close the channel before the sync
                in.transferTo(Channels.newOutputStream(channel));
                syncFile(channel);
            } catch (IOException e) {
                // We created the file, so a half-written one is ours to remove
                deleteAfterFailure(file, e);
                throw e;
            }
            return null;
        });
    }

    @Override
    public void writeAtomic(StoragePath path, byte[] content) {
        Path file = toFile(path);
        Path dir = file.getParent();
        io("writeAtomic", path, () -> {
            Files.createDirectories(dir);
            Path temp = dir.resolve("." + file.getFileName() + "." + UUID.randomUUID() + ".tmp");
            try {
                try (FileChannel channel = FileChannel.open(temp,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                    writeFully(channel, content);
                    syncFile(channel);
                }
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                deleteAfterFailure(temp, e);
                throw e;
            }
            return null;
        });
        io("syncDirectory", path.parent(), () -> {
            syncDirectory(dir);
            return null;
        });
    }

    @Override
    public void append(StoragePath path, byte[] content) {
        Path file = toFile(path);
        Semaphore jvmLock = jvmLock(file);
        jvmLock.acquireUninterruptibly();
        try {
            io("append", path, () -> {
                Files.createDirectories(file.getParent());
                try (FileChannel channel = FileChannel.open(file,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
                     FileLock ignored = channel.lock()) {
                    long sizeBefore = channel.size();
                    try {
                        writeFully(channel, content);
                        syncFile(channel);
                    } catch (IOException e) {
                        truncateAfterFailure(channel, sizeBefore, path, e);
                        throw e;
                    }
                }
                return null;
            });
        } finally {
            jvmLock.release();
        }
    }

    @Override
    public List<String> listChildren(StoragePath path) {
        Path dir = toFile(path);
        return io("list", path, () -> {
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            try (Stream<Path> children = Files.list(dir)) {
                return children
                    .map(child -> child.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .toList();
            } catch (NoSuchFileException e) {
                return List.of();
            }
        });
    }

    @Override
    public void commitDirectory(StoragePath stagingPath, StoragePath finalPath) {
        Path staging = toFile(stagingPath);
        Path target = toFile(finalPath);
        io("commit", finalPath, () -> {
            if (!Files.isDirectory(staging)) {
                throw new NotFoundException("Staging area", stagingPath.toString());
            }
            if (Files.exists(target)) {
                throw new AlreadyExistsException("Path", finalPath.toString());
            }
            Files.createDirectories(target.getParent());
            try {
                // rename(2) refuses a non-empty target, so a concurrent committer loses here
                Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (FileAlreadyExistsException | DirectoryNotEmptyException e) {
                throw new AlreadyExistsException("Path", finalPath.toString());
            } catch (IOException e) {
                // ENOTEMPTY surfaces as a plain FileSystemException
                if (Files.exists(target) && Files.isDirectory(staging)) {
                    throw new AlreadyExistsException("Path", finalPath.toString());
                }
                throw e;
            }
            return null;
        });
        io("syncDirectory", finalPath.parent(), () -> {
            syncDirectory(target.getParent());
            return null;
        });
        log.debug("Committed {} -> {}", stagingPath, finalPath);
    }

    @Override
    public void discard(StoragePath stagingPath) {
        Path staging = toFile(stagingPath);
        io("discard", stagingPath, () -> {
            if (!Files.exists(staging)) {
                return null;
            }
            try (Stream<Path> walk = Files.walk(staging)) {
                for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(p);
                }
            }
            return null;
        });
    }

    @Override
    public StorageLock lock(StoragePath lockPath, Duration timeout) {
        Path file = toFile(lockPath);
        long deadline = System.nanoTime() + timeout.toNanos();
        Semaphore jvmLock = jvmLock(file);
        boolean acquired;
        try {
            acquired = jvmLock.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for lock " + lockPath, e);
        }
        if (!acquired) {
            throw lockTimeout(lockPath, timeout);
        }
        try {
            FileChannel channel = io("lock", lockPath, () -> {
                Files.createDirectories(file.getParent());
                return FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            });
            FileLock fileLock = acquireFileLock(channel, lockPath, timeout, deadline);
            return new FileStorageLock(lockPath, jvmLock, channel, fileLock);
        } catch (RuntimeException e) {
            jvmLock.release();
            throw e;
        }
    }

    @Override
    public String locate(StoragePath path) {
        return toFile(path).toString();
    }

    /**
     * Run one filesystem operation, translating {@link IOException} into
     * {@link StorageException}. Registry exceptions thrown by the action pass through.
     */
    protected <T> T io(String operation, StoragePath path, IoAction<T> action) {
        try {
            return action.run();
        } catch (IOException e) {
            throw new StorageException(operation, locate(path), e);
        }
    }

    /**
     * Flush file content to the medium before it is published. No-op locally.
     */
    protected void syncFile(FileChannel channel) throws IOException {
    }

    /**
     * Flush directory entries after a rename. No-op locally.
     */
    protected void syncDirectory(Path dir) throws IOException {
    }

    protected Path toFile(StoragePath path) {
        Path file = root;
        for (String segment : path.segments()) {
            if (segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Path escapes the storage root: " + path);
            }
            file = file.resolve(segment);
        }
        return file;
    }

    private FileLock acquireFileLock(FileChannel channel, StoragePath lockPath, Duration timeout, long deadline) {
        try {
            while (true) {
                FileLock fileLock = io("lock", lockPath, channel::tryLock);
                if (fileLock != null) {
                    return fileLock;
                }
                if (System.nanoTime() >= deadline) {
                    throw lockTimeout(lockPath, timeout);
                }
                Thread.sleep(LOCK_POLL_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeAfterFailure(channel, lockPath);
            throw new StorageException("Interrupted while waiting for lock " + lockPath, e);
        } catch (RuntimeException e) {
            closeAfterFailure(channel, lockPath);
            throw e;
        }
    }

    private StorageException lockTimeout(StoragePath lockPath, Duration timeout) {
        return (StorageException) new StorageException(
            "Timed out after " + timeout.toMillis() + " ms waiting for lock " + lockPath
        ).with(StorageException.CTX_PATH, locate(lockPath));
    }

    private Semaphore jvmLock(Path file) {
        return jvmLocks.computeIfAbsent(file.toString(), k -> new Semaphore(1));
    }

    private static void writeFully(FileChannel channel, byte[] content) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(content);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    /**
     * Cut a failed append back to the previous end of file so a retry cannot
     * leave the same bytes twice. If that fails too the error is final.
     */
    private void truncateAfterFailure(FileChannel channel, long size, StoragePath path, IOException failure) {
        try {
            channel.truncate(size);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
            log.error("Could not undo a failed append to {}; the file may end with a partial write", path);
            throw new StorageException("append", locate(path), failure);
        }
    }

    private static void deleteAfterFailure(Path file, IOException failure) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }

    private static void closeAfterFailure(FileChannel channel, StoragePath lockPath) {
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock file {}: {}", lockPath, e.getMessage());
        }
    }

    @FunctionalInterface
    protected interface IoAction<T> {
        T run() throws IOException;
    }

    private static final class FileStorageLock implements StorageLock {

        private final StoragePath lockPath;
        private final Semaphore jvmLock;
        private final FileChannel channel;
        private final FileLock fileLock;
        private final AtomicBoolean released = new AtomicBoolean();

        FileStorageLock(StoragePath lockPath, Semaphore jvmLock, FileChannel channel, FileLock fileLock) {
            this.lockPath = lockPath;
            this.jvmLock = jvmLock;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                fileLock.release();
                channel.close();
            } catch (IOException e) {
                // Closing the channel releases the OS lock in any case
                log.warn("Failed to release lock {} cleanly: {}", lockPath, e.getMessage());
            } finally {
                jvmLock.release();
            }
        }
    }
}
