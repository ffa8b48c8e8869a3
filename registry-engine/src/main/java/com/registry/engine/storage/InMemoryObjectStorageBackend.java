package com.registry.engine.storage;

import com.registry.core.exception.AlreadyExistsException;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.StorageException;
import com.registry.core.model.StoragePath;
import com.registry.core.storage.ContentSource;
import com.registry.core.storage.StorageBackend;
import com.registry.core.storage.StorageLock;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory storage backend with object-store semantics.
 *
 * Keys are flat strings; directories exist only as key prefixes. There is
 * no rename, so a directory commit is a conditional put of a commit marker
 * {@code <final>/.commit} whose content is the staged prefix. The marker is
 * written last and is the only existence signal; readers below a committed
 * path are redirected to the staged objects.
 *
 * Keys are kept sorted, so every prefix query is a range lookup.
 *
 * Thread-safe. Suitable for testing and for single-process deployments
 * that do not need durability.
 */
public class InMemoryObjectStorageBackend implements StorageBackend {

    static final String COMMIT_MARKER = ".commit";

    private final String bucket;
    private final ConcurrentNavigableMap<String, byte[]> objects = new ConcurrentSkipListMap<>();
    private final Set<String> committedPrefixes = ConcurrentHashMap.newKeySet();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public InMemoryObjectStorageBackend(String bucket) {
        this.bucket = bucket;
    }

    @Override
    public String kind() {
        return "memory";
    }

    @Override
    public boolean exists(StoragePath path) {
        if (!path.isRoot() && objects.containsKey(markerKey(path))) {
            return true;
        }
        String key = physicalKey(path);
        if (objects.containsKey(key)) {
            return true;
        }
        return hasKeyWithPrefix(prefixOf(key));
    }

    @Override
    public byte[] readAll(StoragePath path) {
        byte[] content = objects.get(physicalKey(path));
        if (content == null) {
            throw new NotFoundException("Object", locate(path));
        }
        return content.clone();
    }

    @Override
    public InputStream openRead(StoragePath path) {
        byte[] content = objects.get(physicalKey(path));
        if (content == null) {
            throw new NotFoundException("Object", locate(path));
        }
        // Stored arrays are never mutated in place
        return new ByteArrayInputStream(content);
    }

    @Override
    public void writeNew(StoragePath path, ContentSource content) {
        String key = physicalKey(path);
        if (objects.containsKey(key)) {
            throw new AlreadyExistsException("Object", locate(path));
        }
        byte[] bytes;
        try (InputStream in = content.open()) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            throw new StorageException("writeNew", locate(path), e);
        }
        if (objects.putIfAbsent(key, bytes) != null) {
            throw new AlreadyExistsException("Object", locate(path));
        }
    }

    @Override
    public void writeAtomic(StoragePath path, byte[] content) {
        objects.put(physicalKey(path), content.clone());
    }

    @Override
    public void append(StoragePath path, byte[] content) {
        String key = physicalKey(path);
        // Object stores cannot append; read-modify-write under a per-key lock
        ReentrantLock lock = locks.computeIfAbsent("append:" + key, k -> new ReentrantLock());
        lock.lock();
        try {
            byte[] existing = objects.getOrDefault(key, new byte[0]);
            byte[] combined = new byte[existing.length + content.length];
            System.arraycopy(existing, 0, combined, 0, existing.length);
            System.arraycopy(content, 0, combined, existing.length, content.length);
            objects.put(key, combined);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> listChildren(StoragePath path) {
        String prefix = prefixOf(physicalKey(path));
        SortedSet<String> names = new TreeSet<>();
        for (String key : keysWithPrefix(prefix).keySet()) {
            String rest = key.substring(prefix.length());
            int slash = rest.indexOf('/');
            String child = slash < 0 ? rest : rest.substring(0, slash);
            if (!child.isEmpty() && !child.startsWith(".")) {
                names.add(child);
            }
        }
        return List.copyOf(names);
    }

    @Override
    public void commitDirectory(StoragePath stagingPath, StoragePath finalPath) {
        String stagedKey = physicalKey(stagingPath);
        String stagedPrefix = prefixOf(stagedKey);
        if (!hasKeyWithPrefix(stagedPrefix)) {
            throw new NotFoundException("Staging area", locate(stagingPath));
        }
        if (exists(finalPath)) {
            throw new AlreadyExistsException("Object", locate(finalPath));
        }
        byte[] marker = stagedKey.getBytes(StandardCharsets.UTF_8);
        if (objects.putIfAbsent(markerKey(finalPath), marker) != null) {
            throw new AlreadyExistsException("Object", locate(finalPath));
        }
        committedPrefixes.add(stagedKey);
    }

    @Override
    public void discard(StoragePath stagingPath) {
        String stagedKey = physicalKey(stagingPath);
        if (committedPrefixes.contains(stagedKey)) {
            throw new StorageException("Refusing to discard committed objects under " + locate(stagingPath));
        }
        keysWithPrefix(prefixOf(stagedKey)).clear();
    }

    @Override
    public StorageLock lock(StoragePath lockPath, Duration timeout) {
        ReentrantLock lock = locks.computeIfAbsent(lockPath.toString(), k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for lock " + lockPath, e);
        }
        if (!acquired) {
            throw new StorageException("Timed out after " + timeout.toMillis() + " ms waiting for lock " + lockPath);
        }
        AtomicBoolean released = new AtomicBoolean();
        return () -> {
            if (released.compareAndSet(false, true)) {
                lock.unlock();
            }
        };
    }

    @Override
    public String locate(StoragePath path) {
        return "memory://" + bucket + "/" + path;
    }

    /**
     * Number of stored objects, markers included.
     */
    public int objectCount() {
        return objects.size();
    }

    /**
     * Key under which the content of a logical path is stored: the longest
     * committed ancestor is replaced by the staged prefix it points at.
     */
    private String physicalKey(StoragePath path) {
        List<String> segments = path.segments();
        for (int i = segments.size(); i >= 1; i--) {
            StoragePath ancestor = new StoragePath(segments.subList(0, i));
            byte[] marker = objects.get(markerKey(ancestor));
            if (marker != null) {
                String staged = new String(marker, StandardCharsets.UTF_8);
                String rest = path.relativeTo(ancestor);
                return rest.isEmpty() ? staged : staged + "/" + rest;
            }
        }
        return path.toString();
    }

    private boolean hasKeyWithPrefix(String prefix) {
        String next = objects.ceilingKey(prefix);
        return next != null && next.startsWith(prefix);
    }

    /**
     * Live view of the keys starting with the prefix. Prefixes end in '/', and
     * '0' is the character right after it, so the range is exactly the subtree.
     */
    private ConcurrentNavigableMap<String, byte[]> keysWithPrefix(String prefix) {
        if (prefix.isEmpty()) {
            return objects;
        }
        String end = prefix.substring(0, prefix.length() - 1) + '0';
        return objects.subMap(prefix, true, end, false);
    }

    private static String markerKey(StoragePath path) {
        return path.resolve(COMMIT_MARKER).toString();
    }

    private static String prefixOf(String key) {
        return key.isEmpty() ? "" : key + "/";
    }
}
