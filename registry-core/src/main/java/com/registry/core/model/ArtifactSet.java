package com.registry.core.model;

import com.registry.core.exception.RegistryValidationException;
import com.registry.core.exception.StorageException;
import com.registry.core.storage.ContentSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Named artifact files, ordered by file name, each with a source of its
 * exact byte content. File names are relative paths using '/' as separator.
 *
 * Sets read from a directory stream their files on demand; the directory
 * must stay unchanged until the set is registered.
 */
public final class ArtifactSet {

    private final SortedMap<String, ContentSource> files;

    private ArtifactSet(SortedMap<String, ContentSource> files) {
        this.files = files;
    }

    /**
     * Create a set from in-memory content. Names are validated, content is copied.
     */
    public static ArtifactSet of(Map<String, byte[]> files) {
        SortedMap<String, ContentSource> copy = new TreeMap<>();
        files.forEach((name, content) -> {
            Identifiers.requireValidFileName(name);
            if (content == null) {
                throw new RegistryValidationException("artifacts", "no content for " + name);
            }
            copy.put(name, ContentSource.of(content.clone()));
        });
        return new ArtifactSet(copy);
    }

    /**
     * Collect every regular file below a directory. Content is not read here.
     *
     * @throws RegistryValidationException if the directory does not exist or holds an unsafe name
     * @throws StorageException if the directory cannot be walked
     */
    public static ArtifactSet fromDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new RegistryValidationException("artifactDir", "not a directory: " + directory);
        }
        SortedMap<String, ContentSource> found = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.filter(Files::isRegularFile).forEach(file -> {
                String name = directory.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
                Identifiers.requireValidFileName(name);
                found.put(name, ContentSource.of(file));
            });
        } catch (IOException e) {
            throw new StorageException("readArtifacts", directory.toString(), e);
        } catch (UncheckedIOException e) {
            // Files.walk reports failures below the top directory this way
            throw new StorageException("readArtifacts", directory.toString(), e.getCause());
        }
        return new ArtifactSet(found);
    }

    public Set<String> fileNames() {
        return Collections.unmodifiableSet(files.keySet());
    }

    public boolean contains(String fileName) {
        return files.containsKey(fileName);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }

    /**
     * Read-only view of the files.
     */
    public SortedMap<String, ContentSource> asMap() {
        return Collections.unmodifiableSortedMap(files);
    }
}
