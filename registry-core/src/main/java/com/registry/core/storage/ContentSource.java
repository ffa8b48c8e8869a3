package com.registry.core.storage;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Re-openable content of one file. Each {@link #open()} starts a fresh
 * stream from the first byte, so a failed write can be retried and a file
 * can be hashed and then copied without holding it in memory.
 */
@FunctionalInterface
public interface ContentSource {

    InputStream open() throws IOException;

    static ContentSource of(byte[] content) {
        return () -> new ByteArrayInputStream(content);
    }

    static ContentSource of(Path file) {
        return () -> Files.newInputStream(file);
    }
}
