package com.registry.engine.integrity;

import com.registry.core.exception.StorageException;
import com.registry.core.model.Manifest;
import com.registry.core.model.ManifestMismatch;
import com.registry.core.storage.ContentSource;

import java.io.IOException;
import java.io.InputStream;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes and checks SHA-256 manifests over a set of files.
 *
 * Files are streamed through the digest in fixed-size chunks and never held
 * whole in memory, so artifact size is bounded by storage only.
 */
public class ManifestCalculator {

    static final int CHUNK_SIZE = 1 << 20;

    /**
     * Hash every file, keyed by name.
     *
     * @throws StorageException if a file cannot be read
     */
    public Manifest computeManifest(Map<String, ContentSource> files) {
        TreeMap<String, String> entries = new TreeMap<>();
        files.forEach((name, content) -> entries.put(name, digest(name, content)));
        return new Manifest(entries);
    }

    /**
     * Lower-case hex SHA-256 of the content.
     */
    public String digest(byte[] content) {
        return HexFormat.of().formatHex(newDigest().digest(content));
    }

    /**
     * Lower-case hex SHA-256 of a streamed file.
     */
    public String digest(ContentSource content) throws IOException {
        MessageDigest digest = newDigest();
        byte[] chunk = new byte[CHUNK_SIZE];
        try (InputStream in = new DigestInputStream(content.open(), digest)) {
            while (in.read(chunk) != -1) {
                // the stream updates the digest
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Compare stored files against a manifest.
     *
     * @param files Stored files, excluding the manifest itself
     * @return Mismatches ordered by file name; empty when everything matches
     * @throws StorageException if a stored file cannot be read
     */
    public List<ManifestMismatch> verifyManifest(Map<String, ContentSource> files, Manifest manifest) {
        TreeSet<String> names = new TreeSet<>(files.keySet());
        names.addAll(manifest.entries().keySet());

        List<ManifestMismatch> mismatches = new ArrayList<>();
        for (String name : names) {
            String expected = manifest.entries().get(name);
            ContentSource content = files.get(name);
            if (content == null) {
                mismatches.add(ManifestMismatch.missing(name, expected));
                continue;
            }
            String actual = digest(name, content);
            if (expected == null) {
                mismatches.add(ManifestMismatch.unexpected(name, actual));
            } else if (!expected.equals(actual)) {
                mismatches.add(ManifestMismatch.digestMismatch(name, expected, actual));
            }
        }
        return mismatches;
    }

    private String digest(String name, ContentSource content) {
        try {
            return digest(content);
        } catch (IOException e) {
            throw new StorageException("digest", name, e);
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(Manifest.ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException(Manifest.ALGORITHM + " not available", e);
        }
    }
}
