package com.registry.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Integrity manifest of a version: file name to SHA-256 hex digest.
 *
 * Serialized as {@code manifest.sha256}, one {@code <hexdigest>  <filename>}
 * line per file, sorted by file name, so {@code sha256sum -c} can check it
 * without the registry.
 */
public record Manifest(SortedMap<String, String> entries) {

    public static final String FILE_NAME = "manifest.sha256";
    public static final String ALGORITHM = "SHA-256";

    private static final Pattern HEX_DIGEST = Pattern.compile("[0-9a-f]{64}");

    public Manifest {
        entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }

    public static Manifest of(Map<String, String> entries) {
        return new Manifest(new TreeMap<>(entries));
    }

    public Optional<String> digestOf(String fileName) {
        return Optional.ofNullable(entries.get(fileName));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Render the line-oriented text form.
     */
    public String serialize() {
        StringBuilder out = new StringBuilder();
        entries.forEach((name, digest) -> out.append(digest).append("  ").append(name).append('\n'));
        return out.toString();
    }

    public byte[] toBytes() {
        return serialize().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parse the text form. Blank lines are ignored; a leading '*' on the file
     * name (binary-mode marker of sha256sum) is accepted.
     *
     * @throws IllegalArgumentException on a malformed line or duplicate entry
     */
    public static Manifest parse(String text) {
        SortedMap<String, String> parsed = new TreeMap<>();
        String[] lines = text.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+", 2);
            if (parts.length != 2 || !HEX_DIGEST.matcher(parts[0]).matches()) {
                throw new IllegalArgumentException("Malformed manifest line " + (i + 1) + ": " + line);
            }
            String name = parts[1].startsWith("*") ? parts[1].substring(1) : parts[1];
            if (parsed.put(name, parts[0]) != null) {
                throw new IllegalArgumentException("Duplicate manifest entry: " + name);
            }
        }
        return new Manifest(parsed);
    }

    public static Manifest parse(byte[] bytes) {
        return parse(new String(bytes, StandardCharsets.UTF_8));
    }
}
