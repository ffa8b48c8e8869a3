package com.registry.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Backend-neutral hierarchical path, addressed by segments.
 *
 * Invariants:
 * - segments are non-empty and contain no '/'
 * - the empty path is the registry root
 */
public record StoragePath(List<String> segments) {

    private static final StoragePath ROOT = new StoragePath(List.of());

    public StoragePath {
        segments = List.copyOf(segments);
        for (String segment : segments) {
            if (segment == null || segment.isEmpty() || segment.contains("/")) {
                throw new IllegalArgumentException("Invalid path segment: '" + segment + "'");
            }
        }
    }

    public static StoragePath root() {
        return ROOT;
    }

    /**
     * Create a path from segments; each argument may itself contain '/'.
     */
    public static StoragePath of(String... parts) {
        return root().resolve(parts);
    }

    /**
     * Resolve child segments; each argument may itself contain '/'.
     */
    public StoragePath resolve(String... parts) {
        List<String> combined = new ArrayList<>(segments);
        for (String part : parts) {
            Arrays.stream(part.split("/"))
                .filter(s -> !s.isEmpty())
                .forEach(combined::add);
        }
        return new StoragePath(combined);
    }

    public StoragePath parent() {
        if (segments.isEmpty()) {
            return this;
        }
        return new StoragePath(segments.subList(0, segments.size() - 1));
    }

    /**
     * Last segment, or the empty string for the root.
     */
    public String name() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public boolean startsWith(StoragePath prefix) {
        return segments.size() >= prefix.segments.size()
            && segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    /**
     * Path of this path relative to an ancestor, joined with '/'.
     */
    public String relativeTo(StoragePath ancestor) {
        if (!startsWith(ancestor)) {
            throw new IllegalArgumentException(this + " is not under " + ancestor);
        }
        return String.join("/", segments.subList(ancestor.segments.size(), segments.size()));
    }

    @Override
    public String toString() {
        return String.join("/", segments);
    }
}
