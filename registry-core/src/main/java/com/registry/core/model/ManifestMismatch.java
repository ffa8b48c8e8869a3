package com.registry.core.model;

/**
 * One discrepancy between stored files and the manifest.
 */
public record ManifestMismatch(
    String fileName,
    Kind kind,
    String expectedDigest,
    String actualDigest
) {
    public enum Kind {
        /** Listed in the manifest but absent from storage. */
        MISSING,
        /** Present in storage but not listed in the manifest. */
        UNEXPECTED,
        /** Content hash differs from the manifest. */
        DIGEST_MISMATCH,
        /** The manifest itself is absent or cannot be parsed. */
        MANIFEST_UNREADABLE
    }

    public static ManifestMismatch missing(String fileName, String expectedDigest) {
        return new ManifestMismatch(fileName, Kind.MISSING, expectedDigest, null);
    }

    public static ManifestMismatch unexpected(String fileName, String actualDigest) {
        return new ManifestMismatch(fileName, Kind.UNEXPECTED, null, actualDigest);
    }

    public static ManifestMismatch digestMismatch(String fileName, String expectedDigest, String actualDigest) {
        return new ManifestMismatch(fileName, Kind.DIGEST_MISMATCH, expectedDigest, actualDigest);
    }

    public static ManifestMismatch unreadableManifest(String reason) {
        return new ManifestMismatch(Manifest.FILE_NAME, Kind.MANIFEST_UNREADABLE, null, reason);
    }

    public String describe() {
        return switch (kind) {
            case MISSING -> fileName + " is missing";
            case UNEXPECTED -> fileName + " is not listed in the manifest";
            case DIGEST_MISMATCH -> fileName + " expected " + expectedDigest + " but was " + actualDigest;
            case MANIFEST_UNREADABLE -> "manifest unreadable: " + actualDigest;
        };
    }
}
