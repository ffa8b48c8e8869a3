package com.registry.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManifestTest {

    private static final String DIGEST_A = "559aead08264d5795d3909718cdd05abd49572e84fe55590eef31a88a08fdffd";
    private static final String DIGEST_B = "df7e70e5021544f4834bbee64a9e3789febc4be81470df629cad6ddb03320a5c";

    @Test
    void serialize_shouldUseSha256sumFormatSortedByName() {
        Manifest manifest = Manifest.of(Map.of("z.bin", DIGEST_B, "a.bin", DIGEST_A));

        assertEquals(
            DIGEST_A + "  a.bin\n" + DIGEST_B + "  z.bin\n",
            manifest.serialize()
        );
    }

    @Test
    void serialize_emptyManifest_shouldBeEmptyText() {
        assertEquals("", Manifest.of(Map.of()).serialize());
    }

    @Test
    void parse_shouldAcceptBinaryMarkerAndBlankLines() {
        Manifest manifest = Manifest.parse(DIGEST_A + " *model.bin\n\n" + DIGEST_B + "  metadata.json\n");

        assertEquals(List.of("metadata.json", "model.bin"), List.copyOf(manifest.entries().keySet()));
        assertEquals(DIGEST_A, manifest.digestOf("model.bin").orElseThrow());
    }

    @Test
    void parse_shouldRejectMalformedDigest() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Manifest.parse("not-a-digest  model.bin\n"));

        assertTrue(e.getMessage().contains("line 1"));
    }

    @Test
    void parse_shouldRejectDuplicateEntries() {
        assertThrows(IllegalArgumentException.class,
            () -> Manifest.parse(DIGEST_A + "  a.bin\n" + DIGEST_B + "  a.bin\n"));
    }

    @Test
    void entries_shouldBeImmutable() {
        Manifest manifest = Manifest.of(Map.of("a.bin", DIGEST_A));

        assertThrows(UnsupportedOperationException.class, () -> manifest.entries().put("b.bin", DIGEST_B));
    }
}
