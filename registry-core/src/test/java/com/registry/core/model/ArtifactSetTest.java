package com.registry.core.model;

import com.registry.core.exception.RegistryValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactSetTest {

    @TempDir
    Path dir;

    @Test
    void fromDirectory_shouldNameNestedFilesWithForwardSlashes() throws IOException {
        Files.writeString(dir.resolve("model.pt"), "weights");
        Files.createDirectories(dir.resolve("config"));
        Files.writeString(dir.resolve("config/params.json"), "{}");

        ArtifactSet set = ArtifactSet.fromDirectory(dir);

        assertEquals(List.of("config/params.json", "model.pt"), List.copyOf(set.fileNames()));
        assertEquals("weights", read(set, "model.pt"));
    }

    @Test
    void fromDirectory_shouldReadContentOnlyWhenOpened() throws IOException {
        Path model = dir.resolve("model.pt");
        Files.writeString(model, "before");

        ArtifactSet set = ArtifactSet.fromDirectory(dir);
        Files.writeString(model, "after");

        assertEquals("after", read(set, "model.pt"));
        // Each open starts from the first byte
        assertEquals("after", read(set, "model.pt"));
    }

    @Test
    void fromDirectory_shouldRejectMissingDirectory() {
        assertThrows(RegistryValidationException.class,
            () -> ArtifactSet.fromDirectory(dir.resolve("absent")));
    }

    @Test
    void of_shouldCopyContent() throws IOException {
        byte[] content = "A".getBytes(StandardCharsets.UTF_8);
        ArtifactSet set = ArtifactSet.of(Map.of("model.bin", content));
        content[0] = 'Z';

        assertEquals("A", read(set, "model.bin"));
        assertTrue(set.contains("model.bin"));
        assertEquals(1, set.size());
    }

    private static String read(ArtifactSet set, String name) throws IOException {
        try (InputStream in = set.asMap().get(name).open()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
