package com.markrunner.core.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.markrunner.core.manifest.UnitSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PlaceholderArtifactWriterTest {

    @TempDir
    Path dir;

    private final PlaceholderArtifactWriter writer = new PlaceholderArtifactWriter(new ObjectMapper());

    @Test
    @DisplayName("JSON outputs get a schema-valid JSON placeholder")
    void jsonPlaceholder() throws Exception {
        Path target = dir.resolve("final/alice.json");

        assertTrue(writer.write("finalize", new UnitSpec("alice", "cmd", target), "quota"));

        JsonNode json = new ObjectMapper().readTree(target.toFile());
        assertEquals(PlaceholderArtifactWriter.MARKER, json.get("status").asText());
        assertTrue(json.get("requires_manual_review").asBoolean());
        assertEquals("alice", json.get("key").asText());
        assertTrue(PlaceholderArtifactWriter.isPlaceholder(target));
    }

    @Test
    @DisplayName("other outputs get a Markdown note with the marker")
    void markdownPlaceholder() throws Exception {
        Path target = dir.resolve("eval/bob_q1.md");

        writer.write("evaluate", new UnitSpec("bob_q1", "cmd", target), "unit failed");

        String text = Files.readString(target);
        assertTrue(text.startsWith("# REQUIRES MANUAL REVIEW"));
        assertTrue(text.contains("unit failed"));
        assertTrue(PlaceholderArtifactWriter.isPlaceholder(target));
    }

    @Test
    @DisplayName("never overwrites an existing artifact")
    void neverOverwrites() throws Exception {
        Path target = dir.resolve("a.md");
        Files.writeString(target, "real result");

        assertFalse(writer.write("s", new UnitSpec("a", "cmd", target), "x"));
        assertEquals("real result", Files.readString(target));
        assertFalse(PlaceholderArtifactWriter.isPlaceholder(target));
    }

    @Test
    @DisplayName("leaves no temp files behind")
    void noTempFiles() throws Exception {
        writer.write("s", new UnitSpec("a", "cmd", dir.resolve("a.md")), "x");
        try (var files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }
}
