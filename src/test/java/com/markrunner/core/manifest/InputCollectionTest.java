package com.markrunner.core.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InputCollectionTest {

    @TempDir
    Path dir;

    private InputCollection collection;

    @BeforeEach
    void setUp() {
        collection = new InputCollection(new ObjectMapper());
    }

    @Test
    @DisplayName("reads one key per line, skipping blanks and comments")
    void readsLines() throws Exception {
        Path file = dir.resolve("subjects.txt");
        Files.writeString(file, "# roster\nalice\n\n  bob  \n");

        List<Subject> subjects = collection.load(file, "key");

        assertEquals(List.of("alice", "bob"), subjects.stream().map(Subject::key).toList());
    }

    @Test
    @DisplayName("reads a JSON array and keeps scalar fields as attributes")
    void readsJsonArray() throws Exception {
        Path file = dir.resolve("subjects.json");
        Files.writeString(file, "[{\"student\":\"alice\",\"section\":2,\"tags\":[\"x\"]}]");

        List<Subject> subjects = collection.load(file, "student");

        assertEquals(1, subjects.size());
        assertEquals("alice", subjects.get(0).key());
        assertEquals("2", subjects.get(0).attributes().get("section"));
        assertFalse(subjects.get(0).attributes().containsKey("tags"));
    }

    @Test
    @DisplayName("uses the first array field of a JSON object")
    void readsWrappedArray() throws Exception {
        Path file = dir.resolve("subjects.json");
        Files.writeString(file, "{\"course\":\"cs101\",\"submissions\":[{\"key\":\"a\"},{\"key\":\"b\"}]}");

        assertEquals(2, collection.load(file, "key").size());
    }

    @Test
    @DisplayName("fails fast on a missing file")
    void missingFile() {
        assertThrows(InputCollectionException.class, () -> collection.load(dir.resolve("nope.json"), "key"));
    }

    @Test
    @DisplayName("fails fast on an entry without the key field")
    void missingKey() throws Exception {
        Path file = dir.resolve("subjects.json");
        Files.writeString(file, "[{\"key\":\"a\"},{\"name\":\"b\"}]");

        var e = assertThrows(InputCollectionException.class, () -> collection.load(file, "key"));
        assertTrue(e.getMessage().contains("Entry 2"));
    }

    @Test
    @DisplayName("fails fast on duplicate keys")
    void duplicateKeys() throws Exception {
        Path file = dir.resolve("subjects.txt");
        Files.writeString(file, "a\nb\na\n");

        assertThrows(InputCollectionException.class, () -> collection.load(file, "key"));
    }
}
