package com.markrunner.core.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.markrunner.core.model.Manifest;
import com.markrunner.core.model.WorkUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ManifestFileTest {

    @TempDir
    Path dir;

    private final ManifestFile manifestFile = new ManifestFile(new ObjectMapper());

    @Test
    @DisplayName("writes one command per line and an index next to it")
    void writesTaskFileAndIndex() throws Exception {
        var manifest = new Manifest("eval", List.of(
                new WorkUnit(1, "a", "echo a", dir.resolve("a.md")),
                new WorkUnit(2, "b", "echo b", dir.resolve("b.md"))));
        Path taskFile = dir.resolve("eval.txt");

        manifestFile.write(manifest, taskFile);

        assertEquals(List.of("echo a", "echo b"), Files.readAllLines(taskFile));
        Path index = ManifestFile.indexPathFor(taskFile);
        assertEquals(dir.resolve("eval.index.json"), index);
        var entries = manifestFile.readIndex(index);
        assertEquals("b", entries.get(2).key());
        assertEquals(dir.resolve("b.md").toString(), entries.get(2).expectedOutput());
        assertEquals(Optional.of("echo b"), ManifestFile.readLine(taskFile, 2));
    }

    @Test
    @DisplayName("readLine returns exactly the requested ordinal")
    void readLine() throws Exception {
        Path taskFile = dir.resolve("t.txt");
        Files.writeString(taskFile, "one\ntwo\nthree\n");

        assertEquals(Optional.of("two"), ManifestFile.readLine(taskFile, 2));
        assertEquals(Optional.empty(), ManifestFile.readLine(taskFile, 4));
        assertEquals(Optional.empty(), ManifestFile.readLine(taskFile, 0));
        assertEquals(3, ManifestFile.countLines(taskFile));
    }

    @Test
    @DisplayName("a plain task file has no index")
    void readsWithoutIndex() throws Exception {
        Path taskFile = dir.resolve("adhoc.txt");
        Files.writeString(taskFile, "true\nfalse\n");

        assertTrue(manifestFile.readIndex(ManifestFile.indexPathFor(taskFile)).isEmpty());
        assertEquals(2, ManifestFile.countLines(taskFile));
    }

    @Test
    @DisplayName("lines end at newline only; a carriage return stays in its line")
    void carriageReturnIsNotALineBreak() throws Exception {
        Path taskFile = dir.resolve("cr.txt");
        Files.writeString(taskFile, "echo a\recho b\necho c\r\necho d");

        assertEquals(3, ManifestFile.countLines(taskFile));
        assertEquals(Optional.of("echo a\recho b"), ManifestFile.readLine(taskFile, 1));
        assertEquals(Optional.of("echo c\r"), ManifestFile.readLine(taskFile, 2));
        assertEquals(Optional.of("echo d"), ManifestFile.readLine(taskFile, 3));
        assertEquals(List.of("echo a\recho b", "echo c\r", "echo d"), ManifestFile.readLines(taskFile));
    }
}
