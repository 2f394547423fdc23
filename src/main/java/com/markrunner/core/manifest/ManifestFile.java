package com.markrunner.core.manifest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.markrunner.core.model.Manifest;
import com.markrunner.core.model.WorkUnit;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task file and manifest index I/O.
 *
 * <p>The task file holds one fully-formed command per line; line N is unit N. The index is a
 * JSON sidecar ({@code <name>.index.json}) mapping ordinals to keys and expected outputs.
 */
public class ManifestFile {

    /**
     * Index row for one unit.
     */
    public record IndexEntry(int id, String key, String expectedOutput) {}

    private final ObjectMapper objectMapper;

    public ManifestFile(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static Path indexPathFor(Path taskFile) {
        String name = taskFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return taskFile.resolveSibling(base + ".index.json");
    }

    /**
     * Writes the task file and its index. Both are written to temp files and moved into place.
     */
    public void write(Manifest manifest, Path taskFile) {
        try {
            Path parent = taskFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);

            var sb = new StringBuilder();
            var index = new ArrayList<IndexEntry>();
            for (WorkUnit unit : manifest.units()) {
                sb.append(unit.command()).append('\n');
                index.add(new IndexEntry(unit.id(), unit.key(),
                        unit.expectedOutputPath() != null ? unit.expectedOutputPath().toString() : null));
            }
            writeAtomically(taskFile, sb.toString().getBytes(StandardCharsets.UTF_8));
            writeAtomically(indexPathFor(taskFile), objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(index));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write manifest " + taskFile, e);
        }
    }

    /**
     * Reads only line {@code ordinal} of the task file, streaming past the lines before it.
     */
    public static Optional<String> readLine(Path taskFile, int ordinal) throws IOException {
        if (ordinal < 1) return Optional.empty();
        String[] found = new String[1];
        forEachLine(taskFile, (n, line) -> {
            if (n < ordinal) return true;
            found[0] = line;
            return false;
        });
        return Optional.ofNullable(found[0]);
    }

    public static int countLines(Path taskFile) throws IOException {
        return forEachLine(taskFile, (n, line) -> true);
    }

    public static List<String> readLines(Path taskFile) throws IOException {
        var lines = new ArrayList<String>();
        forEachLine(taskFile, (n, line) -> lines.add(line));
        return lines;
    }

    private interface LineVisitor {
        /** @return false to stop reading */
        boolean visit(int lineNumber, String line);
    }

    /**
     * Lines end at {@code \n} only, the way the shell workers number them; a {@code \r} stays
     * part of its line. A final line without a terminator still counts.
     */
    private static int forEachLine(Path taskFile, LineVisitor visitor) throws IOException {
        int n = 0;
        try (Reader reader = Files.newBufferedReader(taskFile, StandardCharsets.UTF_8)) {
            var current = new StringBuilder();
            boolean pending = false;
            int c;
            while ((c = reader.read()) != -1) {
                if (c == '\n') {
                    if (!visitor.visit(++n, current.toString())) return n;
                    current.setLength(0);
                    pending = false;
                } else {
                    current.append((char) c);
                    pending = true;
                }
            }
            if (pending) {
                visitor.visit(++n, current.toString());
            }
        }
        return n;
    }

    /**
     * @return ordinal -> entry; empty when the index does not exist
     */
    public Map<Integer, IndexEntry> readIndex(Path indexFile) throws IOException {
        var result = new LinkedHashMap<Integer, IndexEntry>();
        if (indexFile == null || !Files.isRegularFile(indexFile)) {
            return result;
        }
        List<IndexEntry> entries = objectMapper.readValue(indexFile.toFile(), new TypeReference<List<IndexEntry>>() {});
        for (IndexEntry e : entries) {
            result.put(e.id(), e);
        }
        return result;
    }

    static void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, content);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
