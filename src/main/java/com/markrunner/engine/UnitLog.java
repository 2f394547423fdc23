package com.markrunner.engine;

import com.markrunner.core.model.ExecutionResult;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes {@code unit_<n>.log} files. The last line of a complete log is
 * {@code EXIT_CODE=<int>}, preceded by {@code DURATION_MS=<long>}.
 */
public final class UnitLog {

    public static final String EXIT_PREFIX = "EXIT_CODE=";
    public static final String DURATION_PREFIX = "DURATION_MS=";
    public static final Pattern FILE_NAME = Pattern.compile("unit_(\\d+)\\.log");

    private static final int TAIL_BYTES = 512;

    private UnitLog() {}

    public static Path path(Path logDir, int ordinal) {
        return logDir.resolve("unit_" + ordinal + ".log");
    }

    /**
     * Ordinal encoded in a log file name, if it is one.
     */
    public static OptionalInt ordinalOf(Path file) {
        Matcher m = FILE_NAME.matcher(file.getFileName().toString());
        return m.matches() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    public static void appendTrailer(Path log, long durationMs, int exitCode) throws IOException {
        String trailer = "\n" + DURATION_PREFIX + durationMs + "\n" + EXIT_PREFIX + exitCode + "\n";
        Files.writeString(log, trailer, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public static void appendLine(Path log, String line) throws IOException {
        Files.writeString(log, line + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public static boolean hasTrailer(Path log) {
        return exitCode(log).isPresent();
    }

    /**
     * Exit code from the trailer; empty when the file is missing or the worker died before
     * writing it.
     */
    public static Optional<Integer> exitCode(Path log) {
        return trailerValue(log, EXIT_PREFIX, true).map(Integer::parseInt);
    }

    public static ExecutionResult read(Path logDir, int ordinal) {
        Path log = path(logDir, ordinal);
        int exit = exitCode(log).orElse(ExecutionResult.NO_TRAILER);
        long duration = trailerValue(log, DURATION_PREFIX, false).map(Long::parseLong).orElse(-1L);
        return new ExecutionResult(ordinal, exit, log, duration);
    }

    /**
     * Gives a unit whose worker vanished a log that explains it, so the classifier and
     * the operator have something to read. A log that already has a trailer is left alone.
     */
    public static void ensureComplete(Path logDir, int ordinal, String reason) throws IOException {
        Path log = path(logDir, ordinal);
        if (hasTrailer(log)) return;
        appendLine(log, reason);
        appendTrailer(log, -1, ExecutionResult.NO_TRAILER);
    }

    /**
     * Log text without the trailer lines.
     */
    public static String body(Path log) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String line : Files.readAllLines(log, StandardCharsets.UTF_8)) {
            if (line.startsWith(EXIT_PREFIX) || line.startsWith(DURATION_PREFIX)) continue;
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private static Optional<String> trailerValue(Path log, String prefix, boolean mustBeLast) {
        if (!Files.isRegularFile(log)) return Optional.empty();
        String tail;
        try {
            tail = tail(log);
        } catch (IOException e) {
            return Optional.empty();
        }
        String[] lines = tail.split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].strip();
            if (line.isEmpty()) continue;
            if (line.startsWith(prefix)) {
                String value = line.substring(prefix.length()).strip();
                return value.matches("-?\\d+") ? Optional.of(value) : Optional.empty();
            }
            if (mustBeLast) return Optional.empty();
        }
        return Optional.empty();
    }

    private static String tail(Path log) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(log.toFile(), "r")) {
            long length = raf.length();
            int n = (int) Math.min(length, TAIL_BYTES);
            byte[] buf = new byte[n];
            raf.seek(length - n);
            raf.readFully(buf);
            return new String(buf, StandardCharsets.UTF_8);
        }
    }
}
