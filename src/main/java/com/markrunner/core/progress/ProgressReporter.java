package com.markrunner.core.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Cross-process completion counter for one batch.
 *
 * <p>State lives in a directory: {@code counter} holds the completed count and the
 * {@code lock} subdirectory is the mutex. Creating a directory is atomic create-if-absent on
 * every platform, so Java threads and the shell workers started by the dispatch utility can
 * share one counter. The shell side of the protocol lives in {@code engine/unit-worker.sh}.
 *
 * <p>Lock acquisition spins a bounded number of times; when it gives up, that update is
 * dropped. A lost progress line is acceptable, a stuck batch is not.
 */
public class ProgressReporter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    static final String COUNTER_FILE = "counter";
    static final String LOCK_DIR = "lock";

    private final Path dir;
    private final int total;
    private final PrintStream sink;
    private final int maxAttempts;
    private final long sleepMs;

    ProgressReporter(Path dir, int total, PrintStream sink, int maxAttempts, long sleepMs) {
        this.dir = dir;
        this.total = total;
        this.sink = sink;
        this.maxAttempts = maxAttempts;
        this.sleepMs = sleepMs;
    }

    /**
     * Creates the counter directory (initialised to 0) and prints the initial 0% line.
     */
    public static ProgressReporter create(Path dir, int total, PrintStream sink, int maxAttempts, long sleepMs) {
        if (total < 1) {
            throw new IllegalArgumentException("Progress total must be >= 1, got " + total);
        }
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(COUNTER_FILE), "0\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create progress counter in " + dir, e);
        }
        var reporter = new ProgressReporter(dir, total, sink, maxAttempts, sleepMs);
        reporter.emit(0);
        return reporter;
    }

    public Path directory() {
        return dir;
    }

    public int total() {
        return total;
    }

    /**
     * Records one finished unit and prints a snapshot. Safe to call from any thread or process
     * that shares the directory.
     *
     * @return false when the lock could not be taken and the update was skipped
     */
    public boolean increment() {
        Path lock = dir.resolve(LOCK_DIR);
        int attempt = 0;
        while (true) {
            try {
                Files.createDirectory(lock);
                break;
            } catch (FileAlreadyExistsException e) {
                if (++attempt >= maxAttempts) {
                    log.debug("Progress lock busy after {} attempts, skipping update", attempt);
                    return false;
                }
                if (!pause()) return false;
            } catch (IOException e) {
                log.debug("Progress lock unavailable: {}", e.getMessage());
                return false;
            }
        }

        try {
            int completed = readCounter() + 1;
            Files.writeString(dir.resolve(COUNTER_FILE), completed + "\n", StandardCharsets.UTF_8);
            emit(completed);
            return true;
        } catch (IOException e) {
            log.debug("Progress counter update failed: {}", e.getMessage());
            return false;
        } finally {
            try {
                Files.deleteIfExists(lock);
            } catch (IOException e) {
                log.warn("Could not release progress lock {}: {}", lock, e.getMessage());
            }
        }
    }

    /**
     * Current count as stored on disk, including updates from other processes.
     */
    public int completed() {
        try {
            return readCounter();
        } catch (IOException e) {
            return 0;
        }
    }

    public static String formatLine(int completed, int total) {
        int percent = total == 0 ? 100 : (int) ((long) completed * 100 / total);
        return String.format("[%3d%%] Completed %d/%d units", percent, completed, total);
    }

    private void emit(int completed) {
        if (sink == null) return;
        // Blank lines on both sides keep the snapshot visible between interleaved unit output.
        sink.print("\n" + formatLine(completed, total) + "\n\n");
        sink.flush();
    }

    private int readCounter() throws IOException {
        Path counter = dir.resolve(COUNTER_FILE);
        if (!Files.exists(counter)) return 0;
        String text = Files.readString(counter, StandardCharsets.UTF_8).strip();
        if (text.isEmpty()) return 0;
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            log.debug("Corrupt progress counter '{}', restarting from 0", text);
            return 0;
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Removes the counter directory; the counter does not outlive its batch.
     */
    @Override
    public void close() {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean up progress directory {}: {}", dir, e.getMessage());
        }
    }
}
