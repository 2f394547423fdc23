package com.markrunner.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a finished batch reports: one result per manifest unit.
 */
public record BatchResult(
    BackendType backend,
    Path logDir,
    List<ExecutionResult> results,
    long elapsedMs
) {
    /** Base of the engine exit code when at least one unit failed. */
    public static final int UNIT_FAILURE_EXIT_BASE = 64;

    public BatchResult {
        results = List.copyOf(results);
    }

    public static BatchResult empty(BackendType backend, Path logDir) {
        return new BatchResult(backend, logDir, List.of(), 0L);
    }

    public long succeededCount() {
        return results.stream().filter(ExecutionResult::succeeded).count();
    }

    public long failedCount() {
        return results.size() - succeededCount();
    }

    public int worstExitCode() {
        int worst = 0;
        for (var r : results) {
            if (r.exitCode() != 0 && (worst == 0 || r.exitCode() > worst)) {
                worst = r.exitCode();
            }
        }
        return worst;
    }

    /**
     * 0 when every unit exited 0, otherwise {@code 64 + min(worst, 63)}.
     */
    public int engineExitCode() {
        int worst = worstExitCode();
        if (worst == 0) return 0;
        return UNIT_FAILURE_EXIT_BASE + Math.min(Math.abs(worst), 63);
    }
}
