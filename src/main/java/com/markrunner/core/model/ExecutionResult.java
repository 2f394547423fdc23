package com.markrunner.core.model;

import java.nio.file.Path;

/**
 * Outcome of one unit's subprocess, read back from its log trailer.
 *
 * @param unitId     manifest ordinal
 * @param exitCode   recorded exit code; {@link #NO_TRAILER} when the worker died before writing one
 * @param logPath    {@code logDir/unit_<id>.log}
 * @param durationMs wall-clock time, -1 when unknown
 */
public record ExecutionResult(
    int unitId,
    int exitCode,
    Path logPath,
    long durationMs
) {
    public static final int NO_TRAILER = 255;

    public boolean succeeded() {
        return exitCode == 0;
    }
}
