package com.markrunner.core.model;

import java.nio.file.Path;

/**
 * One independent external-process invocation.
 *
 * @param id                 1-based ordinal position in the manifest; line {@code id} of the task file
 * @param key                subject identity the unit was planned for
 * @param command            fully-formed shell command line (never contains a newline)
 * @param expectedOutputPath artifact whose presence proves completion; null for ad-hoc task files
 */
public record WorkUnit(
    int id,
    String key,
    String command,
    Path expectedOutputPath
) {
    public WorkUnit {
        if (id < 1) {
            throw new IllegalArgumentException("Unit ordinal must be >= 1, got " + id);
        }
        if (command == null || command.indexOf('\n') >= 0 || command.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Unit " + id + " command must be a single line");
        }
    }
}
