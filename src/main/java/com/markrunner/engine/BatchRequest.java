package com.markrunner.engine;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Input to {@link ExecutionEngine#execute(BatchRequest)}.
 *
 * @param taskFile           manifest file, one unit per line
 * @param concurrency        maximum simultaneously running units, at least 1
 * @param logDir             receives {@code unit_<n>.log}; created when missing
 * @param commandTemplate    optional; when set each line is a payload substituted for {@code {}}
 * @param verbose            print progress snapshots
 * @param preference         requested backend
 * @param unitTimeoutSeconds 0 disables the per-unit timeout
 * @param console            where progress and dispatcher output go; null silences them
 */
public record BatchRequest(
    Path taskFile,
    int concurrency,
    Path logDir,
    String commandTemplate,
    boolean verbose,
    BackendPreference preference,
    int unitTimeoutSeconds,
    PrintStream console
) {
    public static BatchRequest of(Path taskFile, int concurrency, Path logDir) {
        return new BatchRequest(taskFile, concurrency, logDir, null, false, BackendPreference.AUTO, 0, null);
    }

    public BatchRequest withPreference(BackendPreference p) {
        return new BatchRequest(taskFile, concurrency, logDir, commandTemplate, verbose, p, unitTimeoutSeconds, console);
    }

    public BatchRequest withVerbose(boolean v, PrintStream out) {
        return new BatchRequest(taskFile, concurrency, logDir, commandTemplate, v, preference, unitTimeoutSeconds, out);
    }

    public BatchRequest withCommandTemplate(String template) {
        return new BatchRequest(taskFile, concurrency, logDir, template, verbose, preference, unitTimeoutSeconds, console);
    }

    public BatchRequest withUnitTimeout(int seconds) {
        return new BatchRequest(taskFile, concurrency, logDir, commandTemplate, verbose, preference, seconds, console);
    }
}
