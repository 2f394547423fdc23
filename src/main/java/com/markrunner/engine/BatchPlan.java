package com.markrunner.engine;

import com.markrunner.core.progress.ProgressReporter;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * What a backend needs to run one batch.
 *
 * @param taskFile           one fully-formed command per line
 * @param ordinals           lines to run; the full range 1..N on first dispatch
 * @param unitCount          number of lines in the task file
 * @param concurrency        upper bound on simultaneously running unit processes
 * @param logDir             destination of {@code unit_<n>.log}
 * @param scratchDir         batch-private directory for the worker script and unit scripts
 * @param unitTimeoutSeconds 0 disables the timeout
 * @param console            where status output of the backend goes
 * @param progress           null when progress reporting is off
 */
public record BatchPlan(
    Path taskFile,
    List<Integer> ordinals,
    int unitCount,
    int concurrency,
    Path logDir,
    Path scratchDir,
    boolean verbose,
    int unitTimeoutSeconds,
    PrintStream console,
    ProgressReporter progress
) {
    public BatchPlan {
        ordinals = List.copyOf(ordinals);
    }

    public boolean isFullRange() {
        if (ordinals.size() != unitCount) return false;
        for (int i = 0; i < ordinals.size(); i++) {
            if (ordinals.get(i) != i + 1) return false;
        }
        return true;
    }

    public BatchPlan withOrdinals(List<Integer> subset) {
        return new BatchPlan(taskFile, subset, unitCount, concurrency, logDir, scratchDir,
                verbose, unitTimeoutSeconds, console, progress);
    }
}
