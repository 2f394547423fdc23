package com.markrunner.core.stage;

import com.markrunner.engine.BackendPreference;

import java.io.PrintStream;

/**
 * Per-run controls, resolved from configuration and CLI flags.
 *
 * @param resume         skip units whose output already exists
 * @param forceComplete  write placeholders for missing units instead of aborting
 * @param parallel       concurrency override; null keeps the stage or engine default
 * @param backend        requested backend
 * @param stopAfter      stage id after which the run stops; null runs to the end
 * @param only           run just this stage; null runs all
 * @param verbose        progress output
 * @param console        operator output stream; null silences it
 */
public record RunOptions(
    boolean resume,
    boolean forceComplete,
    Integer parallel,
    BackendPreference backend,
    String stopAfter,
    String only,
    boolean verbose,
    PrintStream console
) {
    public static RunOptions defaults() {
        return new RunOptions(true, false, null, BackendPreference.AUTO, null, null, false, null);
    }

    public RunOptions withResume(boolean r) {
        return new RunOptions(r, forceComplete, parallel, backend, stopAfter, only, verbose, console);
    }

    public RunOptions withForceComplete(boolean f) {
        return new RunOptions(resume, f, parallel, backend, stopAfter, only, verbose, console);
    }

    public RunOptions withParallel(Integer p) {
        return new RunOptions(resume, forceComplete, p, backend, stopAfter, only, verbose, console);
    }

    public RunOptions withBackend(BackendPreference b) {
        return new RunOptions(resume, forceComplete, parallel, b, stopAfter, only, verbose, console);
    }

    public RunOptions withStopAfter(String s) {
        return new RunOptions(resume, forceComplete, parallel, backend, s, only, verbose, console);
    }

    public RunOptions withOnly(String o) {
        return new RunOptions(resume, forceComplete, parallel, backend, stopAfter, o, verbose, console);
    }
}
