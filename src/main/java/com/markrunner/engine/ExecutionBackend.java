package com.markrunner.engine;

import com.markrunner.core.model.BackendType;

import java.io.IOException;

/**
 * Strategy for running a batch of units.
 * Implementations: CoordinatorBackend, IndirectDispatchBackend, SequentialBackend.
 */
public interface ExecutionBackend {

    BackendType type();

    /**
     * Runs every ordinal of the plan and blocks until all have finished. Each unit leaves
     * {@code logDir/unit_<n>.log} ending in an {@code EXIT_CODE=} trailer. A failing unit
     * never stops its siblings and is not reported through an exception.
     *
     * @throws IOException if the backend's own tooling could not be started
     */
    void run(BatchPlan plan) throws IOException, InterruptedException;
}
