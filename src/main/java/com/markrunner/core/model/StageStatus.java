package com.markrunner.core.model;

/**
 * Stage lifecycle: PENDING -> RUNNING -> {COMPLETE, PARTIAL, ABORTED}.
 * PARTIAL is transient; it resolves to COMPLETE (degraded) or ABORTED.
 */
public enum StageStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    PARTIAL,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ABORTED;
    }
}
