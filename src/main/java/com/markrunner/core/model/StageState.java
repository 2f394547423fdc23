package com.markrunner.core.model;

import java.util.Set;

/**
 * Filesystem-derived completion state of a stage. Recomputed on every run, never persisted.
 */
public record StageState(
    String stageId,
    int expectedTotal,
    Set<String> completedKeys
) {
    public StageState {
        completedKeys = Set.copyOf(completedKeys);
    }

    /** State that treats every unit as outstanding, used when resume is off. */
    public static StageState fresh(String stageId, int expectedTotal) {
        return new StageState(stageId, expectedTotal, Set.of());
    }

    public boolean isComplete() {
        return completedKeys.size() == expectedTotal;
    }

    public int missingCount() {
        return expectedTotal - completedKeys.size();
    }
}
