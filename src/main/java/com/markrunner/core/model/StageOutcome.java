package com.markrunner.core.model;

import java.util.List;

/**
 * Terminal result of one stage invocation.
 *
 * @param counts          manifest counts; null when the stage short-circuited before building one
 * @param batch           engine result; null when nothing was dispatched
 * @param missingKeys     keys still without output after execution
 * @param placeholderKeys keys completed by a placeholder artifact (require manual review)
 */
public record StageOutcome(
    String stageId,
    StageStatus status,
    int expectedTotal,
    ManifestCounts counts,
    BatchResult batch,
    List<String> missingKeys,
    List<String> placeholderKeys,
    String message
) {
    public StageOutcome {
        missingKeys = List.copyOf(missingKeys);
        placeholderKeys = List.copyOf(placeholderKeys);
    }

    public boolean isDegraded() {
        return !placeholderKeys.isEmpty();
    }

    public int dispatched() {
        return counts == null ? 0 : counts.toRun();
    }
}
