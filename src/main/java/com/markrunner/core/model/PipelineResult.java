package com.markrunner.core.model;

import java.util.List;

/**
 * Result of running stages in order. The run halts at the first ABORTED stage.
 *
 * @param stoppedAfter stage id the run was asked to stop after, null if it ran to the end
 */
public record PipelineResult(
    String runId,
    List<StageOutcome> stages,
    String stoppedAfter
) {
    public PipelineResult {
        stages = List.copyOf(stages);
    }

    public boolean aborted() {
        return stages.stream().anyMatch(s -> s.status() == StageStatus.ABORTED);
    }

    public List<String> placeholderKeys() {
        return stages.stream().flatMap(s -> s.placeholderKeys().stream()).toList();
    }
}
