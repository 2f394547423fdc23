package com.markrunner.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a pipeline runs, used for console watch output and tests.
 *
 * @param eventType event type (e.g. "stage.started", "batch.completed", "stage.degraded")
 * @param runId     the pipeline run this event belongs to
 * @param stageId   the stage this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String stageId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PipelineEvent of(String eventType, String runId, String stageId, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, stageId, payload, Instant.now());
    }
}
