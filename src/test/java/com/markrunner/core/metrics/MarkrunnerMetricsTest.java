package com.markrunner.core.metrics;

import com.markrunner.core.model.BackendType;
import com.markrunner.core.model.FailureCategory;
import com.markrunner.core.model.StageStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarkrunnerMetricsTest {

    private SimpleMeterRegistry registry;
    private MarkrunnerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MarkrunnerMetrics(registry);
    }

    @Test
    @DisplayName("recordBatch records duration by backend and unit outcomes")
    void recordBatch() {
        metrics.recordBatch(BackendType.INDIRECT_DISPATCH, 1200, 8, 2);

        var timer = registry.find("markrunner.batch.duration").tag("backend", "indirect_dispatch").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(8.0, registry.find("markrunner.units.total").tag("outcome", "succeeded").counter().count());
        assertEquals(2.0, registry.find("markrunner.units.total").tag("outcome", "failed").counter().count());
    }

    @Test
    @DisplayName("recordBatch skips zero unit counters")
    void recordBatchNoFailures() {
        metrics.recordBatch(BackendType.SEQUENTIAL, 10, 3, 0);

        assertNull(registry.find("markrunner.units.total").tag("outcome", "failed").counter());
    }

    @Test
    @DisplayName("recordStageResult counts by status")
    void recordStageResult() {
        metrics.recordStageResult(StageStatus.COMPLETE);
        metrics.recordStageResult(StageStatus.COMPLETE);
        metrics.recordStageResult(StageStatus.ABORTED);

        assertEquals(2.0, registry.find("markrunner.stage.results").tag("status", "complete").counter().count());
        assertEquals(1.0, registry.find("markrunner.stage.results").tag("status", "aborted").counter().count());
    }

    @Test
    @DisplayName("recordPlaceholders ignores zero")
    void recordPlaceholders() {
        metrics.recordPlaceholders("evaluate", 0);
        assertNull(registry.find("markrunner.placeholders.total").counter());

        metrics.recordPlaceholders("evaluate", 3);
        assertEquals(3.0, registry.find("markrunner.placeholders.total").tag("stage", "evaluate").counter().count());
    }

    @Test
    @DisplayName("recordFailure tags by category label")
    void recordFailure() {
        metrics.recordFailure(FailureCategory.QUOTA);

        assertEquals(1.0, registry.find("markrunner.failures.total")
                .tag("category", FailureCategory.QUOTA.label()).counter().count());
    }

    @Test
    @DisplayName("recordManifestSize records a distribution per stage")
    void recordManifestSize() {
        metrics.recordManifestSize("evaluate", 40);
        metrics.recordManifestSize("evaluate", 0);

        var summary = registry.find("markrunner.manifest.to_run").tag("stage", "evaluate").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(40.0, summary.totalAmount());
    }
}
