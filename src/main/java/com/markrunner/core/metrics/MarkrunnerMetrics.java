package com.markrunner.core.metrics;

import com.markrunner.core.model.BackendType;
import com.markrunner.core.model.FailureCategory;
import com.markrunner.core.model.StageStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for batch and pipeline execution.
 */
@Service
public class MarkrunnerMetrics {

    private final MeterRegistry registry;

    public MarkrunnerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBatch(BackendType backend, long ms, long succeeded, long failed) {
        String tag = backend.name().toLowerCase(Locale.ROOT);
        Timer.builder("markrunner.batch.duration")
                .tag("backend", tag)
                .register(registry)
                .record(Duration.ofMillis(ms));
        if (succeeded > 0) {
            Counter.builder("markrunner.units.total")
                    .tag("outcome", "succeeded")
                    .register(registry)
                    .increment(succeeded);
        }
        if (failed > 0) {
            Counter.builder("markrunner.units.total")
                    .tag("outcome", "failed")
                    .register(registry)
                    .increment(failed);
        }
    }

    public void recordStageResult(StageStatus status) {
        Counter.builder("markrunner.stage.results")
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordPlaceholders(String stageId, int count) {
        if (count <= 0) return;
        Counter.builder("markrunner.placeholders.total")
                .description("Placeholder artifacts written for degraded units")
                .tag("stage", stageId)
                .register(registry)
                .increment(count);
    }

    public void recordFailure(FailureCategory category) {
        Counter.builder("markrunner.failures.total")
                .tag("category", category.label())
                .register(registry)
                .increment();
    }

    /**
     * Units a stage actually dispatched after resume filtering.
     */
    public void recordManifestSize(String stageId, int toRun) {
        DistributionSummary.builder("markrunner.manifest.to_run")
                .description("Units dispatched per stage after resume filtering")
                .tag("stage", stageId)
                .register(registry)
                .record(toRun);
    }
}
