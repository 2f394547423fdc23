package com.markrunner.core.stage;

import com.markrunner.core.logging.MdcContext;
import com.markrunner.core.model.PipelineResult;
import com.markrunner.core.model.StageOutcome;
import com.markrunner.core.model.StageStatus;
import com.markrunner.engine.BatchConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs the configured stages in order. Stage N+1 never starts before stage N is terminal,
 * and the run halts at the first ABORTED stage with every earlier artifact left in place.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final StageOrchestrator stageOrchestrator;
    private final PipelineProperties properties;

    public PipelineOrchestrator(StageOrchestrator stageOrchestrator, PipelineProperties properties) {
        this.stageOrchestrator = stageOrchestrator;
        this.properties = properties;
    }

    public PipelineResult run(RunOptions options) {
        List<StageDefinition> stages = selectStages(options);
        String runId = "RUN-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        Path workDir = properties.resolvedWorkDir();
        Path logsRoot = properties.resolvedLogsDir();

        MdcContext.setRun(runId);
        try {
            log.info("Pipeline {} starting: {} stage(s), resume={}, forceComplete={}",
                    runId, stages.size(), options.resume(), options.forceComplete());
            var outcomes = new ArrayList<StageOutcome>();
            String stoppedAfter = null;
            for (StageDefinition stage : stages) {
                StageOutcome outcome = stageOrchestrator.run(runId, stage, workDir, logsRoot, options);
                outcomes.add(outcome);
                if (outcome.status() == StageStatus.ABORTED) {
                    log.error("Stage {} aborted: {}", stage.getId(), outcome.message());
                    break;
                }
                if (stage.getId().equals(options.stopAfter())) {
                    stoppedAfter = stage.getId();
                    log.info("Stopping after stage {} as requested", stoppedAfter);
                    break;
                }
            }
            var result = new PipelineResult(runId, outcomes, stoppedAfter);
            log.info("Pipeline {} finished: {}", runId, result.aborted() ? "ABORTED" : "COMPLETE");
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    List<StageDefinition> selectStages(RunOptions options) {
        List<StageDefinition> all = properties.getStages();
        if (all.isEmpty()) {
            throw new BatchConfigurationException("No stages configured under markrunner.pipeline.stages");
        }
        for (String id : new String[] {options.only(), options.stopAfter()}) {
            if (id != null && properties.stage(id).isEmpty()) {
                throw new BatchConfigurationException("Unknown stage '" + id + "'");
            }
        }
        if (options.only() != null) {
            return List.of(properties.stage(options.only()).orElseThrow());
        }
        return all;
    }
}
