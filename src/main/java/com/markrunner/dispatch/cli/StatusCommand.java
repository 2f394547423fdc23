package com.markrunner.dispatch.cli;

import com.markrunner.core.manifest.InputCollectionException;
import com.markrunner.core.model.StageState;
import com.markrunner.core.model.StageStatus;
import com.markrunner.core.stage.PipelineProperties;
import com.markrunner.core.stage.StageDefinition;
import com.markrunner.core.stage.StageOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: markrunner status
 * <p>
 * Probes each stage's expected outputs and reports how far it got. Reads only; never dispatches.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show per-stage completion from disk")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--stage", "-s"}, description = "Only this stage id")
    private String stageId;

    private final StageOrchestrator stageOrchestrator;
    private final PipelineProperties properties;

    public StatusCommand(StageOrchestrator stageOrchestrator, PipelineProperties properties) {
        this.stageOrchestrator = stageOrchestrator;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<StageDefinition> stages = CommandSupport.selectStages(properties, stageId);
        if (stages.isEmpty()) {
            ConsoleOutput.error(stageId != null ? "Unknown stage: " + stageId : "No stages configured");
            return 1;
        }

        Path workDir = properties.resolvedWorkDir();
        for (StageDefinition stage : stages) {
            try {
                StageState state = stageOrchestrator.probe(stage, workDir);
                int placeholders = stageOrchestrator.placeholderKeys(stage, workDir).size();
                StageStatus status = statusOf(state);
                String line = String.format("%-20s %-8s %d/%d complete", stage.getId(), status,
                        state.completedKeys().size(), state.expectedTotal())
                        + (placeholders > 0 ? ", " + placeholders + " placeholder(s)" : "");
                switch (status) {
                    case COMPLETE -> ConsoleOutput.success(line);
                    case PARTIAL -> ConsoleOutput.warn(line);
                    default -> ConsoleOutput.info(line);
                }
            } catch (InputCollectionException e) {
                ConsoleOutput.error(stage.getId() + ": " + e.getMessage());
            }
        }
        return 0;
    }

    static StageStatus statusOf(StageState state) {
        if (state.isComplete()) return StageStatus.COMPLETE;
        return state.completedKeys().isEmpty() ? StageStatus.PENDING : StageStatus.PARTIAL;
    }
}
