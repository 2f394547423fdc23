package com.markrunner.dispatch.cli;

import com.markrunner.core.manifest.InputCollectionException;
import com.markrunner.core.stage.PipelineProperties;
import com.markrunner.core.stage.StageDefinition;
import com.markrunner.core.stage.StageOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: markrunner force-complete
 * <p>
 * Writes "requires manual review" placeholders for every unit without output, so later
 * stages can run. Existing artifacts are never touched.
 */
@Command(name = "force-complete", mixinStandardHelpOptions = true,
        description = "Write review placeholders for units without output")
@Component
public class ForceCompleteCommand implements Callable<Integer> {

    @Option(names = {"--stage", "-s"}, description = "Only this stage id")
    private String stageId;

    @Option(names = {"--dry-run"}, description = "List the units that would get a placeholder")
    private boolean dryRun;

    private final StageOrchestrator stageOrchestrator;
    private final PipelineProperties properties;

    public ForceCompleteCommand(StageOrchestrator stageOrchestrator, PipelineProperties properties) {
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

        int total = 0;
        for (StageDefinition stage : stages) {
            List<String> keys;
            try {
                keys = stageOrchestrator.forceComplete(stage, properties.resolvedWorkDir(),
                        properties.resolvedLogsDir(), dryRun);
            } catch (InputCollectionException e) {
                ConsoleOutput.error(stage.getId() + ": " + e.getMessage());
                return 1;
            }
            total += keys.size();
            if (keys.isEmpty()) {
                ConsoleOutput.success(stage.getId() + ": nothing missing");
                continue;
            }
            ConsoleOutput.warn(stage.getId() + ": " + keys.size() + " unit(s) "
                    + (dryRun ? "would get" : "got") + " a placeholder");
            for (String key : keys) {
                System.out.println("    " + key);
            }
        }
        if (total > 0 && !dryRun) {
            ConsoleOutput.info("Placeholders are marked for manual review");
        }
        return 0;
    }
}
