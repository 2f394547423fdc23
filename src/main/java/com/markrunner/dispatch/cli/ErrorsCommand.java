package com.markrunner.dispatch.cli;

import com.markrunner.core.failure.FailureAnalysis;
import com.markrunner.core.failure.FailureReportWriter;
import com.markrunner.core.stage.PipelineProperties;
import com.markrunner.core.stage.StageDefinition;
import com.markrunner.core.stage.StageOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: markrunner errors
 * <p>
 * Classifies the unit logs of each stage's last batch. Exit code 1 when any unit failed,
 * so scripts can gate on it.
 */
@Command(name = "errors", mixinStandardHelpOptions = true, description = "Review failed units from the last run")
@Component
public class ErrorsCommand implements Callable<Integer> {

    @Option(names = {"--stage", "-s"}, description = "Only this stage id")
    private String stageId;

    @Option(names = {"--json"}, description = "Machine-readable output")
    private boolean json;

    @Option(names = {"--quiet", "-q"}, description = "No output; exit code only")
    private boolean quiet;

    @Option(names = {"--summary"}, description = "Category counts only")
    private boolean summary;

    private final StageOrchestrator stageOrchestrator;
    private final FailureReportWriter reportWriter;
    private final PipelineProperties properties;

    public ErrorsCommand(StageOrchestrator stageOrchestrator, FailureReportWriter reportWriter,
                         PipelineProperties properties) {
        this.stageOrchestrator = stageOrchestrator;
        this.reportWriter = reportWriter;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        List<StageDefinition> stages = CommandSupport.selectStages(properties, stageId);
        if (stages.isEmpty()) {
            if (!quiet) ConsoleOutput.error(stageId != null ? "Unknown stage: " + stageId : "No stages configured");
            return 2;
        }

        Path logsRoot = properties.resolvedLogsDir();
        var reports = new ArrayList<Map<String, Object>>();
        boolean anyFailures = false;
        for (StageDefinition stage : stages) {
            FailureAnalysis analysis = stageOrchestrator.analyseLogs(stage.getId(), logsRoot);
            anyFailures |= !analysis.isClean();
            if (quiet) continue;
            if (json) {
                reports.add(reportWriter.toJson(stage.getId(), analysis));
            } else if (analysis.unitsSeen() == 0) {
                ConsoleOutput.info(stage.getId() + ": no unit logs");
            } else {
                System.out.print(reportWriter.renderText(stage.getId(), analysis, summary));
            }
        }

        if (json && !quiet) {
            try {
                System.out.println(reportWriter.toJsonString(reports));
            } catch (IOException e) {
                ConsoleOutput.error("Cannot render JSON: " + e.getMessage());
                return 1;
            }
        }
        return anyFailures ? 1 : 0;
    }
}
