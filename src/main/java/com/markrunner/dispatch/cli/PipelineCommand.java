package com.markrunner.dispatch.cli;

import com.markrunner.core.events.EventBus;
import com.markrunner.core.manifest.InputCollectionException;
import com.markrunner.core.model.PipelineResult;
import com.markrunner.core.model.StageOutcome;
import com.markrunner.core.stage.PipelineOrchestrator;
import com.markrunner.core.stage.PipelineProperties;
import com.markrunner.core.stage.RunOptions;
import com.markrunner.engine.BackendPreference;
import com.markrunner.engine.BatchConfigurationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CLI command: markrunner pipeline
 * <p>
 * Runs the configured stages in order, resuming from whatever output already exists.
 * Exit code 0 when every executed stage completed, 1 when one aborted.
 */
@Command(name = "pipeline", mixinStandardHelpOptions = true, description = "Run the configured stages")
@Component
public class PipelineCommand implements Callable<Integer> {

    @Option(names = {"--stop-after"}, description = "Stop after this stage id")
    private String stopAfter;

    @Option(names = {"--only"}, description = "Run only this stage id")
    private String only;

    @Option(names = {"--no-resume"}, description = "Run every unit, even those whose output exists")
    private boolean noResume;

    @Option(names = {"--force-complete"}, description = "Write review placeholders for missing units instead of aborting")
    private boolean forceComplete;

    @Option(names = {"--parallel", "-j"}, description = "Concurrency for every stage")
    private Integer parallel;

    @Option(names = {"--force-xargs"}, description = "Force the indirect-dispatch backend")
    private boolean forceXargs;

    @Option(names = {"--backend"}, description = "auto, coordinator, indirect or sequential")
    private String backend;

    @Option(names = {"--verbose", "-v"}, description = "Print progress snapshots and stage events")
    private boolean verbose;

    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties properties;
    private final EventBus eventBus;

    public PipelineCommand(PipelineOrchestrator orchestrator, PipelineProperties properties, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        BackendPreference preference;
        try {
            preference = forceXargs ? BackendPreference.INDIRECT : BackendPreference.parse(backend);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        var options = new RunOptions(
                properties.isResume() && !noResume,
                properties.isForceComplete() || forceComplete,
                parallel, preference, stopAfter, only, verbose, System.out);

        var quotaHit = new AtomicBoolean(false);
        EventBus.Subscription quotaWatch = eventBus.subscribe("failures.classified", event -> {
            if (event.payload().containsKey("quota")) {
                quotaHit.set(true);
            }
        });
        EventBus.Subscription consoleWatch = verbose
                ? eventBus.subscribe(ConsoleOutput::watchEvent)
                : () -> { };

        PipelineResult result;
        try {
            result = orchestrator.run(options);
        } catch (BatchConfigurationException | InputCollectionException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } finally {
            quotaWatch.unsubscribe();
            consoleWatch.unsubscribe();
        }

        ConsoleOutput.rule();
        ConsoleOutput.info("Run " + result.runId());
        for (StageOutcome outcome : result.stages()) {
            ConsoleOutput.stageOutcome(outcome);
        }
        if (quotaHit.get()) {
            ConsoleOutput.quotaBanner();
        }
        if (result.aborted()) {
            ConsoleOutput.error("Pipeline aborted; earlier stage outputs are intact. Re-run to resume.");
            return 1;
        }
        if (result.stoppedAfter() != null) {
            ConsoleOutput.info("Stopped after stage " + result.stoppedAfter());
        }
        if (!result.placeholderKeys().isEmpty()) {
            ConsoleOutput.warn(result.placeholderKeys().size() + " unit(s) require manual review");
        }
        ConsoleOutput.success("Pipeline complete");
        return 0;
    }
}
