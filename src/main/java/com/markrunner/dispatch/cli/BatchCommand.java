package com.markrunner.dispatch.cli;

import com.markrunner.core.failure.FailureAnalysis;
import com.markrunner.core.failure.FailureClassifier;
import com.markrunner.core.failure.FailureReportWriter;
import com.markrunner.core.manifest.ManifestFile;
import com.markrunner.core.model.BatchResult;
import com.markrunner.engine.BackendPreference;
import com.markrunner.engine.BatchConfigurationException;
import com.markrunner.engine.BatchRequest;
import com.markrunner.engine.EngineProperties;
import com.markrunner.engine.ExecutionEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: markrunner batch --tasks &lt;file&gt;
 * <p>
 * Runs every line of a task file as an independent unit with bounded concurrency and
 * writes {@code unit_<n>.log} per unit. Exit code 0 when every unit exited 0, otherwise
 * 64 plus the worst unit exit code (capped at 127).
 */
@Command(name = "batch", mixinStandardHelpOptions = true, description = "Run a task file as a parallel batch")
@Component
public class BatchCommand implements Callable<Integer> {

    @Option(names = {"--tasks", "-t"}, required = true, description = "Task file, one command (or payload) per line")
    private Path tasks;

    @Option(names = {"--jobs", "-j"}, description = "Maximum concurrent units (default: markrunner.engine.max-parallel)")
    private Integer jobs;

    @Option(names = {"--output-dir", "-o"}, description = "Log directory (default: ${DEFAULT-VALUE})",
            defaultValue = "logs")
    private Path outputDir;

    @Option(names = {"--command", "-c"}, description = "Command template; {} is replaced by each quoted task line")
    private String command;

    @Option(names = {"--verbose", "-v"}, description = "Print progress snapshots")
    private boolean verbose;

    @Option(names = {"--force-xargs"}, description = "Force the indirect-dispatch backend")
    private boolean forceXargs;

    @Option(names = {"--backend"}, description = "auto, coordinator, indirect or sequential")
    private String backend;

    @Option(names = {"--timeout"}, description = "Per-unit timeout in seconds, 0 for none")
    private Integer timeout;

    private final ExecutionEngine engine;
    private final EngineProperties properties;
    private final FailureClassifier classifier;
    private final FailureReportWriter reportWriter;
    private final ManifestFile manifestFile;

    public BatchCommand(ExecutionEngine engine, EngineProperties properties, FailureClassifier classifier,
                        FailureReportWriter reportWriter, ManifestFile manifestFile) {
        this.engine = engine;
        this.properties = properties;
        this.classifier = classifier;
        this.reportWriter = reportWriter;
        this.manifestFile = manifestFile;
    }

    @Override
    public Integer call() {
        BackendPreference preference;
        try {
            preference = forceXargs ? BackendPreference.INDIRECT : BackendPreference.parse(backend);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        var request = new BatchRequest(tasks, jobs != null ? jobs : properties.getMaxParallel(), outputDir,
                command, verbose, preference,
                timeout != null ? timeout : properties.getUnitTimeoutSeconds(), System.out);

        BatchResult result;
        try {
            result = engine.execute(request);
        } catch (BatchConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.batchSummary(result);
        if (result.failedCount() > 0) {
            FailureAnalysis analysis = classifier.classify(result.logDir(), unitKeys(), result.results().size());
            System.out.print(reportWriter.renderText(tasks.getFileName().toString(), analysis, false));
            try {
                reportWriter.write(tasks.getFileName().toString(), analysis);
            } catch (IOException e) {
                ConsoleOutput.warn("Could not write failure report: " + e.getMessage());
            }
            if (analysis.hasQuotaFailures()) {
                ConsoleOutput.quotaBanner();
            }
        }
        return result.engineExitCode();
    }

    private Map<Integer, String> unitKeys() {
        var keys = new LinkedHashMap<Integer, String>();
        try {
            manifestFile.readIndex(ManifestFile.indexPathFor(tasks)).forEach((id, e) -> keys.put(id, e.key()));
        } catch (IOException e) {
            ConsoleOutput.warn("Ignoring unreadable manifest index: " + e.getMessage());
        }
        return keys;
    }
}
