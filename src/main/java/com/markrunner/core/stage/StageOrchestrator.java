package com.markrunner.core.stage;

import com.markrunner.core.events.EventBus;
import com.markrunner.core.events.PipelineEvent;
import com.markrunner.core.failure.FailureAnalysis;
import com.markrunner.core.failure.FailureClassifier;
import com.markrunner.core.failure.FailureReportWriter;
import com.markrunner.core.logging.MdcContext;
import com.markrunner.core.manifest.CommandTemplate;
import com.markrunner.core.manifest.InputCollection;
import com.markrunner.core.manifest.InputCollectionException;
import com.markrunner.core.manifest.ManifestBuildResult;
import com.markrunner.core.manifest.ManifestBuilder;
import com.markrunner.core.manifest.ManifestFile;
import com.markrunner.core.manifest.Subject;
import com.markrunner.core.manifest.UnitPlanner;
import com.markrunner.core.manifest.UnitSpec;
import com.markrunner.core.metrics.MarkrunnerMetrics;
import com.markrunner.core.model.BatchResult;
import com.markrunner.core.model.FailureReport;
import com.markrunner.core.model.ManifestCounts;
import com.markrunner.core.model.StageOutcome;
import com.markrunner.core.model.StageState;
import com.markrunner.core.model.StageStatus;
import com.markrunner.engine.BatchRequest;
import com.markrunner.engine.EngineProperties;
import com.markrunner.engine.ExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs one stage through PENDING, RUNNING and a terminal state.
 *
 * <p>Every invocation re-derives the stage state from disk, so calling it again after an
 * external problem is fixed only dispatches the units that still lack output.
 */
@Service
public class StageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StageOrchestrator.class);

    private final InputCollection inputCollection;
    private final UnitPlanner unitPlanner;
    private final ManifestBuilder manifestBuilder;
    private final ManifestFile manifestFile;
    private final StageStateProbe probe;
    private final ExecutionEngine engine;
    private final FailureClassifier classifier;
    private final FailureReportWriter reportWriter;
    private final PlaceholderArtifactWriter placeholderWriter;
    private final EngineProperties engineProperties;
    private final EventBus eventBus;
    private final MarkrunnerMetrics metrics;

    public StageOrchestrator(InputCollection inputCollection,
                             UnitPlanner unitPlanner,
                             ManifestBuilder manifestBuilder,
                             ManifestFile manifestFile,
                             StageStateProbe probe,
                             ExecutionEngine engine,
                             FailureClassifier classifier,
                             FailureReportWriter reportWriter,
                             PlaceholderArtifactWriter placeholderWriter,
                             EngineProperties engineProperties,
                             EventBus eventBus,
                             @Autowired(required = false) MarkrunnerMetrics metrics) {
        this.inputCollection = inputCollection;
        this.unitPlanner = unitPlanner;
        this.manifestBuilder = manifestBuilder;
        this.manifestFile = manifestFile;
        this.probe = probe;
        this.engine = engine;
        this.classifier = classifier;
        this.reportWriter = reportWriter;
        this.placeholderWriter = placeholderWriter;
        this.engineProperties = engineProperties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public StageOutcome run(String runId, StageDefinition stage, Path workDir, Path logsRoot, RunOptions options) {
        String stageId = stage.getId();
        MdcContext.setStage(runId, stageId);
        try {
            publish("stage.started", runId, stageId, Map.of("name", stage.displayName()));
            StageOutcome outcome = runStage(runId, stage, workDir, logsRoot, options);
            if (metrics != null) metrics.recordStageResult(outcome.status());
            return outcome;
        } finally {
            MdcContext.clearStage();
        }
    }

    private StageOutcome runStage(String runId, StageDefinition stage, Path workDir, Path logsRoot,
                                  RunOptions options) {
        String stageId = stage.getId();
        List<UnitSpec> specs = plan(stage, workDir);

        StageState state = options.resume() ? probe.probe(stageId, specs) : StageState.fresh(stageId, specs.size());
        if (options.resume() && state.isComplete()) {
            log.info("Stage {} already complete ({} artifacts), skipping", stageId, specs.size());
            publish("stage.skipped", runId, stageId, Map.of("expected", specs.size()));
            return new StageOutcome(stageId, StageStatus.COMPLETE, specs.size(),
                    new ManifestCounts(specs.size(), 0, specs.size()), null,
                    List.of(), probe.placeholderKeys(specs), "already complete");
        }

        ManifestBuildResult built = manifestBuilder.build(stageId, specs, state);
        if (metrics != null) metrics.recordManifestSize(stageId, built.counts().toRun());

        Path taskFile = logsRoot.resolve(stageId + ".txt");
        Path logDir = logsRoot.resolve(stageId);
        manifestFile.write(built.manifest(), taskFile);
        resetLogDir(logDir);

        int concurrency = concurrencyFor(stage, options);
        publish("batch.started", runId, stageId, Map.of(
                "toRun", built.counts().toRun(),
                "alreadyDone", built.counts().alreadyDone(),
                "concurrency", concurrency));
        BatchResult batch = engine.execute(new BatchRequest(taskFile, concurrency, logDir, null,
                options.verbose(), options.backend(), engineProperties.getUnitTimeoutSeconds(), options.console()));
        publish("batch.completed", runId, stageId, Map.of(
                "backend", batch.backend().name(),
                "succeeded", batch.succeededCount(),
                "failed", batch.failedCount(),
                "elapsedMs", batch.elapsedMs()));

        FailureAnalysis analysis = analyse(stageId, taskFile, logDir);
        if (!analysis.isClean()) {
            var byCategory = new LinkedHashMap<String, Object>();
            analysis.countsByCategory().forEach((c, n) -> byCategory.put(c.label(), n));
            publish("failures.classified", runId, stageId, byCategory);
        }

        StageState after = probe.probe(stageId, specs);
        List<String> missing = probe.missingKeys(specs, after);
        if (missing.isEmpty()) {
            log.info("Stage {} complete: {} of {} artifacts present", stageId, specs.size(), specs.size());
            publish("stage.completed", runId, stageId, Map.of("expected", specs.size()));
            return new StageOutcome(stageId, StageStatus.COMPLETE, specs.size(), built.counts(), batch,
                    List.of(), probe.placeholderKeys(specs), "complete");
        }

        log.warn("Stage {} partial: {} of {} artifacts missing", stageId, missing.size(), specs.size());
        if (options.forceComplete() && stage.isAllowDegraded()) {
            List<String> written = degrade(stageId, specs, missing, analysis);
            if (metrics != null) metrics.recordPlaceholders(stageId, written.size());
            publish("stage.degraded", runId, stageId, Map.of("placeholders", written));
            return new StageOutcome(stageId, StageStatus.COMPLETE, specs.size(), built.counts(), batch,
                    List.of(), probe.placeholderKeys(specs),
                    written.size() + " unit(s) completed with placeholders requiring manual review");
        }

        String message = missing.size() + " of " + specs.size()
                + " unit(s) have no output; fix the cause and re-run to resume, or use --force-complete";
        publish("stage.aborted", runId, stageId, Map.of("missing", missing));
        return new StageOutcome(stageId, StageStatus.ABORTED, specs.size(), built.counts(), batch,
                missing, List.of(), message);
    }

    /**
     * Expands a stage into its full unit list; resume filtering happens later.
     */
    public List<UnitSpec> plan(StageDefinition stage, Path workDir) {
        if (stage.getCommand() == null || stage.getCommand().isBlank()) {
            throw new InputCollectionException("Stage " + stage.getId() + " has no command");
        }
        if (stage.getOutput() == null || stage.getOutput().isBlank()) {
            throw new InputCollectionException("Stage " + stage.getId() + " has no output template");
        }
        CommandTemplate command;
        CommandTemplate output;
        try {
            command = CommandTemplate.of(stage.getCommand());
            output = CommandTemplate.of(stage.getOutput());
        } catch (IllegalArgumentException e) {
            throw new InputCollectionException("Stage " + stage.getId() + ": " + e.getMessage(), e);
        }

        List<Subject> subjects = stage.isBatch()
                ? inputCollection.load(workDir.resolve(stage.getInput()), stage.getKeyField())
                : List.of(new Subject(stage.getId(), Map.of()));
        return unitPlanner.plan(stage.getId(), subjects, items(stage, workDir), command, output, Map.of(), workDir);
    }

    /**
     * Current on-disk state without running anything, for status reporting.
     */
    public StageState probe(StageDefinition stage, Path workDir) {
        return probe.probe(stage.getId(), plan(stage, workDir));
    }

    public List<String> placeholderKeys(StageDefinition stage, Path workDir) {
        return probe.placeholderKeys(plan(stage, workDir));
    }

    /**
     * Writes placeholders for every unit of the stage that has no output, outside a pipeline run.
     *
     * @return keys that got (or, when {@code dryRun}, would get) a placeholder
     */
    public List<String> forceComplete(StageDefinition stage, Path workDir, Path logsRoot, boolean dryRun) {
        List<UnitSpec> specs = plan(stage, workDir);
        List<String> missing = probe.missingKeys(specs, probe.probe(stage.getId(), specs));
        if (dryRun || missing.isEmpty()) return missing;

        FailureAnalysis analysis = analyseLogs(stage.getId(), logsRoot);
        List<String> written = degrade(stage.getId(), specs, missing, analysis);
        if (metrics != null) metrics.recordPlaceholders(stage.getId(), written.size());
        return written;
    }

    /**
     * Classifies the logs left by the stage's most recent batch without writing anything.
     */
    public FailureAnalysis analyseLogs(String stageId, Path logsRoot) {
        Path logDir = logsRoot.resolve(stageId);
        if (!Files.isDirectory(logDir)) {
            return new FailureAnalysis(logDir, 0, List.of());
        }
        return classifier.classify(logDir, unitKeys(logsRoot.resolve(stageId + ".txt")));
    }

    private List<String> degrade(String stageId, List<UnitSpec> specs, List<String> missing, FailureAnalysis analysis) {
        Map<String, FailureReport> byKey = new HashMap<>();
        for (FailureReport f : analysis.failures()) byKey.put(f.unitKey(), f);

        var written = new ArrayList<String>();
        for (UnitSpec spec : specs) {
            if (!missing.contains(spec.key())) continue;
            try {
                if (placeholderWriter.write(stageId, spec, reason(byKey.get(spec.key())))) {
                    written.add(spec.key());
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write placeholder for " + spec.key(), e);
            }
        }
        log.warn("Stage {}: wrote {} placeholder artifact(s)", stageId, written.size());
        return written;
    }

    private static String reason(FailureReport failure) {
        if (failure == null) {
            return "unit produced no output artifact";
        }
        String base = "unit failed with exit code " + failure.exitCode() + " (" + failure.category().label() + ")";
        return failure.evidenceSnippet().isEmpty() ? base : base + ": " + failure.evidenceSnippet();
    }

    private FailureAnalysis analyse(String stageId, Path taskFile, Path logDir) {
        FailureAnalysis analysis = classifier.classify(logDir, unitKeys(taskFile));
        try {
            reportWriter.write(stageId, analysis);
        } catch (IOException e) {
            log.warn("Could not write failure report for {}: {}", stageId, e.getMessage());
        }
        return analysis;
    }

    private Map<Integer, String> unitKeys(Path taskFile) {
        try {
            Map<Integer, String> keys = new LinkedHashMap<>();
            manifestFile.readIndex(ManifestFile.indexPathFor(taskFile)).forEach((id, e) -> keys.put(id, e.key()));
            return keys;
        } catch (IOException e) {
            log.debug("No readable manifest index next to {}: {}", taskFile, e.getMessage());
            return Map.of();
        }
    }

    private int concurrencyFor(StageDefinition stage, RunOptions options) {
        if (options.parallel() != null) return options.parallel();
        if (stage.getMaxParallel() != null) return stage.getMaxParallel();
        return engineProperties.getMaxParallel();
    }

    /**
     * Static items, or file names (without extension) matching the glob under the work dir.
     */
    static List<String> items(StageDefinition stage, Path workDir) {
        if (stage.getItemsGlob() == null || stage.getItemsGlob().isBlank()) {
            return stage.getItems() == null ? List.of() : stage.getItems();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + stage.getItemsGlob());
        try (Stream<Path> files = Files.walk(workDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(workDir.relativize(p)))
                    .map(p -> stripExtension(p.getFileName().toString()))
                    .sorted(Comparator.naturalOrder())
                    .distinct()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new InputCollectionException("Cannot evaluate items glob " + stage.getItemsGlob(), e);
        }
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void resetLogDir(Path logDir) {
        try {
            if (Files.isDirectory(logDir)) {
                try (Stream<Path> walk = Files.walk(logDir)) {
                    for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                        if (!p.equals(logDir)) Files.deleteIfExists(p);
                    }
                }
            }
            Files.createDirectories(logDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot reset log directory " + logDir, e);
        }
    }

    private void publish(String type, String runId, String stageId, Map<String, Object> payload) {
        eventBus.publish(PipelineEvent.of(type, runId, stageId, payload));
    }
}
