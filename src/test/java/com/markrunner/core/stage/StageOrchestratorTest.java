package com.markrunner.core.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.markrunner.core.events.EventBus;
import com.markrunner.core.events.PipelineEvent;
import com.markrunner.core.failure.FailureClassifier;
import com.markrunner.core.failure.FailureReportWriter;
import com.markrunner.core.manifest.InputCollection;
import com.markrunner.core.manifest.InputCollectionException;
import com.markrunner.core.manifest.ManifestBuilder;
import com.markrunner.core.manifest.ManifestFile;
import com.markrunner.core.manifest.UnitPlanner;
import com.markrunner.core.model.StageOutcome;
import com.markrunner.core.model.StageStatus;
import com.markrunner.engine.BackendPreference;
import com.markrunner.engine.BackendSelector;
import com.markrunner.engine.EngineProperties;
import com.markrunner.engine.ExecutableLocator;
import com.markrunner.engine.ExecutionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class StageOrchestratorTest {

    private static final String FLAKY_COMMAND = "if [ {key} = s3 ]; then echo 'upstream error: boom'; exit 3; fi; "
            + "echo done > {output}";
    private static final String GOOD_COMMAND = "echo done > {output}";

    @TempDir
    Path workDir;

    private Path logsRoot;
    private EventBus eventBus;
    private List<PipelineEvent> events;
    private StageOrchestrator orchestrator;
    private RunOptions options;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(new ExecutableLocator().isAvailable("sh"), "needs a POSIX shell");
        ObjectMapper mapper = new ObjectMapper();
        EngineProperties engineProperties = new EngineProperties();
        ExecutionEngine engine = new ExecutionEngine(
                new BackendSelector(new ExecutableLocator(), engineProperties), engineProperties, null);

        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribe(events::add);

        orchestrator = new StageOrchestrator(
                new InputCollection(mapper),
                new UnitPlanner(),
                new ManifestBuilder(),
                new ManifestFile(mapper),
                new StageStateProbe(),
                engine,
                new FailureClassifier(null),
                new FailureReportWriter(mapper),
                new PlaceholderArtifactWriter(mapper),
                engineProperties,
                eventBus,
                null);
        options = RunOptions.defaults().withBackend(BackendPreference.SEQUENTIAL);

        logsRoot = workDir.resolve("logs");
        Files.writeString(workDir.resolve("subjects.txt"), "s1\ns2\ns3\ns4\ns5\n");
        Files.createDirectories(workDir.resolve("out"));
    }

    private StageDefinition stage(String command) {
        var stage = new StageDefinition("evaluate", command, "out/{key}.md");
        stage.setInput("subjects.txt");
        return stage;
    }

    private StageOutcome run(StageDefinition stage, RunOptions opts) {
        return orchestrator.run("RUN-TEST", stage, workDir, logsRoot, opts);
    }

    private Path artifact(String key) {
        return workDir.resolve("out").resolve(key + ".md");
    }

    private List<String> eventTypes() {
        return events.stream().map(PipelineEvent::eventType).toList();
    }

    @Nested
    @DisplayName("resume")
    class ResumeTests {

        @Test
        @DisplayName("a second run over a complete stage dispatches nothing and leaves artifacts untouched")
        void idempotentRerun() throws Exception {
            StageOutcome first = run(stage(GOOD_COMMAND), options);
            assertEquals(StageStatus.COMPLETE, first.status());
            assertEquals(5, first.dispatched());

            var before = new LinkedHashMap<String, FileTime>();
            for (String k : List.of("s1", "s2", "s3", "s4", "s5")) {
                Files.setLastModifiedTime(artifact(k), FileTime.fromMillis(1_000_000L));
                before.put(k, Files.getLastModifiedTime(artifact(k)));
            }
            events.clear();

            StageOutcome second = run(stage(GOOD_COMMAND), options);

            assertEquals(StageStatus.COMPLETE, second.status());
            assertEquals(0, second.dispatched());
            assertNull(second.batch());
            for (var e : before.entrySet()) {
                assertEquals(e.getValue(), Files.getLastModifiedTime(artifact(e.getKey())));
            }
            assertEquals(List.of("stage.started", "stage.skipped"), eventTypes());
        }

        @Test
        @DisplayName("only units whose artifact was deleted are dispatched again")
        void rerunsOnlyMissing() throws Exception {
            run(stage(GOOD_COMMAND), options);
            Files.delete(artifact("s2"));

            StageOutcome outcome = run(stage(GOOD_COMMAND), options);

            assertEquals(1, outcome.counts().toRun());
            assertEquals(4, outcome.counts().alreadyDone());
            assertEquals(1, ManifestFile.countLines(logsRoot.resolve("evaluate.txt")));
            assertTrue(Files.exists(artifact("s2")));
        }

        @Test
        @DisplayName("without resume every unit is dispatched")
        void noResume() {
            run(stage(GOOD_COMMAND), options);

            StageOutcome outcome = run(stage(GOOD_COMMAND), options.withResume(false));

            assertEquals(5, outcome.counts().toRun());
            assertEquals(StageStatus.COMPLETE, outcome.status());
        }
    }

    @Nested
    @DisplayName("failure handling")
    class FailureTests {

        @Test
        @DisplayName("aborts when a unit produced no output, and resumes only that unit once fixed")
        void abortsThenResumes() throws Exception {
            StageOutcome aborted = run(stage(FLAKY_COMMAND), options);

            assertEquals(StageStatus.ABORTED, aborted.status());
            assertEquals(List.of("s3"), aborted.missingKeys());
            assertFalse(Files.exists(artifact("s3")));
            assertEquals(4, List.of("s1", "s2", "s4", "s5").stream().filter(k -> Files.exists(artifact(k))).count());
            assertTrue(eventTypes().contains("failures.classified"));
            assertEquals("stage.aborted", eventTypes().get(eventTypes().size() - 1));

            Path report = logsRoot.resolve("evaluate").resolve(FailureReportWriter.REPORT_FILE);
            assertTrue(Files.readString(report).contains("\"s3\""));

            StageOutcome resumed = run(stage(GOOD_COMMAND), options);
            assertEquals(StageStatus.COMPLETE, resumed.status());
            assertEquals(1, resumed.dispatched());
            assertFalse(resumed.isDegraded());
        }

        @Test
        @DisplayName("force-complete fills missing units with placeholders")
        void degradedCompletion() throws Exception {
            StageOutcome outcome = run(stage(FLAKY_COMMAND), options.withForceComplete(true));

            assertEquals(StageStatus.COMPLETE, outcome.status());
            assertEquals(List.of("s3"), outcome.placeholderKeys());
            assertTrue(outcome.isDegraded());
            assertTrue(PlaceholderArtifactWriter.isPlaceholder(artifact("s3")));
            assertTrue(Files.readString(artifact("s3")).contains("exit code 3"));
            for (String k : List.of("s1", "s2", "s4", "s5")) {
                assertEquals("done\n", Files.readString(artifact(k)));
            }
            assertTrue(eventTypes().contains("stage.degraded"));
        }

        @Test
        @DisplayName("a stage that disallows degradation aborts even with force-complete")
        void degradationDisallowed() {
            StageDefinition stage = stage(FLAKY_COMMAND);
            stage.setAllowDegraded(false);

            StageOutcome outcome = run(stage, options.withForceComplete(true));

            assertEquals(StageStatus.ABORTED, outcome.status());
            assertFalse(Files.exists(artifact("s3")));
        }

        @Test
        @DisplayName("force-complete outside a run supports a dry run")
        void standaloneForceComplete() {
            StageDefinition stage = stage(FLAKY_COMMAND);
            run(stage, options);

            assertEquals(List.of("s3"), orchestrator.forceComplete(stage, workDir, logsRoot, true));
            assertFalse(Files.exists(artifact("s3")));

            assertEquals(List.of("s3"), orchestrator.forceComplete(stage, workDir, logsRoot, false));
            assertEquals(List.of("s3"), orchestrator.placeholderKeys(stage, workDir));
            assertTrue(orchestrator.probe(stage, workDir).isComplete());
        }

        @Test
        @DisplayName("analyses the latest logs of a stage")
        void analysesLogs() {
            run(stage(FLAKY_COMMAND), options);

            var analysis = orchestrator.analyseLogs("evaluate", logsRoot);

            assertEquals(1, analysis.failures().size());
            assertEquals("s3", analysis.failures().get(0).unitKey());
            assertEquals(3, analysis.failures().get(0).exitCode());
        }
    }

    @Nested
    @DisplayName("planning")
    class PlanningTests {

        @Test
        @DisplayName("a stage without input is a single unit keyed by its id")
        void singleUnitStage() throws Exception {
            var stage = new StageDefinition("summary", "echo summary > {output}", "summary.md");

            StageOutcome outcome = run(stage, options);

            assertEquals(StageStatus.COMPLETE, outcome.status());
            assertEquals(1, outcome.expectedTotal());
            assertEquals("summary\n", Files.readString(workDir.resolve("summary.md")));
        }

        @Test
        @DisplayName("items from a glob expand every subject, sorted by name")
        void itemsGlob() throws Exception {
            Files.createDirectories(workDir.resolve("questions"));
            Files.writeString(workDir.resolve("questions/q2.md"), "");
            Files.writeString(workDir.resolve("questions/q1.md"), "");
            StageDefinition stage = stage(GOOD_COMMAND);
            stage.setOutput("out/{key}_{item}.md");
            stage.setItemsGlob("questions/*.md");

            assertEquals(List.of("q1", "q2"), StageOrchestrator.items(stage, workDir));
            assertEquals(10, orchestrator.plan(stage, workDir).size());
            assertEquals("s1_q1", orchestrator.plan(stage, workDir).get(0).key());
        }

        @Test
        @DisplayName("a missing input collection is fatal for the stage")
        void missingInput() {
            StageDefinition stage = stage(GOOD_COMMAND);
            stage.setInput("absent.json");

            assertThrows(InputCollectionException.class, () -> run(stage, options));
        }

        @Test
        @DisplayName("a stage without a command is rejected")
        void missingCommand() {
            assertThrows(InputCollectionException.class,
                    () -> orchestrator.plan(new StageDefinition("x", " ", "out/{key}.md"), workDir));
        }
    }

    @Test
    @DisplayName("events carry batch counts")
    void batchEvents() {
        run(stage(GOOD_COMMAND), options);

        Map<String, Object> started = events.stream()
                .filter(e -> e.eventType().equals("batch.started")).findFirst().orElseThrow().payload();
        assertEquals(5, started.get("toRun"));
        assertEquals(0, started.get("alreadyDone"));
        PipelineEvent completed = events.stream()
                .filter(e -> e.eventType().equals("batch.completed")).findFirst().orElseThrow();
        assertEquals("SEQUENTIAL", completed.payload().get("backend"));
        assertEquals(5L, completed.payload().get("succeeded"));
        assertEquals("RUN-TEST", completed.runId());
        assertEquals("evaluate", completed.stageId());
    }
}
