package com.markrunner.core.stage;

import com.markrunner.core.model.ManifestCounts;
import com.markrunner.core.model.PipelineResult;
import com.markrunner.core.model.StageOutcome;
import com.markrunner.core.model.StageStatus;
import com.markrunner.engine.BatchConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineOrchestratorTest {

    private StageOrchestrator stageOrchestrator;
    private PipelineProperties properties;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        stageOrchestrator = mock(StageOrchestrator.class);
        properties = new PipelineProperties();
        properties.setStages(List.of(
                new StageDefinition("evaluate", "cmd", "eval/{key}.md"),
                new StageDefinition("validate", "cmd", "val/{key}.md"),
                new StageDefinition("finalize", "cmd", "final/{key}.json")));
        orchestrator = new PipelineOrchestrator(stageOrchestrator, properties);
    }

    private void outcomes(Set<String> aborting) {
        when(stageOrchestrator.run(anyString(), any(), any(), any(), any())).thenAnswer(inv -> {
            StageDefinition stage = inv.getArgument(1);
            StageStatus status = aborting.contains(stage.getId()) ? StageStatus.ABORTED : StageStatus.COMPLETE;
            return new StageOutcome(stage.getId(), status, 2, new ManifestCounts(2, 2, 0), null,
                    List.of(), List.of(), status.name());
        });
    }

    private static List<String> ids(PipelineResult result) {
        return result.stages().stream().map(StageOutcome::stageId).toList();
    }

    @Test
    @DisplayName("runs every stage in order")
    void runsAll() {
        outcomes(Set.of());

        PipelineResult result = orchestrator.run(RunOptions.defaults());

        assertEquals(List.of("evaluate", "validate", "finalize"), ids(result));
        assertFalse(result.aborted());
        assertTrue(result.runId().startsWith("RUN-"));
    }

    @Test
    @DisplayName("halts at the first aborted stage")
    void haltsOnAbort() {
        outcomes(Set.of("validate"));

        PipelineResult result = orchestrator.run(RunOptions.defaults());

        assertEquals(List.of("evaluate", "validate"), ids(result));
        assertTrue(result.aborted());
        verify(stageOrchestrator, never()).run(anyString(), argThat(s -> s.getId().equals("finalize")),
                any(), any(), any());
    }

    @Test
    @DisplayName("stops after the requested stage")
    void stopAfter() {
        outcomes(Set.of());

        PipelineResult result = orchestrator.run(RunOptions.defaults().withStopAfter("evaluate"));

        assertEquals(List.of("evaluate"), ids(result));
        assertEquals("evaluate", result.stoppedAfter());
    }

    @Test
    @DisplayName("runs a single stage with --only")
    void only() {
        outcomes(Set.of());

        assertEquals(List.of("finalize"), ids(orchestrator.run(RunOptions.defaults().withOnly("finalize"))));
    }

    @Test
    @DisplayName("rejects unknown stage ids")
    void unknownStage() {
        assertThrows(BatchConfigurationException.class,
                () -> orchestrator.run(RunOptions.defaults().withStopAfter("publish")));
    }

    @Test
    @DisplayName("rejects an empty pipeline")
    void noStages() {
        properties.setStages(List.of());
        assertThrows(BatchConfigurationException.class, () -> orchestrator.run(RunOptions.defaults()));
    }
}
