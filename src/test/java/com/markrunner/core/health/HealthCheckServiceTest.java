package com.markrunner.core.health;

import com.markrunner.core.model.BackendType;
import com.markrunner.core.stage.PipelineProperties;
import com.markrunner.core.stage.StageDefinition;
import com.markrunner.engine.BackendSelector;
import com.markrunner.engine.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path workDir;

    private BackendSelector selector;
    private PipelineProperties pipelineProperties;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        selector = mock(BackendSelector.class);
        pipelineProperties = new PipelineProperties();
        pipelineProperties.setWorkDir(workDir.toString());
        service = new HealthCheckService(selector, new EngineProperties(), pipelineProperties);
    }

    private void available(boolean shell, boolean coordinator, boolean dispatcher) {
        Map<BackendType, Boolean> map = new EnumMap<>(BackendType.class);
        map.put(BackendType.SEQUENTIAL, shell);
        map.put(BackendType.COORDINATOR, coordinator);
        map.put(BackendType.INDIRECT_DISPATCH, dispatcher);
        when(selector.availability()).thenReturn(map);
    }

    private HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns shell, coordinator, dispatcher, workdir and pipeline")
    void allComponents() {
        available(true, true, true);

        var components = service.checkAll().stream().map(HealthStatus::component).toList();

        assertEquals(List.of("shell", "coordinator", "dispatcher", "workdir", "pipeline"), components);
    }

    @Test
    @DisplayName("missing shell is DOWN")
    void shellDown() {
        available(false, false, false);

        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "shell").status());
    }

    @Test
    @DisplayName("missing backends are only DEGRADED")
    void backendsDegraded() {
        available(true, false, false);

        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.DEGRADED, component(results, "coordinator").status());
        assertEquals(HealthStatus.Status.DEGRADED, component(results, "dispatcher").status());
        assertEquals(HealthStatus.Status.UP, component(results, "shell").status());
    }

    @Test
    @DisplayName("a missing work dir is DOWN")
    void workDirMissing() {
        available(true, true, true);
        pipelineProperties.setWorkDir(workDir.resolve("absent").toString());

        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "workdir").status());
    }

    @Test
    @DisplayName("configured stages make the pipeline UP")
    void pipelineUp() {
        available(true, true, true);
        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "pipeline").status());

        pipelineProperties.setStages(List.of(new StageDefinition("evaluate", "cmd", "out/{key}.md")));
        assertEquals(HealthStatus.Status.UP, component(service.checkAll(), "pipeline").status());
    }
}
