package com.markrunner.core.health;

import com.markrunner.core.model.BackendType;
import com.markrunner.core.stage.PipelineProperties;
import com.markrunner.engine.BackendSelector;
import com.markrunner.engine.EngineProperties;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final BackendSelector backendSelector;
    private final EngineProperties engineProperties;
    private final PipelineProperties pipelineProperties;

    public HealthCheckService(BackendSelector backendSelector,
                              EngineProperties engineProperties,
                              PipelineProperties pipelineProperties) {
        this.backendSelector = backendSelector;
        this.engineProperties = engineProperties;
        this.pipelineProperties = pipelineProperties;
    }

    public List<HealthStatus> checkAll() {
        Map<BackendType, Boolean> available = backendSelector.availability();
        var results = new ArrayList<HealthStatus>();
        results.add(checkShell(available.get(BackendType.SEQUENTIAL)));
        results.add(checkBackend("coordinator", engineProperties.getCoordinatorBinary(),
                available.get(BackendType.COORDINATOR)));
        results.add(checkBackend("dispatcher", engineProperties.getDispatchBinary(),
                available.get(BackendType.INDIRECT_DISPATCH)));
        results.add(checkWorkDir());
        results.add(checkStages());
        return results;
    }

    private HealthStatus checkShell(boolean present) {
        if (present) {
            return new HealthStatus("shell", HealthStatus.Status.UP,
                    engineProperties.getShell() + " found on PATH", Map.of());
        }
        return new HealthStatus("shell", HealthStatus.Status.DOWN,
                engineProperties.getShell() + " not found; no unit can run", Map.of());
    }

    // A missing optional backend only costs speed, so it reports DEGRADED.
    private HealthStatus checkBackend(String component, String binary, boolean present) {
        if (present) {
            return new HealthStatus(component, HealthStatus.Status.UP,
                    binary + " available", Map.of("binary", binary));
        }
        return new HealthStatus(component, HealthStatus.Status.DEGRADED,
                binary + " not found, falling back to a slower backend", Map.of("binary", binary));
    }

    private HealthStatus checkWorkDir() {
        Path workDir = pipelineProperties.resolvedWorkDir();
        if (!Files.isDirectory(workDir)) {
            return new HealthStatus("workdir", HealthStatus.Status.DOWN,
                    "Work dir does not exist: " + workDir, Map.of());
        }
        if (!Files.isWritable(workDir)) {
            return new HealthStatus("workdir", HealthStatus.Status.DOWN,
                    "Work dir is not writable: " + workDir, Map.of());
        }
        return new HealthStatus("workdir", HealthStatus.Status.UP,
                "Work dir writable: " + workDir, Map.of());
    }

    private HealthStatus checkStages() {
        int count = pipelineProperties.getStages().size();
        if (count == 0) {
            return new HealthStatus("pipeline", HealthStatus.Status.DEGRADED,
                    "No stages configured; only the batch command is usable", Map.of());
        }
        return new HealthStatus("pipeline", HealthStatus.Status.UP,
                count + " stage(s) configured", Map.of("stages", String.valueOf(count)));
    }
}
