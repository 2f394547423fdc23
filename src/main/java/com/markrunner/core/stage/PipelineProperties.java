package com.markrunner.core.stage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@ConfigurationProperties(prefix = "markrunner.pipeline")
public class PipelineProperties {

    private String workDir = ".";
    private String logsDir = "logs";
    private boolean resume = true;
    private boolean forceComplete = false;
    private List<StageDefinition> stages = new ArrayList<>();

    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }
    public String getLogsDir() { return logsDir; }
    public void setLogsDir(String logsDir) { this.logsDir = logsDir; }
    public boolean isResume() { return resume; }
    public void setResume(boolean resume) { this.resume = resume; }
    public boolean isForceComplete() { return forceComplete; }
    public void setForceComplete(boolean forceComplete) { this.forceComplete = forceComplete; }
    public List<StageDefinition> getStages() { return stages; }
    public void setStages(List<StageDefinition> stages) { this.stages = stages; }

    public Path resolvedWorkDir() {
        return Path.of(workDir).toAbsolutePath().normalize();
    }

    /** Logs root; relative paths are resolved against the work dir. */
    public Path resolvedLogsDir() {
        return resolvedWorkDir().resolve(logsDir).normalize();
    }

    public Optional<StageDefinition> stage(String id) {
        return stages.stream().filter(s -> s.getId().equals(id)).findFirst();
    }
}
