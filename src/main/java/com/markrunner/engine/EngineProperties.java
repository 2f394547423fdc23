package com.markrunner.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "markrunner.engine")
public class EngineProperties {

    private int maxParallel = 4;
    private String backend = "auto";
    private int unitTimeoutSeconds = 0;
    private String coordinatorBinary = "parallel";
    private String dispatchBinary = "xargs";
    private String shell = "sh";
    private int progressLockAttempts = 100;
    private long progressLockSleepMs = 10;

    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }
    public int getUnitTimeoutSeconds() { return unitTimeoutSeconds; }
    public void setUnitTimeoutSeconds(int unitTimeoutSeconds) { this.unitTimeoutSeconds = unitTimeoutSeconds; }
    public String getCoordinatorBinary() { return coordinatorBinary; }
    public void setCoordinatorBinary(String coordinatorBinary) { this.coordinatorBinary = coordinatorBinary; }
    public String getDispatchBinary() { return dispatchBinary; }
    public void setDispatchBinary(String dispatchBinary) { this.dispatchBinary = dispatchBinary; }
    public String getShell() { return shell; }
    public void setShell(String shell) { this.shell = shell; }
    public int getProgressLockAttempts() { return progressLockAttempts; }
    public void setProgressLockAttempts(int progressLockAttempts) { this.progressLockAttempts = progressLockAttempts; }
    public long getProgressLockSleepMs() { return progressLockSleepMs; }
    public void setProgressLockSleepMs(long progressLockSleepMs) { this.progressLockSleepMs = progressLockSleepMs; }

    public BackendPreference getBackendPreference() {
        return BackendPreference.parse(backend);
    }
}
