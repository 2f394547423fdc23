package com.markrunner.engine;

import com.markrunner.core.logging.MdcContext;
import com.markrunner.core.manifest.ManifestFile;
import com.markrunner.core.model.BackendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Last-resort backend: runs units one at a time in this JVM. Needs nothing but a shell.
 */
public class SequentialBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(SequentialBackend.class);

    static final int EXIT_TIMED_OUT = 124;
    static final int EXIT_NOT_STARTED = 127;

    private final String shell;

    public SequentialBackend(String shell) {
        this.shell = shell;
    }

    @Override
    public BackendType type() {
        return BackendType.SEQUENTIAL;
    }

    @Override
    public void run(BatchPlan plan) throws IOException, InterruptedException {
        log.info("Running {} unit(s) sequentially", plan.ordinals().size());
        for (int ordinal : plan.ordinals()) {
            MdcContext.setUnit(ordinal);
            try {
                runUnit(plan, ordinal);
            } finally {
                MdcContext.clearUnit();
            }
            if (plan.progress() != null) {
                plan.progress().increment();
            }
        }
    }

    private void runUnit(BatchPlan plan, int ordinal) throws IOException, InterruptedException {
        Path logFile = UnitLog.path(plan.logDir(), ordinal);
        Optional<String> command = ManifestFile.readLine(plan.taskFile(), ordinal);
        long start = System.currentTimeMillis();

        if (command.isEmpty() || command.get().isBlank()) {
            UnitLog.appendLine(logFile, "no command at manifest line " + ordinal);
            UnitLog.appendTrailer(logFile, 0, EXIT_NOT_STARTED);
            return;
        }

        // The command runs from a script file so its length is not bounded by the argument limit.
        Path script = plan.scratchDir().resolve("unit_" + ordinal + ".sh");
        int exitCode;
        try {
            Process process;
            try {
                Files.createDirectories(plan.scratchDir());
                Files.writeString(script, command.get() + "\n", StandardCharsets.UTF_8);
                process = new ProcessBuilder(shell, script.toString())
                        .redirectErrorStream(true)
                        .redirectOutput(logFile.toFile())
                        .start();
            } catch (IOException e) {
                log.warn("Unit {} could not be started: {}", ordinal, e.getMessage());
                UnitLog.appendLine(logFile, "failed to start unit: " + e.getMessage());
                UnitLog.appendTrailer(logFile, System.currentTimeMillis() - start, EXIT_NOT_STARTED);
                return;
            }
            process.getOutputStream().close();

            try {
                exitCode = await(process, plan.unitTimeoutSeconds());
            } catch (InterruptedException e) {
                kill(process);
                throw e;
            }
        } finally {
            Files.deleteIfExists(script);
        }
        if (exitCode == EXIT_TIMED_OUT && plan.unitTimeoutSeconds() > 0) {
            UnitLog.appendLine(logFile, "unit timed out after " + plan.unitTimeoutSeconds() + "s");
        }
        long duration = System.currentTimeMillis() - start;
        UnitLog.appendTrailer(logFile, duration, exitCode);
        log.debug("Unit {} exited {} after {}ms", ordinal, exitCode, duration);
    }

    private static int await(Process process, int timeoutSeconds) throws InterruptedException {
        if (timeoutSeconds <= 0) {
            return process.waitFor();
        }
        if (process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
            return process.exitValue();
        }
        kill(process);
        process.waitFor();
        return EXIT_TIMED_OUT;
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
