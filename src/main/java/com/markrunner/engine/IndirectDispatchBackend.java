package com.markrunner.engine;

import com.markrunner.core.model.BackendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs units through the dispatch utility (xargs). Only line numbers travel through its
 * argument vector; each worker reads its own command from the task file, so command length
 * is never bounded by the system argument limit.
 */
public class IndirectDispatchBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(IndirectDispatchBackend.class);

    private final String binary;
    private final String shell;
    private final int lockAttempts;
    private final long lockSleepMs;

    public IndirectDispatchBackend(String binary, String shell, int lockAttempts, long lockSleepMs) {
        this.binary = binary;
        this.shell = shell;
        this.lockAttempts = lockAttempts;
        this.lockSleepMs = lockSleepMs;
    }

    @Override
    public BackendType type() {
        return BackendType.INDIRECT_DISPATCH;
    }

    @Override
    public void run(BatchPlan plan) throws IOException, InterruptedException {
        Path worker = WorkerScript.extractTo(plan.scratchDir());
        String progressDir = plan.progress() != null ? plan.progress().directory().toString() : "-";

        List<String> command = new ArrayList<>(List.of(
                binary, "-P", String.valueOf(plan.concurrency()), "-n", "1",
                shell, worker.toString(), "by-index",
                plan.taskFile().toString(),
                plan.logDir().toString(),
                progressDir,
                String.valueOf(plan.unitCount()),
                String.valueOf(plan.unitTimeoutSeconds())));

        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        pb.environment().put("PROGRESS_LOCK_ATTEMPTS", String.valueOf(lockAttempts));
        pb.environment().put("PROGRESS_LOCK_SLEEP", String.format(Locale.ROOT, "%.3f", lockSleepMs / 1000.0));

        log.info("Dispatching {} unit(s) via {} with concurrency {}",
                plan.ordinals().size(), binary, plan.concurrency());
        Process process = pb.start();
        OutputPump pump = OutputPump.start(process.getInputStream(), plan.console(), line -> true, "xargs-output");

        try {
            try (Writer stdin = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)) {
                for (int ordinal : plan.ordinals()) {
                    stdin.write(ordinal + "\n");
                }
            }
            int exit = process.waitFor();
            pump.await();
            // 123 means some worker reported a failing unit; the per-unit logs carry the details.
            if (exit != 0 && exit != 123) {
                log.warn("{} exited {}; units without a log will be reported as crashed", binary, exit);
            }
        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            throw e;
        }
    }
}
