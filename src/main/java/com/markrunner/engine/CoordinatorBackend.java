package com.markrunner.engine;

import com.markrunner.core.manifest.ShellQuoting;
import com.markrunner.core.model.BackendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs units through a job coordinator (GNU parallel), which reads the task file on
 * standard input and draws its own progress bar.
 */
public class CoordinatorBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorBackend.class);

    static final String STATUS_PREFIX = "parallel:";

    private final String binary;
    private final String shell;

    public CoordinatorBackend(String binary, String shell) {
        this.binary = binary;
        this.shell = shell;
    }

    @Override
    public BackendType type() {
        return BackendType.COORDINATOR;
    }

    @Override
    public void run(BatchPlan plan) throws IOException, InterruptedException {
        if (!plan.isFullRange()) {
            throw new IllegalArgumentException("Coordinator backend runs whole task files only");
        }
        Path worker = WorkerScript.extractTo(plan.scratchDir());

        List<String> command = new ArrayList<>(List.of(binary, "--will-cite",
                "--jobs", String.valueOf(plan.concurrency()), "--line-buffer"));
        if (plan.verbose()) {
            command.add("--bar");
        }
        // parallel joins these into one shell line; {#} is the input line number. The worker
        // reads the command from the task file itself, so a long line never reaches argv.
        command.addAll(List.of(
                ShellQuoting.quote(shell),
                ShellQuoting.quote(worker.toString()),
                "by-index",
                ShellQuoting.quote(plan.taskFile().toString()),
                ShellQuoting.quote(plan.logDir().toString()),
                "-",
                String.valueOf(plan.unitCount()),
                String.valueOf(plan.unitTimeoutSeconds()),
                "{#}"));

        ProcessBuilder pb = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectInput(plan.taskFile().toFile());

        log.info("Dispatching {} unit(s) via {} with concurrency {}",
                plan.unitCount(), binary, plan.concurrency());
        Process process = pb.start();
        OutputPump pump = OutputPump.start(process.getInputStream(), plan.console(),
                CoordinatorBackend::isUserFacing, "parallel-output");
        try {
            int exit = process.waitFor();
            pump.await();
            log.debug("{} exited {}", binary, exit);
        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            throw e;
        }
    }

    static boolean isUserFacing(String line) {
        return !line.startsWith(STATUS_PREFIX);
    }
}
