package com.markrunner.engine;

import com.markrunner.core.failure.FailureReportWriter;
import com.markrunner.core.manifest.CommandTemplate;
import com.markrunner.core.manifest.ManifestFile;
import com.markrunner.core.metrics.MarkrunnerMetrics;
import com.markrunner.core.model.BackendType;
import com.markrunner.core.model.BatchResult;
import com.markrunner.core.model.ExecutionResult;
import com.markrunner.core.progress.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Runs a manifest as a bounded-parallel batch and reports one result per unit.
 *
 * <p>A failing unit never affects its siblings. The only exceptions thrown are
 * {@link BatchConfigurationException}s for problems found before anything is dispatched.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final BackendSelector backendSelector;
    private final EngineProperties properties;
    private final MarkrunnerMetrics metrics;

    public ExecutionEngine(BackendSelector backendSelector,
                           EngineProperties properties,
                           @Autowired(required = false) MarkrunnerMetrics metrics) {
        this.backendSelector = backendSelector;
        this.properties = properties;
        this.metrics = metrics;
    }

    public BatchResult execute(BatchRequest request) {
        validate(request);
        Path logDir = request.logDir().toAbsolutePath().normalize();
        clearPreviousRun(logDir);

        Path scratch;
        try {
            scratch = Files.createTempDirectory("markrunner-batch-");
        } catch (IOException e) {
            throw new BatchConfigurationException("Cannot create scratch directory: " + e.getMessage(), e);
        }

        ExecutionBackend backend = null;
        try {
            Path taskFile = resolveTaskFile(request, scratch);
            int total = countLines(taskFile);
            backend = backendSelector.select(request.preference());
            if (total == 0) {
                log.info("Task file {} is empty, nothing to run", request.taskFile());
                return BatchResult.empty(backend.type(), logDir);
            }
            return run(request, backend, taskFile, total, logDir, scratch);
        } finally {
            deleteTree(scratch);
        }
    }

    private BatchResult run(BatchRequest request, ExecutionBackend backend, Path taskFile, int total,
                            Path logDir, Path scratch) {
        long start = System.currentTimeMillis();
        int concurrency = backend.type() == BackendType.SEQUENTIAL ? 1 : request.concurrency();
        log.info("Starting batch of {} unit(s) on {} backend, concurrency {}", total, backend.type(), concurrency);

        ProgressReporter progress = request.verbose() && backend.type() != BackendType.COORDINATOR
                ? ProgressReporter.create(scratch.resolve("progress"), total, request.console(),
                        properties.getProgressLockAttempts(), properties.getProgressLockSleepMs())
                : null;

        List<Integer> all = IntStream.rangeClosed(1, total).boxed().collect(Collectors.toList());
        BatchPlan plan = new BatchPlan(taskFile, all, total, concurrency, logDir, scratch,
                request.verbose(), request.unitTimeoutSeconds(), request.console(), progress);

        BackendType used = backend.type();
        try {
            backend.run(plan);
        } catch (IOException e) {
            log.warn("{} backend failed to start ({}), falling back to sequential execution",
                    backend.type(), e.getMessage());
            used = BackendType.SEQUENTIAL;
            runFallback(plan);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Batch interrupted; unfinished units are reported as crashed");
        } finally {
            if (progress != null) progress.close();
        }

        List<ExecutionResult> results = collect(logDir, total);
        var result = new BatchResult(used, logDir, results, System.currentTimeMillis() - start);
        log.info("Batch finished in {}ms: {} succeeded, {} failed",
                result.elapsedMs(), result.succeededCount(), result.failedCount());
        if (metrics != null) {
            metrics.recordBatch(used, result.elapsedMs(), result.succeededCount(), result.failedCount());
        }
        return result;
    }

    /**
     * Removes unit logs and the failure report left by an earlier batch in the same directory,
     * so neither the fallback nor the classifier mistakes them for this run's results.
     */
    private static void clearPreviousRun(Path logDir) {
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logDir)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (UnitLog.FILE_NAME.matcher(name).matches() || name.equals(FailureReportWriter.REPORT_FILE)) {
                    Files.deleteIfExists(p);
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new BatchConfigurationException("Cannot clear previous logs in " + logDir + ": " + e.getMessage(), e);
        }
        if (removed > 0) {
            log.info("Removed {} file(s) left by a previous batch in {}", removed, logDir);
        }
    }

    private void runFallback(BatchPlan plan) {
        List<Integer> pending = plan.ordinals().stream()
                .filter(o -> !Files.exists(UnitLog.path(plan.logDir(), o)))
                .collect(Collectors.toList());
        if (pending.isEmpty()) return;
        try {
            backendSelector.backend(BackendType.SEQUENTIAL).run(plan.withOrdinals(pending));
        } catch (IOException e) {
            log.error("Sequential fallback failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Batch interrupted during sequential fallback");
        }
    }

    private List<ExecutionResult> collect(Path logDir, int total) {
        var results = new ArrayList<ExecutionResult>(total);
        for (int ordinal = 1; ordinal <= total; ordinal++) {
            try {
                UnitLog.ensureComplete(logDir, ordinal, "worker exited without recording an exit code");
            } catch (IOException e) {
                log.warn("Could not write crash log for unit {}: {}", ordinal, e.getMessage());
            }
            results.add(UnitLog.read(logDir, ordinal));
        }
        return results;
    }

    private void validate(BatchRequest request) {
        if (request.concurrency() < 1) {
            throw new BatchConfigurationException("Concurrency must be at least 1, got " + request.concurrency());
        }
        Path taskFile = request.taskFile();
        if (taskFile == null || !Files.isRegularFile(taskFile) || !Files.isReadable(taskFile)) {
            throw new BatchConfigurationException("Task file not found or not readable: " + taskFile);
        }
        if (request.logDir() == null) {
            throw new BatchConfigurationException("No log directory given");
        }
        try {
            Files.createDirectories(request.logDir());
        } catch (IOException e) {
            throw new BatchConfigurationException("Cannot create log directory " + request.logDir(), e);
        }
        if (!Files.isWritable(request.logDir())) {
            throw new BatchConfigurationException("Log directory is not writable: " + request.logDir());
        }
        if (request.commandTemplate() != null) {
            try {
                CommandTemplate.of(request.commandTemplate());
            } catch (IllegalArgumentException e) {
                throw new BatchConfigurationException("Invalid command template: " + e.getMessage(), e);
            }
        }
    }

    /**
     * With a command template, each task line is a payload; the rendered commands go to a
     * scratch task file so every backend sees one complete command per line.
     */
    private Path resolveTaskFile(BatchRequest request, Path scratch) {
        Path taskFile = request.taskFile().toAbsolutePath().normalize();
        if (request.commandTemplate() == null) {
            return taskFile;
        }
        CommandTemplate template = CommandTemplate.of(request.commandTemplate());
        try {
            var rendered = new StringBuilder();
            for (String payload : ManifestFile.readLines(taskFile)) {
                rendered.append(template.renderPayload(payload)).append('\n');
            }
            Path resolved = scratch.resolve("tasks.resolved.txt");
            Files.writeString(resolved, rendered, StandardCharsets.UTF_8);
            return resolved;
        } catch (IOException e) {
            throw new BatchConfigurationException("Cannot read task file " + taskFile, e);
        } catch (IllegalArgumentException e) {
            throw new BatchConfigurationException("Cannot render command template: " + e.getMessage(), e);
        }
    }

    private static int countLines(Path taskFile) {
        try {
            return ManifestFile.countLines(taskFile);
        } catch (CharacterCodingException e) {
            throw new BatchConfigurationException("Task file " + taskFile + " is not valid UTF-8 text", e);
        } catch (IOException e) {
            throw new BatchConfigurationException("Cannot read task file " + taskFile, e);
        }
    }

    private static void deleteTree(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.debug("Could not remove scratch directory {}: {}", dir, e.getMessage());
        }
    }
}
