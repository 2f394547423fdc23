package com.markrunner.core.failure;

import com.markrunner.core.metrics.MarkrunnerMetrics;
import com.markrunner.core.model.FailureCategory;
import com.markrunner.core.model.FailureReport;
import com.markrunner.engine.UnitLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Buckets failed units by scanning their logs for known signatures. Advisory only: it
 * never retries and never touches artifacts.
 */
@Service
public class FailureClassifier {

    private static final Logger log = LoggerFactory.getLogger(FailureClassifier.class);

    static final int SNIPPET_LIMIT = 200;
    static final int TIMEOUT_EXIT = 124;

    private final List<FailureSignature> signatures;
    private final MarkrunnerMetrics metrics;

    @Autowired
    public FailureClassifier(@Autowired(required = false) MarkrunnerMetrics metrics) {
        this(FailureSignature.DEFAULTS, metrics);
    }

    public FailureClassifier(List<FailureSignature> signatures, MarkrunnerMetrics metrics) {
        this.signatures = List.copyOf(signatures);
        this.metrics = metrics;
    }

    /**
     * A match: the category and the line that triggered it.
     */
    public record Match(FailureCategory category, String evidence) {}

    /**
     * Scans every {@code unit_<n>.log} in the directory. A unit has failed when its trailer
     * is non-zero or missing.
     *
     * @param unitKeys ordinal to subject key, from the manifest index; may be empty
     */
    public FailureAnalysis classify(Path logDir, Map<Integer, String> unitKeys) {
        return classify(logDir, unitKeys, Integer.MAX_VALUE);
    }

    /**
     * As {@link #classify(Path, Map)}, ignoring logs whose ordinal exceeds {@code maxOrdinal}.
     */
    public FailureAnalysis classify(Path logDir, Map<Integer, String> unitKeys, int maxOrdinal) {
        var logs = new TreeMap<Integer, Path>();
        if (Files.isDirectory(logDir)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(logDir, "unit_*.log")) {
                for (Path p : stream) {
                    OptionalInt ordinal = UnitLog.ordinalOf(p);
                    if (ordinal.isPresent() && ordinal.getAsInt() <= maxOrdinal) logs.put(ordinal.getAsInt(), p);
                }
            } catch (IOException e) {
                log.warn("Cannot list unit logs in {}: {}", logDir, e.getMessage());
            }
        }

        var failures = new ArrayList<FailureReport>();
        for (var entry : logs.entrySet()) {
            int ordinal = entry.getKey();
            Path logFile = entry.getValue();
            int exit = UnitLog.exitCode(logFile).orElse(255);
            if (exit == 0) continue;

            Match match = classifyLog(logFile, exit);
            String key = unitKeys.getOrDefault(ordinal, "unit_" + ordinal);
            failures.add(new FailureReport(match.category(), ordinal, key, exit, match.evidence()));
            if (metrics != null) metrics.recordFailure(match.category());
        }

        var analysis = new FailureAnalysis(logDir, logs.size(), failures);
        if (!analysis.isClean()) {
            log.info("Classified {} failed unit(s) in {}: {}", failures.size(), logDir, analysis.countsByCategory());
        }
        return analysis;
    }

    Match classifyLog(Path logFile, int exitCode) {
        String body;
        try {
            body = UnitLog.body(logFile);
        } catch (IOException e) {
            return new Match(FailureCategory.UNKNOWN, "log unreadable: " + e.getMessage());
        }
        return classifyText(body)
                .orElseGet(() -> exitCode == TIMEOUT_EXIT
                        ? new Match(FailureCategory.TIMEOUT, "exit code " + TIMEOUT_EXIT)
                        : new Match(FailureCategory.UNKNOWN, ""));
    }

    /**
     * First signature, in priority order, that matches any non-noise line.
     */
    public Optional<Match> classifyText(String text) {
        List<String> lines = text.lines()
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .filter(l -> !FailureSignature.isNoise(l.toLowerCase(Locale.ROOT)))
                .toList();
        for (FailureSignature signature : signatures) {
            for (String line : lines) {
                if (signature.matches(line.toLowerCase(Locale.ROOT))) {
                    return Optional.of(new Match(signature.category(), snippet(line)));
                }
            }
        }
        return Optional.empty();
    }

    static String snippet(String line) {
        return line.length() <= SNIPPET_LIMIT ? line : line.substring(0, SNIPPET_LIMIT - 3) + "...";
    }
}
