package com.markrunner.core.failure;

import com.markrunner.core.model.FailureCategory;
import com.markrunner.core.model.FailureReport;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classifier output for one log directory.
 *
 * @param logDir     the scanned directory
 * @param unitsSeen  number of unit logs found
 * @param failures   one report per failed unit, in ordinal order
 */
public record FailureAnalysis(Path logDir, int unitsSeen, List<FailureReport> failures) {

    public FailureAnalysis {
        failures = List.copyOf(failures);
    }

    public boolean isClean() {
        return failures.isEmpty();
    }

    public boolean hasQuotaFailures() {
        return failures.stream().anyMatch(f -> f.category() == FailureCategory.QUOTA);
    }

    public Map<FailureCategory, Integer> countsByCategory() {
        var counts = new EnumMap<FailureCategory, Integer>(FailureCategory.class);
        for (FailureReport f : failures) {
            counts.merge(f.category(), 1, Integer::sum);
        }
        return counts;
    }
}
