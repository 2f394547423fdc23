package com.markrunner.core.model;

/**
 * Advisory classification of one failed unit.
 *
 * @param category        first matching signature category, or UNKNOWN
 * @param unitId          manifest ordinal
 * @param unitKey         subject key when a manifest index is available, else {@code unit_<id>}
 * @param exitCode        recorded exit code
 * @param evidenceSnippet the log line that matched, trimmed; empty for UNKNOWN
 */
public record FailureReport(
    FailureCategory category,
    int unitId,
    String unitKey,
    int exitCode,
    String evidenceSnippet
) {}
