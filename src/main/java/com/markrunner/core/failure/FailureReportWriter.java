package com.markrunner.core.failure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.markrunner.core.model.FailureCategory;
import com.markrunner.core.model.FailureReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders a {@link FailureAnalysis} as {@code failure-report.json} and as operator text.
 */
public class FailureReportWriter {

    public static final String REPORT_FILE = "failure-report.json";

    private final ObjectMapper objectMapper;

    public FailureReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path write(String stageId, FailureAnalysis analysis) throws IOException {
        Path target = analysis.logDir().resolve(REPORT_FILE);
        Files.createDirectories(analysis.logDir());
        Path tmp = target.resolveSibling(REPORT_FILE + ".tmp");
        objectMapper.writeValue(tmp.toFile(), toJson(stageId, analysis));
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    public Map<String, Object> toJson(String stageId, FailureAnalysis analysis) {
        var counts = new LinkedHashMap<String, Integer>();
        analysis.countsByCategory().forEach((c, n) -> counts.put(c.label(), n));

        var json = new LinkedHashMap<String, Object>();
        json.put("stage", stageId);
        json.put("logDir", analysis.logDir().toString());
        json.put("unitsScanned", analysis.unitsSeen());
        json.put("failed", analysis.failures().size());
        json.put("byCategory", counts);
        json.put("failures", analysis.failures().stream().map(FailureReportWriter::entry).toList());
        return json;
    }

    public String toJsonString(Object value) throws IOException {
        return objectMapper.writeValueAsString(value);
    }

    private static Map<String, Object> entry(FailureReport f) {
        var m = new LinkedHashMap<String, Object>();
        m.put("unitId", f.unitId());
        m.put("key", f.unitKey());
        m.put("category", f.category().label());
        m.put("exitCode", f.exitCode());
        m.put("evidence", f.evidenceSnippet());
        return m;
    }

    /**
     * Human report; {@code summaryOnly} prints the category counts without per-unit lines.
     */
    public String renderText(String stageId, FailureAnalysis analysis, boolean summaryOnly) {
        var sb = new StringBuilder();
        sb.append("Stage ").append(stageId).append(": ")
          .append(analysis.failures().size()).append(" failed of ")
          .append(analysis.unitsSeen()).append(" unit log(s)\n");
        for (Map.Entry<FailureCategory, Integer> e : analysis.countsByCategory().entrySet()) {
            sb.append("  ").append(String.format("%-13s", e.getKey().label())).append(e.getValue()).append('\n');
        }
        if (!summaryOnly) {
            for (FailureReport f : analysis.failures()) {
                sb.append("  [").append(f.category().label()).append("] unit ").append(f.unitId())
                  .append(" (").append(f.unitKey()).append(") exit ").append(f.exitCode());
                if (!f.evidenceSnippet().isEmpty()) {
                    sb.append(": ").append(f.evidenceSnippet());
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
