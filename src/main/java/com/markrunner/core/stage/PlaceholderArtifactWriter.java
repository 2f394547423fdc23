package com.markrunner.core.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.markrunner.core.manifest.UnitSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;

/**
 * Writes flagged stand-in artifacts for units that never produced output, so later stages
 * still see one artifact per unit.
 *
 * <p>Existing files are never overwritten. JSON outputs get a JSON document; everything else
 * a Markdown note. Both carry {@link #MARKER}.
 */
public class PlaceholderArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderArtifactWriter.class);

    public static final String MARKER = "REQUIRES_MANUAL_REVIEW";
    private static final int MARKER_SCAN_BYTES = 4096;

    private final ObjectMapper objectMapper;

    public PlaceholderArtifactWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return true if a placeholder was written, false if an artifact was already there
     */
    public boolean write(String stageId, UnitSpec unit, String reason) throws IOException {
        Path target = unit.expectedOutput();
        if (Files.exists(target)) {
            log.debug("Artifact for {} appeared in the meantime, leaving it alone", unit.key());
            return false;
        }
        Files.createDirectories(target.toAbsolutePath().getParent());

        byte[] content = isJson(target) ? json(stageId, unit, reason) : markdown(stageId, unit, reason);
        Path tmp = Files.createTempFile(target.toAbsolutePath().getParent(), ".placeholder-", ".tmp");
        try {
            Files.write(tmp, content);
            // No REPLACE_EXISTING: a file that shows up concurrently wins.
            Files.move(tmp, target);
        } catch (FileAlreadyExistsException e) {
            return false;
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Wrote placeholder for {} at {}", unit.key(), target);
        return true;
    }

    public static boolean isPlaceholder(Path artifact) {
        if (!Files.isRegularFile(artifact)) return false;
        try (InputStream in = Files.newInputStream(artifact)) {
            String head = new String(in.readNBytes(MARKER_SCAN_BYTES), StandardCharsets.UTF_8);
            return head.contains(MARKER);
        } catch (IOException e) {
            return false;
        }
    }

    private byte[] json(String stageId, UnitSpec unit, String reason) throws IOException {
        var doc = new LinkedHashMap<String, Object>();
        doc.put("status", MARKER);
        doc.put("requires_manual_review", true);
        doc.put("stage", stageId);
        doc.put("key", unit.key());
        doc.put("reason", reason);
        doc.put("generated_at", Instant.now().toString());
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(doc);
    }

    private static byte[] markdown(String stageId, UnitSpec unit, String reason) {
        String text = "# REQUIRES MANUAL REVIEW\n\n"
                + "<!-- " + MARKER + " -->\n\n"
                + "- Stage: " + stageId + "\n"
                + "- Unit: " + unit.key() + "\n"
                + "- Reason: " + reason + "\n"
                + "- Generated: " + Instant.now() + "\n\n"
                + "This file was generated because the unit did not produce its output. "
                + "Replace it with the real result after review.\n";
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static boolean isJson(Path p) {
        return p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
