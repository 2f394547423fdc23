package com.markrunner.core.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a stage's input collection.
 *
 * <p>Supported formats:
 * <ul>
 *   <li>{@code .json}: an array of objects, or an object whose first array-valued field holds
 *       them (e.g. {@code {"submissions": [...]}}). Each object must carry the key field; its
 *       scalar fields become template variables.</li>
 *   <li>anything else: one key per line; blank lines and {@code #} comments are skipped.</li>
 * </ul>
 *
 * <p>Any read or shape problem is fatal for the whole stage, never a per-unit concern.
 */
public class InputCollection {

    private static final Logger log = LoggerFactory.getLogger(InputCollection.class);

    private final ObjectMapper objectMapper;

    public InputCollection(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Subject> load(Path file, String keyField) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new InputCollectionException("Input collection not found: " + file);
        }
        List<Subject> subjects;
        try {
            subjects = file.getFileName().toString().endsWith(".json")
                    ? loadJson(file, keyField)
                    : loadLines(file);
        } catch (IOException e) {
            throw new InputCollectionException("Failed to read input collection " + file, e);
        }

        var seen = new HashSet<String>();
        for (var s : subjects) {
            if (!seen.add(s.key())) {
                throw new InputCollectionException("Duplicate key '" + s.key() + "' in " + file);
            }
        }
        log.debug("Loaded {} subjects from {}", subjects.size(), file);
        return subjects;
    }

    private List<Subject> loadLines(Path file) throws IOException {
        var subjects = new ArrayList<Subject>();
        for (String line : Files.readAllLines(file)) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            subjects.add(new Subject(trimmed, Map.of()));
        }
        return subjects;
    }

    private List<Subject> loadJson(Path file, String keyField) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        JsonNode array = root;
        if (root != null && root.isObject()) {
            array = null;
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                if (field.getValue().isArray()) {
                    array = field.getValue();
                    break;
                }
            }
        }
        if (array == null || !array.isArray()) {
            throw new InputCollectionException("Expected a JSON array of subjects in " + file);
        }

        var subjects = new ArrayList<Subject>();
        int index = 0;
        for (JsonNode node : array) {
            index++;
            if (!node.isObject()) {
                throw new InputCollectionException("Entry " + index + " in " + file + " is not an object");
            }
            JsonNode keyNode = node.get(keyField);
            if (keyNode == null || keyNode.isNull() || keyNode.asText().isBlank()) {
                throw new InputCollectionException(
                        "Entry " + index + " in " + file + " has no '" + keyField + "' field");
            }
            var attributes = new LinkedHashMap<String, String>();
            node.fields().forEachRemaining(f -> {
                if (f.getValue().isValueNode() && !f.getValue().isNull()) {
                    attributes.put(f.getKey(), f.getValue().asText());
                }
            });
            subjects.add(new Subject(keyNode.asText(), attributes));
        }
        return subjects;
    }
}
