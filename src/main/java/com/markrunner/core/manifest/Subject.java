package com.markrunner.core.manifest;

import java.util.Map;

/**
 * One entry of a stage's input collection, e.g. one submission.
 */
public record Subject(String key, Map<String, String> attributes) {

    public Subject {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Subject key must not be blank");
        }
        attributes = Map.copyOf(attributes);
    }
}
