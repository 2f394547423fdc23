package com.markrunner.core.model;

/**
 * Buckets for failed units, in classification priority order.
 */
public enum FailureCategory {
    QUOTA("quota"),
    TIMEOUT("timeout"),
    NETWORK("network"),
    PERMISSION("permission"),
    TOOL_FAILURE("tool-failure"),
    UNKNOWN("unknown");

    private final String label;

    FailureCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
