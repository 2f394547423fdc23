package com.markrunner.engine;

import java.util.Locale;

/**
 * Requested backend. AUTO and COORDINATOR both walk down the capability chain when the
 * preferred tool is missing; SEQUENTIAL always wins.
 */
public enum BackendPreference {
    AUTO,
    COORDINATOR,
    INDIRECT,
    SEQUENTIAL;

    public static BackendPreference parse(String value) {
        if (value == null || value.isBlank()) return AUTO;
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (v) {
            case "AUTO" -> AUTO;
            case "COORDINATOR", "PARALLEL" -> COORDINATOR;
            case "INDIRECT", "INDIRECT_DISPATCH", "XARGS" -> INDIRECT;
            case "SEQUENTIAL" -> SEQUENTIAL;
            default -> throw new IllegalArgumentException(
                    "Unknown backend '" + value + "'. Valid: auto, coordinator, indirect, sequential");
        };
    }
}
