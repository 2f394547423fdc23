package com.markrunner.core.failure;

import com.markrunner.core.model.FailureCategory;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substrings that identify one failure category in a unit log.
 */
public record FailureSignature(FailureCategory category, List<String> patterns) {

    public FailureSignature {
        patterns = patterns.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
    }

    /** Built-in signatures, in priority order. */
    public static final List<FailureSignature> DEFAULTS = List.of(
            new FailureSignature(FailureCategory.QUOTA, List.of(
                    "limit reached", "quota exceeded", "rate limit", "rate_limit", "usage limit",
                    "too many requests", "resource_exhausted", "resets 3am", "/upgrade to max",
                    "/extra-usage")),
            new FailureSignature(FailureCategory.TIMEOUT, List.of(
                    "timed out", "timeout", "deadline exceeded", "etimedout")),
            new FailureSignature(FailureCategory.NETWORK, List.of(
                    "connection refused", "connection reset", "econnrefused", "econnreset", "enotfound",
                    "network is unreachable", "could not resolve host", "name resolution",
                    "socket hang up", "ssl handshake")),
            new FailureSignature(FailureCategory.PERMISSION, List.of(
                    "permission denied", "eacces", "operation not permitted", "unauthorized",
                    "forbidden", "invalid api key", "authentication failed")),
            new FailureSignature(FailureCategory.TOOL_FAILURE, List.of(
                    "command not found", "no such file or directory", "traceback (most recent call last)",
                    "fatal error", "panic:", "segmentation fault", "exception", "no command at manifest line",
                    "failed to start unit", "worker exited without recording", "error:"))
    );

    /**
     * Startup chatter of assistant CLIs that mentions words like "error" or "limit" without
     * meaning a failure.
     */
    public static final List<String> NOISE = List.of("yolo mode", "cached credentials");

    public boolean matches(String lowerCaseLine) {
        for (String p : patterns) {
            if (lowerCaseLine.contains(p)) return true;
        }
        return false;
    }

    static boolean isNoise(String lowerCaseLine) {
        for (String n : NOISE) {
            if (lowerCaseLine.contains(n)) return true;
        }
        return false;
    }
}
