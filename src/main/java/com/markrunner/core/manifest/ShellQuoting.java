package com.markrunner.core.manifest;

/**
 * POSIX shell quoting for values substituted into command lines.
 */
public final class ShellQuoting {

    private ShellQuoting() {
        // utility class
    }

    /**
     * Wraps a value in single quotes so the shell passes it through as one literal word.
     * Embedded single quotes become {@code '\''}.
     */
    public static String quote(String value) {
        if (value == null || value.isEmpty()) return "''";
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
