package com.markrunner.core.model;

/**
 * Reporting counts from manifest construction. {@code expectedTotal == toRun + alreadyDone}.
 */
public record ManifestCounts(int expectedTotal, int toRun, int alreadyDone) {

    public ManifestCounts {
        if (expectedTotal != toRun + alreadyDone) {
            throw new IllegalArgumentException(
                    "expectedTotal " + expectedTotal + " != toRun " + toRun + " + alreadyDone " + alreadyDone);
        }
    }
}
