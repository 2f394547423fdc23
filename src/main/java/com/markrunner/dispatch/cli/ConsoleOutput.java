package com.markrunner.dispatch.cli;

import com.markrunner.core.events.PipelineEvent;
import com.markrunner.core.model.BatchResult;
import com.markrunner.core.model.StageOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the markrunner CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MARKRUNNER v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MARKRUNNER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void batchSummary(BatchResult result) {
        String failed = result.failedCount() > 0
                ? ", @|fg(red) " + result.failedCount() + " failed|@"
                : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Batch|@ " + result.results().size() + " unit(s) on " + result.backend()
                        + ": @|fg(green) " + result.succeededCount() + " succeeded|@" + failed
                        + " (" + formatDuration(result.elapsedMs()) + ")"));
    }

    public static void stageOutcome(StageOutcome outcome) {
        String status = switch (outcome.status()) {
            case COMPLETE -> outcome.isDegraded() ? "@|fg(yellow),bold DEGRADED|@" : "@|fg(green),bold COMPLETE|@";
            case ABORTED -> "@|fg(red),bold ABORTED|@";
            default -> "@|bold " + outcome.status() + "|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + outcome.stageId() + " (" + outcome.dispatched() + " dispatched, "
                        + outcome.expectedTotal() + " expected) " + outcome.message()));
        for (String key : outcome.placeholderKeys()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(yellow) ?|@ " + key + " requires manual review"));
        }
        for (String key : outcome.missingKeys()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + key + " missing"));
        }
    }

    /**
     * Printed when any unit hit a usage quota: the work done so far is kept and a re-run
     * picks up only the failed units.
     */
    public static void quotaBanner() {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) ================ QUOTA LIMIT REACHED ================|@"));
        System.out.println("Some units failed because the assistant's usage quota or rate limit was hit.");
        System.out.println("Completed outputs are preserved. Re-run the same command after the quota");
        System.out.println("resets and only the units without output will be dispatched again.");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) ===================================================|@"));
        System.out.println();
    }

    public static void watchEvent(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case "stage.started", "stage.skipped" -> "@|fg(cyan) [STAGE]|@";
            case "batch.started", "batch.completed" -> "@|fg(blue) [BATCH]|@";
            case "failures.classified" -> "@|fg(red) [FAILURES]|@";
            case "stage.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "stage.degraded" -> "@|fg(yellow),bold [DEGRADED]|@";
            case "stage.aborted" -> "@|fg(red),bold [ABORTED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.stageId() + " " + event.eventType() + " " + event.payload()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
