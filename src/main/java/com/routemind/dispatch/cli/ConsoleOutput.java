package com.routemind.dispatch.cli;

import com.routemind.core.execution.TaskOutcome;
import com.routemind.core.model.HealthState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Routemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ROUTEMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ROUTEMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void backend(String name, HealthState state, String message) {
        String color = switch (state) {
            case ONLINE -> "fg(green)";
            case DEGRADED -> "fg(yellow)";
            case OFFLINE -> "fg(red)";
            case UNKNOWN -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-8s", state.name()) + "|@ "
                        + String.format("%-12s", name) + " " + message));
    }

    public static void taskResult(TaskOutcome outcome) {
        if (outcome.succeeded()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green) DONE|@   " + outcome.taskId() + " on " + outcome.backend()
                            + " (" + outcome.attempts() + " attempt" + (outcome.attempts() != 1 ? "s" : "")
                            + ", " + formatDuration(outcome.durationMs()) + ")"));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) FAILED|@ " + outcome.taskId() + ": " + outcome.failureReason()));
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
