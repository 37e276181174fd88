package com.claudeye.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Claudeye CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) CLAUDEYE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CLAUDEYE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void scanSummary(int sessions, int enqueued, int succeeded, int failed, long ms) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Scan|@"));
        System.out.println("  Sessions scanned: " + sessions);
        System.out.println("  Items enqueued:   " + enqueued);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Results: @|fg(green) " + succeeded + " ok|@" +
                (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "")));
        System.out.println("  Duration: " + formatDuration(ms));
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
