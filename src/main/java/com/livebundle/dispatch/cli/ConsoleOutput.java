package com.livebundle.dispatch.cli;

import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the livebundle CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LIVEBUNDLE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LIVEBUNDLE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void serverUnavailable(int port) {
        error("Cannot connect to livebundle server at localhost:" + port);
        info("Start the server first: livebundle serve");
    }

    public static void buildResult(String target, boolean success, long bytes, long durationMs, String error) {
        String status = success ? "@|fg(green) OK  |@" : "@|fg(red) FAIL|@";
        String detail = success
                ? formatBytes(bytes) + " in " + formatDuration(durationMs)
                : (error != null ? error : "failed");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + String.format("%-16s", target) + " " + detail));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "file-changed" -> "@|fg(blue) [CHANGE]|@";
            case "rebuild-started" -> "@|bold,fg(yellow) [BUILD]|@";
            case "rebuild-completed" -> "@|fg(green),bold [DONE]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
    }
}
