package com.cratemind.dispatch.cli;

import com.cratemind.core.classify.RetryPolicy;
import com.cratemind.core.model.Category;
import com.cratemind.core.model.ClassificationSummary;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * ANSI-colored terminal output utilities for Cratemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CRATEMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CRATEMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void fileWritten(String label, Path path) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) +|@ " + label + ": " + path));
    }

    public static void summary(ClassificationSummary summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Classification Summary|@"));
        System.out.println("  Total tracks: " + summary.totalTracks());
        String rate = String.format("%.1f%%", summary.successRate() * 100);
        String rateColor = rateColor(summary.successRate());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Success rate: @|" + rateColor + " " + rate + "|@"));
        System.out.println("  Unclassified: " + summary.unclassified());
        System.out.println();
        System.out.println("  Category breakdown:");
        for (Category category : Category.values()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "    @|fg(yellow) %-10s|@ %d tracks (%.1f%%)",
                    category.label(), summary.count(category), summary.percentage(category))));
        }
    }

    /**
     * Green when the run as a whole would clear the per-batch acceptance threshold.
     */
    static String rateColor(double successRate) {
        return successRate >= RetryPolicy.ACCEPTANCE_THRESHOLD ? "fg(green)" : "fg(red)";
    }
}
