package com.phasegate.dispatch.cli;

import com.phasegate.core.ledger.LedgerEntry;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Phasegate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PHASEGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PHASEGATE]|@ " + message));
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

    public static void spanLine(String name, long ok, long error) {
        String errors = error > 0 ? "@|fg(red) " + error + " error|@" : "0 error";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  %-28s @|fg(green) %d ok|@, %s", name, ok, errors)));
    }

    public static void counterLine(String counter, double total) {
        String value = total == Math.rint(total) ? String.valueOf((long) total) : String.valueOf(total);
        System.out.printf("  %-28s %s%n", counter, value);
    }

    public static void ledgerEntry(LedgerEntry entry) {
        String from = entry.fromPhase() != null ? entry.fromPhase().name() : "-";
        String evidence = entry.evidenceValidated() ? "@|fg(green) validated|@" : "@|faint unvalidated|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %s  @|fg(blue) %-9s|@ %-10s -> %-10s %s%s",
                entry.timestamp(), entry.kind(), from, entry.toPhase().name(), evidence,
                entry.evidenceArtifacts().isEmpty() ? "" : " " + entry.evidenceArtifacts())));
    }
}
