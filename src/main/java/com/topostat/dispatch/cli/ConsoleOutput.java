package com.topostat.dispatch.cli;

import com.topostat.agent.ResultGatherer;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Topostat CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TOPOSTAT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TOPOSTAT]|@ " + message));
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

    public static void gathered(ResultGatherer.Gathered g) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Results: " + g.total() + " total, @|fg(green) " + g.valid() + " valid|@, "
                        + g.skipped() + " skipped"
                        + (g.invalid() > 0 ? ", @|fg(red) " + g.invalid() + " invalid|@" : ", 0 invalid")));
    }
}
