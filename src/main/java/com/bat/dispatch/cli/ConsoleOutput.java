package com.bat.dispatch.cli;

import com.bat.core.model.TaskReport;
import com.bat.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Bat CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BAT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BAT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String role, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + role + "]|@ " + message));
    }

    public static void taskReport(int position, TaskReport report) {
        String status = report.status() == TaskStatus.COMPLETED
                ? "@|fg(green) COMPLETED|@"
                : "@|fg(red) " + report.status() + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("%d. %s [%s] %s (%s)", position, report.taskId(),
                        report.priority(), report.agentRole(), status)));
        System.out.println("   " + report.description());
        for (String line : report.result().split("\n")) {
            System.out.println("   > " + line);
        }
    }

    public static void summary(int total, long failed) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Tasks: @|fg(green) " + (total - failed) + " completed|@"
                        + (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "")));
    }
}
