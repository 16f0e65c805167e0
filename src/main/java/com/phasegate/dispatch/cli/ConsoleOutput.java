package com.phasegate.dispatch.cli;

import com.phasegate.core.model.AuditLogEntry;
import com.phasegate.core.model.GatePrompt;
import picocli.CommandLine;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * ANSI-colored terminal output utilities for the PhaseGate CLI.
 */
public class ConsoleOutput {

    static final String RULE = "=".repeat(70);

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

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

    public static void gate(GatePrompt prompt) {
        System.out.println();
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold [Phase " + prompt.phase() + "]|@ " + prompt.phaseName()
                        + " @|fg(blue) -> Assigned to: " + prompt.agent() + "|@"));
        System.out.println(RULE);
        System.out.println("Artifact: " + prompt.artifact());
        System.out.println("-> " + prompt.instructions());
    }

    public static void auditRow(int index, AuditLogEntry entry) {
        String color = switch (entry.action()) {
            case APPROVED -> "fg(green)";
            case PAUSED -> "fg(yellow)";
            case COMPLETED -> "fg(cyan),bold";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %4d  %-21s %-5d @|%s %-10s|@ %-22s %s",
                index, TIMESTAMP.format(entry.timestamp()), entry.phase(), color,
                entry.action().wireName(), truncate(entry.agent(), 22), entry.comment())));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause == t || cause.getMessage() == null
                ? t.getMessage()
                : t.getMessage() + " (" + cause.getMessage() + ")";
    }
}
