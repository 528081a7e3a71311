package com.crewloop.dispatch.cli;

import com.crewloop.core.health.HealthStatus;
import com.crewloop.core.worker.OrchestratorEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the crewloop CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CREWLOOP v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CREWLOOP]|@ " + message));
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

    public static void health(HealthStatus check) {
        String label = check.component() + ": " + check.detail();
        switch (check.status()) {
            case UP -> success(label);
            case DOWN -> error(label);
            case DEGRADED -> warn(label);
        }
    }

    public static void orchestratorEvent(OrchestratorEvent event) {
        String worker = event.workerName() != null ? event.workerName() : "-";
        Object taskId = event.data().get("taskId");
        String line = switch (event.type()) {
            case OrchestratorEvent.WORKER_STARTED -> "@|fg(blue) [" + worker + "]|@ started";
            case OrchestratorEvent.WORKER_STOPPED -> "@|fg(blue) [" + worker + "]|@ stopped ("
                    + event.data().get("reason") + ")";
            case OrchestratorEvent.WORKER_PAUSED -> "@|fg(yellow) [" + worker + "]|@ paused";
            case OrchestratorEvent.WORKER_RESUMED -> "@|fg(yellow) [" + worker + "]|@ resumed";
            case OrchestratorEvent.TASK_STARTED -> "@|fg(blue) [" + worker + "]|@ task " + taskId
                    + describe(event.data().get("taskTitle"));
            case OrchestratorEvent.TASK_COMPLETED -> "@|fg(green),bold [" + worker + "]|@ completed " + taskId
                    + " after " + event.data().get("attempts") + " attempt(s)";
            case OrchestratorEvent.ERROR -> "@|fg(red) [" + worker + "]|@ " + event.data().get("message");
            case OrchestratorEvent.STATE_CHANGED -> "@|fg(cyan) [CREWLOOP]|@ " + event.data().get("to");
            default -> "@|fg(white) [" + event.type() + "]|@ " + worker;
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String flat = s.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }

    private static String describe(Object title) {
        return title != null ? ": " + title : "";
    }
}
