package com.shannon.dispatch.cli;

import com.shannon.core.error.ClassifiedException;
import com.shannon.core.events.ShannonEvent;
import com.shannon.core.model.Session;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Shannon CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) SHANNON v0.1.0|@"));
        System.out.println("----------------------------------");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [SHANNON]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    /** Prints a progress event published on the event bus. */
    public static void event(ShannonEvent event) {
        String subject = event.agentName() == null ? "" : event.agentName() + " ";
        String line = switch (event.eventType()) {
            case "phase.started" -> "@|bold,fg(yellow) [PHASE]|@ " + event.payload().get("phase")
                    + " (" + event.payload().get("agents") + " agents)";
            case "agent.started" -> "@|fg(blue) [AGENT]|@ " + subject + "started";
            case "agent.attempt.started" -> "@|fg(blue) [AGENT]|@ " + subject + "attempt "
                    + event.payload().get("attempt") + "/" + event.payload().get("maxAttempts");
            case "agent.attempt.failed" -> "@|fg(yellow) [RETRY]|@ " + subject + "attempt "
                    + event.payload().get("attempt") + " " + event.payload().get("reason");
            case "agent.completed" -> "@|fg(green) [DONE]|@ " + subject + "in " + event.payload().get("attempts")
                    + " attempt(s), " + formatCost(event.payload().get("costUsd"));
            case "agent.skipped" -> "@|fg(white) [SKIP]|@ " + subject + event.payload().get("reason");
            case "agent.failed" -> "@|bold,fg(red) [FAILED]|@ " + subject + event.payload().get("classification");
            case "wave.member.completed" -> "@|fg(magenta) [WAVE]|@ " + subject
                    + event.payload().get("status") + " (" + formatDuration(toLong(event.payload().get("durationMs"))) + ")";
            case "session.completed" -> "@|bold,fg(green) [COMPLETE]|@ session " + event.sessionId();
            default -> null;
        };
        if (line != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        }
    }

    public static void failure(ClassifiedException e) {
        error((e.agentName() == null ? "Run" : e.agentName()) + ": " + e.guidance());
        error("  " + e.getMessage());
        if (e.attempts() > 0) {
            info("  Attempts: " + e.attempts() + ", cost: " + formatCost(e.totalCostUsd()));
        }
    }

    public static void sessionSummary(Session session) {
        System.out.println("----------------------------------");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Session " + session.id() + "|@"));
        System.out.println("  Status:    " + session.status());
        System.out.println("  Completed: " + session.completedAgents().size() + " agent(s)");
        if (!session.failedAgents().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  Failed:    @|fg(red) " + String.join(", ", session.failedAgents()) + "|@"));
        }
        System.out.println("  Duration:  " + formatDuration(session.totalDurationMs()));
        System.out.println("  Cost:      " + formatCost(session.totalCostUsd()));
    }

    static String formatCost(Object value) {
        double cost = value instanceof Number n ? n.doubleValue() : 0.0;
        return String.format("$%.4f", cost);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        long minutes = seconds / 60;
        if (minutes < 60) return minutes + "m " + (seconds % 60) + "s";
        return (minutes / 60) + "h " + (minutes % 60) + "m";
    }

    private static long toLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
