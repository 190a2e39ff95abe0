package com.shannon.dispatch.cli;

import com.shannon.core.model.AgentCatalog;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.Session;
import com.shannon.core.session.SessionStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: shannon status [session-id]
 * <p>
 * Without an id, lists known sessions; with one, shows per-agent progress of that session.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show session progress")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Session ID")
    private String sessionId;

    private final SessionStore sessionStore;

    public StatusCommand(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Override
    public void run() {
        if (sessionId == null) {
            listSessions();
            return;
        }
        var session = sessionStore.load(sessionId);
        if (session.isEmpty()) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return;
        }
        showSession(session.get());
    }

    private void listSessions() {
        List<Session> sessions = sessionStore.list();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions yet");
            return;
        }
        System.out.printf("  %-36s %-12s %-9s %s%n", "SESSION", "STATUS", "PROGRESS", "TARGET");
        System.out.println("  " + "-".repeat(80));
        for (Session s : sessions) {
            System.out.printf("  %-36s %-12s %2d/%-6d %s%n", s.id(), s.status(),
                    s.completedAgents().size(), AgentCatalog.all().size(), s.targetRef());
        }
    }

    private void showSession(Session session) {
        System.out.println();
        System.out.println("SESSION " + session.id());
        System.out.println("Target:    " + session.targetRef());
        System.out.println("Workspace: " + session.workspaceRef());
        System.out.println();
        System.out.printf("  %-18s %-6s %-10s %-10s %-10s %s%n",
                "AGENT", "PHASE", "STATUS", "CHECKPOINT", "DURATION", "COST");
        System.out.println("  " + "-".repeat(72));
        for (AgentDefinition agent : AgentCatalog.all()) {
            String status = session.isCompleted(agent.name()) ? "done"
                    : session.isFailed(agent.name()) ? "FAILED" : "pending";
            String checkpoint = session.checkpointOf(agent.name()).map(c -> c.shortValue()).orElse("-");
            Long duration = session.agentDurationsMs().get(agent.name());
            Double cost = session.agentCostsUsd().get(agent.name());
            System.out.printf("  %-18s %-6d %-10s %-10s %-10s %s%n", agent.name(), agent.phase().number(), status,
                    checkpoint, duration == null ? "-" : ConsoleOutput.formatDuration(duration),
                    cost == null ? "-" : ConsoleOutput.formatCost(cost));
        }
        ConsoleOutput.sessionSummary(session);
    }
}
