package com.shannon.dispatch.cli;

import com.shannon.core.model.AgentCatalog;
import com.shannon.core.model.Session;
import com.shannon.core.session.SessionStateMachine;
import com.shannon.core.session.SessionStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: shannon rollback-to &lt;session-id&gt; &lt;agent&gt;
 * <p>
 * Restores the workspace to the agent's checkpoint and forgets every later agent, so the next run
 * resumes right after it.
 */
@Command(name = "rollback-to", mixinStandardHelpOptions = true,
        description = "Rewind a session to the checkpoint of a completed agent")
@Component
public class RollbackCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Parameters(index = "1", description = "Agent name (see list-agents)")
    private String agentName;

    private final SessionStore sessionStore;
    private final SessionStateMachine stateMachine;

    public RollbackCommand(SessionStore sessionStore, SessionStateMachine stateMachine) {
        this.sessionStore = sessionStore;
        this.stateMachine = stateMachine;
    }

    @Override
    public Integer call() {
        if (AgentCatalog.find(agentName).isEmpty()) {
            ConsoleOutput.error("Unknown agent '" + agentName + "'. Valid agents: " + AgentCatalog.names());
            return RunCommand.EXIT_USAGE;
        }
        var session = sessionStore.load(sessionId);
        if (session.isEmpty()) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return RunCommand.EXIT_USAGE;
        }
        try {
            Session updated = stateMachine.rollbackTo(session.get(), agentName);
            ConsoleOutput.success("Rolled back to " + agentName + "; "
                    + updated.completedAgents().size() + " agent(s) remain completed");
            return 0;
        } catch (IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return RunCommand.EXIT_FAILED;
        }
    }
}
