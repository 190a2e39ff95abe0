package com.shannon.dispatch.cli;

import com.shannon.core.model.AgentCatalog;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.Phase;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * CLI command: shannon list-agents
 */
@Command(name = "list-agents", mixinStandardHelpOptions = true, description = "List pipeline agents by phase")
@Component
public class ListAgentsCommand implements Runnable {

    @Override
    public void run() {
        for (Phase phase : Phase.values()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold Phase " + phase.number() + ": " + phase.label() + "|@"
                            + (phase.isParallel() ? " (parallel)" : "")));
            for (AgentDefinition agent : AgentCatalog.inPhase(phase)) {
                System.out.printf("  %-18s %s%n", agent.name(), agent.displayName());
            }
        }
    }
}
