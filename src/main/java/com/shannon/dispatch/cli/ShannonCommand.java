package com.shannon.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: run, status, list-agents, rollback-to, tools.
 */
@Command(
        name = "shannon",
        mixinStandardHelpOptions = true,
        version = "Shannon 0.1.0",
        description = "Checkpointed, retrying orchestrator for autonomous security testing agents",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                ListAgentsCommand.class,
                RollbackCommand.class,
                ToolsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShannonCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
