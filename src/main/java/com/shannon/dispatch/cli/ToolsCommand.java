package com.shannon.dispatch.cli;

import com.shannon.core.wave.ToolAvailabilityChecker;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: shannon tools
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "Check which external scanners are installed")
@Component
public class ToolsCommand implements Runnable {

    private final ToolAvailabilityChecker checker;

    public ToolsCommand(ToolAvailabilityChecker checker) {
        this.checker = checker;
    }

    @Override
    public void run() {
        checker.check().forEach((tool, available) -> {
            if (available) {
                ConsoleOutput.success(tool);
            } else {
                ConsoleOutput.error(tool + " (install: " + ToolAvailabilityChecker.installHint(tool) + ")");
            }
        });
    }
}
