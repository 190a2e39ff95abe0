package com.shannon.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle: parses the arguments, runs the matching command
 * and keeps its exit code for {@link ExitCodeGenerator}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ShannonCommand shannonCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ShannonCommand shannonCommand, IFactory factory) {
        this.shannonCommand = shannonCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(shannonCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
