package com.shannon.invoker;

import com.shannon.config.ShannonProperties;
import com.shannon.core.error.AgentExecutionException;
import com.shannon.core.error.ErrorCategory;
import com.shannon.core.model.AttemptResult;
import com.shannon.core.retry.AgentEvent;
import com.shannon.core.retry.AgentInvocation;
import com.shannon.core.retry.AgentInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs an agent attempt through the Claude Code CLI in non-interactive stream-json mode. The prompt is
 * written to the process's stdin; each output line is decoded into {@link AgentEvent}s as it arrives.
 */
public class ClaudeCodeAgentInvoker implements AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCodeAgentInvoker.class);

    private final ShannonProperties.Llm llm;
    private final ClaudeStreamParser parser;

    public ClaudeCodeAgentInvoker(ShannonProperties properties, ClaudeStreamParser parser) {
        this.llm = properties.getLlm();
        this.parser = parser;
    }

    List<String> buildCommand() {
        var command = new ArrayList<String>();
        command.add(llm.getClaudeCommand());
        command.add("-p");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        command.add("--dangerously-skip-permissions");
        command.add("--max-turns");
        command.add(String.valueOf(llm.getMaxTurns()));
        if (llm.getModel() != null && !llm.getModel().isBlank()) {
            command.add("--model");
            command.add(llm.getModel());
        }
        return command;
    }

    @Override
    public AttemptResult run(AgentInvocation invocation, Consumer<AgentEvent> events) throws Exception {
        long start = System.currentTimeMillis();
        Path stderrFile = Files.createTempFile("shannon-claude-", ".err");
        Process process;
        try {
            process = new ProcessBuilder(buildCommand())
                    .directory(invocation.workspace().toFile())
                    .redirectError(stderrFile.toFile())
                    .start();
        } catch (IOException e) {
            Files.deleteIfExists(stderrFile);
            throw new AgentExecutionException("Could not start '" + llm.getClaudeCommand() + "': " + e.getMessage(),
                    ErrorCategory.INVALID_REQUEST, false, e);
        }
        Runnable deregister = invocation.cancellationToken().onCancel(process::destroy);

        try {
            try (Writer stdin = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)) {
                stdin.write(invocation.prompt());
            }

            ClaudeStreamParser.Decoder decoder = parser.newDecoder();
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    for (AgentEvent event : decoder.accept(line)) {
                        events.accept(event);
                    }
                }
            }
            int exitCode = process.waitFor();
            long elapsed = System.currentTimeMillis() - start;
            log.debug("{} attempt {} exited with {}", invocation.agent().name(), invocation.attemptNumber(), exitCode);

            if (invocation.cancellationToken().isCancelled()) {
                return AttemptResult.failed("Cancelled", elapsed, decoder.result()
                        .map(ClaudeStreamParser.StreamResult::costUsd).orElse(0.0));
            }

            var streamResult = decoder.result();
            if (streamResult.isEmpty()) {
                String stderr = new String(Files.readAllBytes(stderrFile), StandardCharsets.UTF_8).strip();
                return new AttemptResult(false, decoder.lastAssistantText(), elapsed, 0.0, 0.0, null, null,
                        false, 0, "Claude exited with code " + exitCode + " without a result"
                        + (stderr.isEmpty() ? "" : ": " + stderr));
            }

            var result = streamResult.get();
            if (result.succeeded()) {
                return AttemptResult.succeeded(result.text(), elapsed, result.costUsd(), result.turns());
            }
            ErrorCategory category = "error_max_turns".equals(result.subtype()) ? ErrorCategory.MAX_TURNS : null;
            return new AttemptResult(false, decoder.lastAssistantText(), elapsed, 0.0, result.costUsd(), null,
                    category, false, result.turns(), result.subtype() + ": " + result.text());
        } finally {
            deregister.run();
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            Files.deleteIfExists(stderrFile);
        }
    }
}
