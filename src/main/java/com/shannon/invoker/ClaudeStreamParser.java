package com.shannon.invoker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shannon.core.retry.AgentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes the {@code --output-format stream-json} output of the Claude Code CLI, one JSON message per line.
 */
public class ClaudeStreamParser {

    private static final Logger log = LoggerFactory.getLogger(ClaudeStreamParser.class);

    private final ObjectMapper objectMapper;

    public ClaudeStreamParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Starts decoding a new stream; decoders are not shared between attempts. */
    public Decoder newDecoder() {
        return new Decoder();
    }

    /**
     * The final {@code result} message of a run.
     *
     * @param isError    the CLI flagged the run as failed
     * @param subtype    "success", "error_max_turns", "error_during_execution", ...
     * @param text       final answer or error text
     * @param costUsd    total cost reported by the CLI
     * @param turns      number of turns used
     * @param durationMs duration reported by the CLI
     */
    public record StreamResult(boolean isError, String subtype, String text, double costUsd, int turns,
                               long durationMs) {

        public boolean succeeded() {
            return !isError && "success".equals(subtype);
        }
    }

    public final class Decoder {

        private final Map<String, String> toolNamesById = new HashMap<>();
        private final StringBuilder lastAssistantText = new StringBuilder();
        private StreamResult result;

        /**
         * @return the events carried by this line; empty for blank, unparseable or uninteresting lines
         */
        public List<AgentEvent> accept(String line) {
            if (line == null || line.isBlank()) {
                return List.of();
            }
            JsonNode message;
            try {
                message = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                log.debug("Ignoring non-JSON output line: {}", line);
                return List.of();
            }

            String type = message.path("type").asText();
            return switch (type) {
                case "assistant" -> assistant(message.path("message").path("content"));
                case "user" -> toolResults(message.path("message").path("content"));
                case "result" -> {
                    result = new StreamResult(
                            message.path("is_error").asBoolean(false),
                            message.path("subtype").asText(""),
                            message.path("result").asText(""),
                            message.path("total_cost_usd").asDouble(0.0),
                            message.path("num_turns").asInt(0),
                            message.path("duration_ms").asLong(0));
                    yield result.isError() ? List.of(AgentEvent.error(result.text())) : List.of();
                }
                default -> List.of();
            };
        }

        public Optional<StreamResult> result() {
            return Optional.ofNullable(result);
        }

        /** Text of the most recent assistant message, used as partial output when no result arrived. */
        public String lastAssistantText() {
            return lastAssistantText.toString();
        }

        private List<AgentEvent> assistant(JsonNode content) {
            var events = new ArrayList<AgentEvent>();
            if (!content.isArray()) {
                return events;
            }
            var text = new StringBuilder();
            for (JsonNode block : content) {
                switch (block.path("type").asText()) {
                    case "text" -> text.append(block.path("text").asText());
                    case "tool_use" -> {
                        String name = block.path("name").asText("unknown");
                        toolNamesById.put(block.path("id").asText(), name);
                        events.add(AgentEvent.toolStart(name, block.path("input")));
                    }
                    default -> { }
                }
            }
            if (!text.isEmpty()) {
                lastAssistantText.setLength(0);
                lastAssistantText.append(text);
                events.add(0, AgentEvent.text(text.toString()));
            }
            return events;
        }

        private List<AgentEvent> toolResults(JsonNode content) {
            var events = new ArrayList<AgentEvent>();
            if (!content.isArray()) {
                return events;
            }
            for (JsonNode block : content) {
                if ("tool_result".equals(block.path("type").asText())) {
                    String name = toolNamesById.getOrDefault(block.path("tool_use_id").asText(), "unknown");
                    JsonNode output = block.path("content");
                    events.add(AgentEvent.toolEnd(name, output.isTextual() ? output.asText() : output.toString()));
                }
            }
            return events;
        }
    }
}
