package com.shannon.core.retry;

import java.util.Map;

/**
 * Something an agent did while an attempt was running, as reported by its invoker.
 *
 * @param type event type
 * @param text assistant text or error message (may be empty)
 * @param data structured details, such as tool name and input
 */
public record AgentEvent(Type type, String text, Map<String, Object> data) {

    public enum Type {
        ASSISTANT_TEXT,
        TOOL_START,
        TOOL_END,
        ERROR
    }

    public static AgentEvent text(String text) {
        return new AgentEvent(Type.ASSISTANT_TEXT, text, Map.of());
    }

    public static AgentEvent toolStart(String toolName, Object input) {
        return new AgentEvent(Type.TOOL_START, "", Map.of("tool", toolName, "input", String.valueOf(input)));
    }

    public static AgentEvent toolEnd(String toolName, String output) {
        return new AgentEvent(Type.TOOL_END, "", Map.of("tool", toolName, "output", output == null ? "" : output));
    }

    public static AgentEvent error(String message) {
        return new AgentEvent(Type.ERROR, message, Map.of());
    }
}
