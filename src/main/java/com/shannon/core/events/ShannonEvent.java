package com.shannon.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a session runs, consumed by the CLI progress printer.
 *
 * @param eventType event type (e.g. "agent.started", "attempt.failed", "wave.member.completed")
 * @param sessionId the session this event belongs to
 * @param agentName the agent or wave member this event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ShannonEvent(
    String eventType,
    String sessionId,
    String agentName,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static ShannonEvent of(String eventType, String sessionId, String agentName, Map<String, Object> payload) {
        return new ShannonEvent(eventType, sessionId, agentName, payload, Instant.now());
    }
}
