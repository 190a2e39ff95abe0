package com.shannon.core.logging;

import org.slf4j.MDC;

/**
 * Shannon-specific MDC keys, rendered by the logback pattern.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String AGENT = "agent";
    public static final String ATTEMPT = "attempt";
    public static final String WAVE = "wave";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setAgent(String sessionId, String agentName) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(AGENT, agentName);
    }

    public static void setAttempt(int attempt) {
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    public static void setWave(String sessionId, String waveName) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(WAVE, waveName);
    }

    /** Removes the agent-level keys but keeps the session. */
    public static void clearAgent() {
        MDC.remove(AGENT);
        MDC.remove(ATTEMPT);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(AGENT);
        MDC.remove(ATTEMPT);
        MDC.remove(WAVE);
    }
}
