package com.shannon.core.audit;

import java.util.Map;

/**
 * Append-only, per-attempt record of what an agent did.
 * <p>
 * An append is durable when the call returns. Implementations raise
 * {@link com.shannon.core.error.StorageException} when they cannot guarantee that.
 */
public interface AuditSink {

    AttemptHandle startAttempt(String sessionId, String agentName, int attemptNumber, String promptSnapshot);

    void append(AttemptHandle handle, AuditEvent event);

    void endAttempt(AttemptHandle handle, String outcome, Map<String, Object> details);
}
