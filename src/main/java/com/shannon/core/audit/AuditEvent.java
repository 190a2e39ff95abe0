package com.shannon.core.audit;

import java.time.Instant;
import java.util.Map;

/**
 * One line of an attempt's audit log.
 */
public record AuditEvent(
    AuditEventKind kind,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static AuditEvent of(AuditEventKind kind, Map<String, Object> payload) {
        return new AuditEvent(kind, payload == null ? Map.of() : payload, Instant.now());
    }
}
