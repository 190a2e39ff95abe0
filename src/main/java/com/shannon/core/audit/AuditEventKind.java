package com.shannon.core.audit;

public enum AuditEventKind {
    ATTEMPT_STARTED,
    LLM_RESPONSE,
    TOOL_START,
    TOOL_END,
    ERROR,
    ATTEMPT_ENDED
}
