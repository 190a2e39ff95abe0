package com.shannon.core.audit;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Identifies the log an attempt's events go to.
 */
public record AttemptHandle(
    String sessionId,
    String agentName,
    int attemptNumber,
    Path logFile,
    Instant startedAt
) {}
