package com.shannon.core.retry;

import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.RunOptions;

import java.nio.file.Path;

/**
 * Everything an invoker needs for one attempt.
 */
public record AgentInvocation(
    AgentDefinition agent,
    String prompt,
    Path workspace,
    String sessionId,
    int attemptNumber,
    RunOptions options,
    CancellationToken cancellationToken
) {}
