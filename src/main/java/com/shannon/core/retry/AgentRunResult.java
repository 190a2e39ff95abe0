package com.shannon.core.retry;

import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.AttemptResult;
import com.shannon.core.model.CommitRef;

/**
 * Outcome of a successful {@link RetryOrchestrator#runWithRetry} call.
 *
 * @param agent           the agent that ran
 * @param finalAttempt    result of the attempt that passed validation
 * @param checkpoint      the commit recording the accepted workspace
 * @param attempts        attempts used, including failed ones
 * @param totalCostUsd    cost summed over every attempt
 * @param totalDurationMs duration summed over every attempt
 */
public record AgentRunResult(
    AgentDefinition agent,
    AttemptResult finalAttempt,
    CommitRef checkpoint,
    int attempts,
    double totalCostUsd,
    long totalDurationMs
) {}
