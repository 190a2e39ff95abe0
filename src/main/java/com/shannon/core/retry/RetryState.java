package com.shannon.core.retry;

import com.shannon.core.error.ClassifiedException;

/**
 * Accumulated state of a {@link RetryOrchestrator} run. Terminal once {@code result} or {@code failure} is set.
 *
 * @param attemptsUsed    attempts that reached the invoker or failed trying
 * @param totalCostUsd    cost over all attempts so far, failed ones included
 * @param totalDurationMs duration over all attempts so far
 * @param retryContext    text prepended to the next attempt's prompt (nullable)
 * @param result          set on success
 * @param failure         set on terminal failure
 */
record RetryState(
    int attemptsUsed,
    double totalCostUsd,
    long totalDurationMs,
    String retryContext,
    AgentRunResult result,
    ClassifiedException failure
) {

    static RetryState initial() {
        return new RetryState(0, 0.0, 0L, null, null, null);
    }

    RetryState after(AttemptOutcome outcome) {
        return new RetryState(Math.max(attemptsUsed, outcome.attemptNumber()),
                totalCostUsd + outcome.costUsd(), totalDurationMs + outcome.durationMs(),
                retryContext, null, null);
    }

    RetryState retrying(String nextContext) {
        return new RetryState(attemptsUsed, totalCostUsd, totalDurationMs, nextContext, null, null);
    }

    RetryState succeeded(AgentRunResult runResult) {
        return new RetryState(attemptsUsed, totalCostUsd, totalDurationMs, retryContext, runResult, null);
    }

    RetryState failed(ClassifiedException error) {
        return new RetryState(attemptsUsed, totalCostUsd, totalDurationMs, retryContext, null, error);
    }
}
