package com.shannon.core.model;

import com.shannon.core.error.ErrorCategory;

/**
 * What an agent invoker reports for a single attempt.
 *
 * @param success          the agent reported that it finished its task
 * @param payload          final text the agent produced (may be empty)
 * @param durationMs       wall-clock duration of the attempt
 * @param costUsd          cost reported for a finished attempt
 * @param partialCostUsd   cost accrued before an attempt failed
 * @param retryable        explicit retry decision from the invoker; null leaves it to classification
 * @param errorCategory    invoker's own classification of the failure (nullable)
 * @param apiErrorDetected streamed output mentioned an API error or a terminated session
 * @param turns            number of model turns used
 * @param errorMessage     failure description (nullable on success)
 */
public record AttemptResult(
    boolean success,
    String payload,
    long durationMs,
    double costUsd,
    double partialCostUsd,
    Boolean retryable,
    ErrorCategory errorCategory,
    boolean apiErrorDetected,
    int turns,
    String errorMessage
) {

    public static AttemptResult succeeded(String payload, long durationMs, double costUsd, int turns) {
        return new AttemptResult(true, payload, durationMs, costUsd, 0.0, null, null, false, turns, null);
    }

    public static AttemptResult failed(String errorMessage, long durationMs, double partialCostUsd) {
        return new AttemptResult(false, "", durationMs, 0.0, partialCostUsd, null, null, false, 0, errorMessage);
    }

    /** Cost to charge for this attempt whether it finished or not. */
    public double billedCost() {
        return costUsd > 0 ? costUsd : partialCostUsd;
    }

    public AttemptResult withApiErrorDetected(boolean detected) {
        return new AttemptResult(success, payload, durationMs, costUsd, partialCostUsd, retryable,
                errorCategory, detected, turns, errorMessage);
    }

    public AttemptResult withClassification(ErrorCategory category, Boolean retryable) {
        return new AttemptResult(success, payload, durationMs, costUsd, partialCostUsd, retryable,
                category, apiErrorDetected, turns, errorMessage);
    }
}
