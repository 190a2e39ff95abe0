package com.shannon.core.retry;

import com.shannon.core.error.ErrorCategory;
import com.shannon.core.model.AttemptResult;

/**
 * How a single attempt ended, before any rollback or commit has happened.
 *
 * @param kind             the kind of ending
 * @param attemptNumber    1-based attempt number
 * @param result           invoker result, when the invoker returned one
 * @param error            the failure behind an execution or storage failure
 * @param category         classification of an execution failure
 * @param retryable        whether an execution failure may be retried
 * @param workspaceTouched a checkpoint was taken, so a rollback is needed to undo the attempt
 * @param costUsd          cost incurred by this attempt
 * @param durationMs       time spent in this attempt
 */
record AttemptOutcome(
    Kind kind,
    int attemptNumber,
    AttemptResult result,
    Throwable error,
    ErrorCategory category,
    boolean retryable,
    boolean workspaceTouched,
    double costUsd,
    long durationMs
) {

    enum Kind {
        SUCCEEDED,
        EXECUTION_FAILED,
        VALIDATION_FAILED,
        STORAGE_FAILED,
        CANCELLED
    }

    static AttemptOutcome succeeded(int n, AttemptResult result, long durationMs) {
        return new AttemptOutcome(Kind.SUCCEEDED, n, result, null, null, false, true, result.billedCost(), durationMs);
    }

    static AttemptOutcome validationFailed(int n, AttemptResult result, long durationMs) {
        return new AttemptOutcome(Kind.VALIDATION_FAILED, n, result, null, null, true, true,
                result.billedCost(), durationMs);
    }

    static AttemptOutcome executionFailed(int n, AttemptResult result, Throwable error, ErrorCategory category,
                                          boolean retryable, double costUsd, long durationMs) {
        return new AttemptOutcome(Kind.EXECUTION_FAILED, n, result, error, category, retryable, true,
                costUsd, durationMs);
    }

    static AttemptOutcome storageFailed(int n, boolean workspaceTouched, Throwable error, long durationMs) {
        return new AttemptOutcome(Kind.STORAGE_FAILED, n, null, error, null, false, workspaceTouched, 0.0, durationMs);
    }

    static AttemptOutcome cancelled(int n, boolean workspaceTouched, double costUsd, long durationMs) {
        return new AttemptOutcome(Kind.CANCELLED, n, null, null, null, false, workspaceTouched, costUsd, durationMs);
    }
}
