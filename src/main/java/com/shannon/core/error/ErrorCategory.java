package com.shannon.core.error;

/**
 * Failure categories recognised by {@link ErrorClassifier}, each with a fixed retry decision.
 */
public enum ErrorCategory {
    NETWORK(true),
    RATE_LIMIT(true),
    SERVER(true),
    API(true),
    MAX_TURNS(true),
    AUTHENTICATION(false),
    BILLING(false),
    PERMISSION(false),
    INVALID_REQUEST(false),
    RESOURCE(false),
    UNKNOWN(false);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
