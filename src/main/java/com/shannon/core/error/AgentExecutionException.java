package com.shannon.core.error;

/**
 * Thrown by an agent invoker when an attempt could not run to completion.
 */
public class AgentExecutionException extends ShannonException {

    private final ErrorCategory category;
    private final boolean retryable;

    public AgentExecutionException(String message, ErrorCategory category) {
        this(message, category, category.isRetryable(), null);
    }

    public AgentExecutionException(String message, ErrorCategory category, boolean retryable, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.retryable = retryable;
    }

    public ErrorCategory category() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
