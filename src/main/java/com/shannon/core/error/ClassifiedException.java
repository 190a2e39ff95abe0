package com.shannon.core.error;

import java.nio.file.Path;

/**
 * Terminal failure of an agent run, tagged with why it stopped.
 */
public class ClassifiedException extends ShannonException {

    public enum Classification {
        /** The failure will not go away by retrying. */
        NON_RETRYABLE,
        /** Every attempt failed to execute. */
        RETRIES_EXHAUSTED,
        /** Every attempt ran but none produced acceptable deliverables. */
        VALIDATION_EXHAUSTED,
        /** Checkpoint, rollback or audit storage failed. */
        STORAGE_INTEGRITY,
        /** The run was cancelled by the operator. */
        CANCELLED
    }

    private final Classification classification;
    private final String agentName;
    private final Path workspace;
    private final int attempts;
    private final double totalCostUsd;

    public ClassifiedException(Classification classification, String agentName, Path workspace,
                               int attempts, double totalCostUsd, String message, Throwable cause) {
        super(message, cause);
        this.classification = classification;
        this.agentName = agentName;
        this.workspace = workspace;
        this.attempts = attempts;
        this.totalCostUsd = totalCostUsd;
    }

    public Classification classification() {
        return classification;
    }

    public String agentName() {
        return agentName;
    }

    public Path workspace() {
        return workspace;
    }

    public int attempts() {
        return attempts;
    }

    public double totalCostUsd() {
        return totalCostUsd;
    }

    /** Operator-facing advice for this classification. */
    public String guidance() {
        return switch (classification) {
            case NON_RETRYABLE -> "non-retryable error, stopping";
            case RETRIES_EXHAUSTED -> "retries exhausted, stopping";
            case VALIDATION_EXHAUSTED -> "agent never produced the required deliverables, stopping";
            case STORAGE_INTEGRITY -> "storage integrity risk, stopping and preserving the last good checkpoint";
            case CANCELLED -> "cancelled, in-flight changes rolled back";
        };
    }
}
