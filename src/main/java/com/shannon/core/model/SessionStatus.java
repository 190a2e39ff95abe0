package com.shannon.core.model;

/**
 * Lifecycle status of a pipeline session.
 */
public enum SessionStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED
}
