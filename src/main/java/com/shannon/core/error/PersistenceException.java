package com.shannon.core.error;

/**
 * Session progress could not be saved. Completed work stays in the workspace and needs manual reconciliation.
 */
public class PersistenceException extends ShannonException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
