package com.shannon.core.error;

/**
 * The workspace snapshot store or the audit log could not be written or restored.
 * Continuing after this risks losing the last good checkpoint.
 */
public class StorageException extends ShannonException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
