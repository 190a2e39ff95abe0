package com.shannon.core.error;

/**
 * Base class for orchestration failures.
 */
public class ShannonException extends RuntimeException {

    public ShannonException(String message) {
        super(message);
    }

    public ShannonException(String message, Throwable cause) {
        super(message, cause);
    }
}
