package com.shannon.core.wave;

/**
 * One member of a wave. Operations that are not {@link #available()} are reported as skipped and never run.
 */
@FunctionalInterface
public interface WaveOperation {

    ToolRunResult call() throws Exception;

    default boolean available() {
        return true;
    }

    /** Placeholder for a member whose tool is not installed. */
    static WaveOperation unavailable() {
        return new WaveOperation() {
            @Override
            public ToolRunResult call() {
                throw new IllegalStateException("Unavailable wave operation must not be called");
            }

            @Override
            public boolean available() {
                return false;
            }
        };
    }
}
