package com.shannon.core.retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared by the pipeline, the orchestrator and agent invokers.
 */
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        for (Runnable callback : callbacks) {
            callback.run();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Registers a callback to run on cancellation; runs it immediately when already cancelled.
     *
     * @return a handle that deregisters the callback
     */
    public Runnable onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Waits for the given duration or until cancelled, whichever comes first.
     *
     * @return true if the token was cancelled
     */
    public boolean await(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        try {
            return cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
