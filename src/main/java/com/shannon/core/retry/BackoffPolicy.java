package com.shannon.core.retry;

import com.shannon.config.ShannonProperties;
import com.shannon.core.error.ErrorCategory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Delay before the next attempt. Rate limits wait a long, linearly growing time; everything else backs off
 * exponentially with up to a second of jitter.
 */
public class BackoffPolicy {

    private final long baseMs;
    private final long maxMs;
    private final long rateLimitBaseMs;
    private final long rateLimitStepMs;
    private final long rateLimitMaxMs;
    private final LongSupplier jitterMs;

    public BackoffPolicy(long baseMs, long maxMs, long rateLimitBaseMs, long rateLimitStepMs, long rateLimitMaxMs,
                         LongSupplier jitterMs) {
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.rateLimitBaseMs = rateLimitBaseMs;
        this.rateLimitStepMs = rateLimitStepMs;
        this.rateLimitMaxMs = rateLimitMaxMs;
        this.jitterMs = jitterMs;
    }

    public static BackoffPolicy fromProperties(ShannonProperties properties) {
        return new BackoffPolicy(properties.getBackoffBaseMs(), properties.getBackoffMaxMs(),
                properties.getRateLimitBaseMs(), properties.getRateLimitStepMs(), properties.getRateLimitMaxMs(),
                () -> ThreadLocalRandom.current().nextLong(1000));
    }

    /** No waiting at all. */
    public static BackoffPolicy none() {
        return new BackoffPolicy(0, 0, 0, 0, 0, () -> 0);
    }

    /**
     * @param attempt  the attempt that just failed, starting at 1
     * @param category why it failed
     */
    public Duration delay(int attempt, ErrorCategory category) {
        if (category == ErrorCategory.RATE_LIMIT) {
            return Duration.ofMillis(Math.min(rateLimitBaseMs + attempt * rateLimitStepMs, rateLimitMaxMs));
        }
        long exponential = (1L << Math.min(attempt, 20)) * baseMs;
        return Duration.ofMillis(Math.min(exponential + jitterMs.getAsLong(), maxMs));
    }
}
