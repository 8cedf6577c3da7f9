package com.nayem.sagacoordinator.engine;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Computes the delay between two attempts of a failed step.
 */
public class BackoffStrategy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterPercent;

    public BackoffStrategy(Duration baseDelay, Duration maxDelay, double jitterPercent) {
        this.baseDelayMs = Math.max(0L, baseDelay.toMillis());
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelay.toMillis());
        this.jitterPercent = Math.max(0.0, Math.min(1.0, jitterPercent));
    }

    /**
     * Exponential delay {@code base * 2^attempt}, capped at the maximum, with
     * the jitter share of it randomized.
     *
     * @param attempt The retry number (0-indexed)
     * @return Delay in milliseconds
     */
    public long delayMillis(int attempt) {
        // clamp so the shift cannot overflow
        int shift = Math.min(Math.max(attempt, 0), 30);
        long exponentialDelay = baseDelayMs * (1L << shift);
        long cappedDelay = Math.min(exponentialDelay, maxDelayMs);

        if (jitterPercent == 0.0 || cappedDelay == 0) {
            return cappedDelay;
        }

        long jitterRange = (long) (cappedDelay * jitterPercent);
        long fixedPortion = cappedDelay - jitterRange;
        long randomPortion = ThreadLocalRandom.current().nextLong(jitterRange + 1);

        return fixedPortion + randomPortion;
    }
}
