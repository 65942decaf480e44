package com.memeinsight.marketdata.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Cool-down bookkeeping for one upstream source.
 *
 * <pre>
 *   coolDown(n) = min(base × 2^(n−1), max)     n = consecutive failures
 * </pre>
 *
 * A success resets the failure count. Guarded by its own monitor; every method is a
 * short synchronous section.
 */
public class SourceBackoff {

    private final Duration base;
    private final Duration max;

    private int consecutiveFailures;
    private Instant coolDownUntil = Instant.EPOCH;

    public SourceBackoff(Duration base, Duration max) {
        this.base = base;
        this.max = max;
    }

    public synchronized Duration recordFailure(Instant now) {
        return recordFailure(now, Duration.ZERO);
    }

    /** As {@link #recordFailure(Instant)}, but never cools down for less than {@code atLeast}. */
    public synchronized Duration recordFailure(Instant now, Duration atLeast) {
        consecutiveFailures++;
        Duration coolDown = coolDownFor(consecutiveFailures);
        if (atLeast != null && atLeast.compareTo(coolDown) > 0) {
            coolDown = atLeast;
        }
        coolDownUntil = now.plus(coolDown);
        return coolDown;
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        coolDownUntil = Instant.EPOCH;
    }

    public synchronized boolean isCoolingDown(Instant now) {
        return now.isBefore(coolDownUntil);
    }

    public synchronized Duration remaining(Instant now) {
        return now.isBefore(coolDownUntil) ? Duration.between(now, coolDownUntil) : Duration.ZERO;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    Duration coolDownFor(int failures) {
        // 2^30 × any sane base already exceeds max
        int exponent = Math.min(failures - 1, 30);
        Duration d = base.multipliedBy(1L << exponent);
        return d.compareTo(max) > 0 || d.isNegative() ? max : d;
    }
}
