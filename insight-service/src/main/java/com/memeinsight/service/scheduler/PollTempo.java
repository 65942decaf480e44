package com.memeinsight.service.scheduler;

import com.memeinsight.common.model.CycleStatus;

import java.time.Duration;

/**
 * Picks the delay before the next poll cycle from the outcome of the last one.
 *
 * <ul>
 *   <li>SUCCESS, PARTIAL, PENDING: the configured {@code updateInterval}</li>
 *   <li>FAILED, TIMEOUT: the longer of {@code updateInterval} and {@link #FALLBACK_INTERVAL}</li>
 * </ul>
 */
public final class PollTempo {

    public static final Duration FALLBACK_INTERVAL = Duration.ofMinutes(5);

    private PollTempo() {}

    public static Duration resolve(CycleStatus lastStatus, Duration updateInterval) {
        return switch (lastStatus) {
            case SUCCESS, PARTIAL, PENDING -> updateInterval;
            case FAILED, TIMEOUT           -> fallback(updateInterval);
        };
    }

    /** Delay after a cycle that ended in an unexpected error. */
    public static Duration fallback(Duration updateInterval) {
        return updateInterval.compareTo(FALLBACK_INTERVAL) > 0 ? updateInterval : FALLBACK_INTERVAL;
    }
}
