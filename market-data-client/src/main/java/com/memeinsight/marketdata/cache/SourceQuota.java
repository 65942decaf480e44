package com.memeinsight.marketdata.cache;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Daily call budget for one upstream source. The counter resets at UTC midnight.
 * A limit of zero or less means unlimited.
 */
public class SourceQuota {

    private final int dailyLimit;

    private LocalDate day;
    private int used;

    public SourceQuota(int dailyLimit) {
        this.dailyLimit = dailyLimit;
    }

    public static SourceQuota unlimited() {
        return new SourceQuota(0);
    }

    /** Counts one call against today's budget; false when the budget is spent. */
    public synchronized boolean tryAcquire(Instant now) {
        if (dailyLimit <= 0) {
            return true;
        }
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (!today.equals(day)) {
            day = today;
            used = 0;
        }
        if (used >= dailyLimit) {
            return false;
        }
        used++;
        return true;
    }

    public synchronized int used() {
        return used;
    }

    public int dailyLimit() {
        return dailyLimit;
    }

    /** Time left until the budget resets. */
    public static Duration untilReset(Instant now) {
        Instant midnight = LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return Duration.between(now, midnight);
    }
}
