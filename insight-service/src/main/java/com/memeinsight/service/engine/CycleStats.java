package com.memeinsight.service.engine;

import java.util.concurrent.atomic.AtomicInteger;

/** Skip and degrade counters of one cycle. Written from fetch threads, read at commit. */
public class CycleStats {

    private final AtomicInteger fetchFailures = new AtomicInteger();
    private final AtomicInteger timeouts = new AtomicInteger();
    private final AtomicInteger rateLimited = new AtomicInteger();
    private final AtomicInteger authFailures = new AtomicInteger();
    private final AtomicInteger parseFailures = new AtomicInteger();
    private final AtomicInteger skippedSuspended = new AtomicInteger();

    public void fetchFailure() { fetchFailures.incrementAndGet(); }
    public void timeout() { timeouts.incrementAndGet(); }
    public void rateLimited() { rateLimited.incrementAndGet(); }
    public void authFailure() { authFailures.incrementAndGet(); }
    public void parseFailure() { parseFailures.incrementAndGet(); }
    public void skippedSuspended() { skippedSuspended.incrementAndGet(); }

    public int fetchFailures() { return fetchFailures.get(); }
    public int timeouts() { return timeouts.get(); }
    public int rateLimitedCount() { return rateLimited.get(); }
    public int authFailures() { return authFailures.get(); }
    public int parseFailures() { return parseFailures.get(); }
    public int skippedSuspendedCount() { return skippedSuspended.get(); }

    /** True when any fetch of the cycle degraded. */
    public boolean degraded() {
        return fetchFailures() + timeouts() + rateLimitedCount() + authFailures() + parseFailures() + skippedSuspendedCount() > 0;
    }

    @Override
    public String toString() {
        return "fetchFailures=" + fetchFailures() + " timeouts=" + timeouts() + " rateLimited=" + rateLimitedCount()
            + " authFailures=" + authFailures() + " parseFailures=" + parseFailures()
            + " skippedSuspended=" + skippedSuspendedCount();
    }
}
