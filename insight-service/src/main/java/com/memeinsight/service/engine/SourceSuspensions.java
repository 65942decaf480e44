package com.memeinsight.service.engine;

import com.memeinsight.common.alert.OperatorAlert;
import com.memeinsight.common.alert.OperatorAlertSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Upstream sources taken out of polling after their credentials were rejected. The
 * operator is alerted once per suspension; polling resumes only through {@link #resume}.
 */
public class SourceSuspensions {

    private static final Logger log = LoggerFactory.getLogger(SourceSuspensions.class);

    private final Set<String> suspended = ConcurrentHashMap.newKeySet();
    private final OperatorAlertSink alertSink;
    private final Clock clock;

    public SourceSuspensions(OperatorAlertSink alertSink, Clock clock) {
        this.alertSink = alertSink;
        this.clock = clock;
    }

    /** Returns true when this call suspended the source. */
    public boolean suspend(String source, String reason, String traceId) {
        if (!suspended.add(source)) {
            return false;
        }
        log.error("SOURCE_SUSPENDED source={} reason={} traceId={}", source, reason, traceId);
        alertSink.raise(new OperatorAlert(source, reason, clock.instant(), traceId));
        return true;
    }

    public boolean resume(String source) {
        boolean removed = suspended.remove(source);
        if (removed) {
            log.info("SOURCE_RESUMED source={}", source);
        }
        return removed;
    }

    public boolean isSuspended(String source) {
        return suspended.contains(source);
    }

    public Set<String> snapshot() {
        return Set.copyOf(new TreeSet<>(suspended));
    }
}
