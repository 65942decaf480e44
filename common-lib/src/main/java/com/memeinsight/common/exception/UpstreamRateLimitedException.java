package com.memeinsight.common.exception;

import java.time.Duration;

/**
 * Upstream refused the call because of rate limiting, quota exhaustion, or an
 * active local cool-down. Non-fatal.
 */
public class UpstreamRateLimitedException extends InsightException {
    private final Duration retryAfter;

    public UpstreamRateLimitedException(String source, String message) {
        this(source, message, Duration.ZERO);
    }

    public UpstreamRateLimitedException(String source, String message, Duration retryAfter) {
        super(source, message);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
