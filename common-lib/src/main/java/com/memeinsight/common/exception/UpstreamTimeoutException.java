package com.memeinsight.common.exception;

/** A single upstream fetch exceeded its per-fetch timeout. */
public class UpstreamTimeoutException extends InsightException {

    public UpstreamTimeoutException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
