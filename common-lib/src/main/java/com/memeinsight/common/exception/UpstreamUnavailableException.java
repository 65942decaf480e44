package com.memeinsight.common.exception;

/** Upstream answered with a server error or could not be reached. Transient. */
public class UpstreamUnavailableException extends InsightException {

    public UpstreamUnavailableException(String source, String message) {
        super(source, message);
    }

    public UpstreamUnavailableException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
