package com.memeinsight.common.exception;

/**
 * Credentials rejected by an upstream source. Fatal for that source: polling of
 * the source stays suspended until it is reconfigured.
 */
public class UpstreamAuthException extends InsightException {

    public UpstreamAuthException(String source, String message) {
        super(source, message);
    }

    public UpstreamAuthException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
