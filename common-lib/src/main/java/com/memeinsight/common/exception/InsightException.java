package com.memeinsight.common.exception;

/**
 * Root of the engine's error taxonomy. Carries the name of the upstream source
 * (or component) the failure belongs to so callers can degrade per source.
 */
public class InsightException extends RuntimeException {
    private final String source;

    public InsightException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public InsightException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
