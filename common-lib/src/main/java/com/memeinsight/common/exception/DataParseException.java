package com.memeinsight.common.exception;

/** A single post or price bar could not be parsed. The item is skipped and counted. */
public class DataParseException extends InsightException {

    public DataParseException(String source, String message) {
        super(source, message);
    }

    public DataParseException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
