package com.subreq.exception;

/**
 * Exception thrown when an input table cannot be parsed.
 */
public class MalformedTableException extends SubReqException {

    public MalformedTableException(String message) {
        super(message);
    }

    public MalformedTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
