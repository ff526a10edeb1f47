package com.subreq.exception;

/**
 * Base exception for the sub-requirement eligibility engine.
 */
public class SubReqException extends RuntimeException {

    public SubReqException(String message) {
        super(message);
    }

    public SubReqException(String message, Throwable cause) {
        super(message, cause);
    }
}
