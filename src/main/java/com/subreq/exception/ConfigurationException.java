package com.subreq.exception;

/**
 * Exception thrown when configuration or a static code table is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends SubReqException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
