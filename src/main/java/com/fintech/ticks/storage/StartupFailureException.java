package com.fintech.ticks.storage;

/**
 * A per-symbol storage resource could not be provisioned or opened.
 * Fatal: the application context refuses to start.
 */
public class StartupFailureException extends RuntimeException {

    public StartupFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public StartupFailureException(String message) {
        super(message);
    }
}
