package com.fintech.ticks.storage;

/**
 * I/O failure on a tick log or summary sink after startup.
 * Never retried; propagated to the caller of the failed operation.
 */
public class TickLogException extends RuntimeException {

    public TickLogException(String message, Throwable cause) {
        super(message, cause);
    }

    public TickLogException(String message) {
        super(message);
    }
}
