package com.statuswatch.core.wait;

/**
 * Thrown when no status could be fetched within the per-call budget.
 */
public class StatusTimeoutException extends RuntimeException {

    public StatusTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
