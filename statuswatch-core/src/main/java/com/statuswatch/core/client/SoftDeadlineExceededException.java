package com.statuswatch.core.client;

import java.time.Instant;

/**
 * Thrown when a client call finishes after the client's soft deadline.
 */
public class SoftDeadlineExceededException extends RuntimeException {

    private final Instant deadline;

    public SoftDeadlineExceededException(Instant deadline) {
        super("Operation exceeded deadline " + deadline + ".");
        this.deadline = deadline;
    }

    public Instant deadline() {
        return deadline;
    }
}
