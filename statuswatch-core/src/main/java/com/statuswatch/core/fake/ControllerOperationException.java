package com.statuswatch.core.fake;

/**
 * Thrown when a controller-only operation is run against a hosted model.
 */
public class ControllerOperationException extends RuntimeException {

    private final String operation;

    public ControllerOperationException(String operation) {
        super("Operation \"" + operation + "\" is only valid on controller models.");
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
