package com.statuswatch.core.status;

/**
 * Thrown when an agent reports an error while agents are expected to be starting.
 */
public class ErroredUnitException extends RuntimeException {

    private final String unitName;
    private final String state;

    public ErroredUnitException(String unitName, String state) {
        super(unitName + " is in state " + state);
        this.unitName = unitName;
        this.state = state;
    }

    public String unitName() {
        return unitName;
    }

    public String state() {
        return state;
    }
}
