package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

/**
 * Thrown when a wait times out without reaching the expected status.
 *
 * <p>Carries the model name and the last status snapshot seen, which may be null when no
 * status could be fetched at all.
 */
public class StatusNotMetException extends RuntimeException {

    private final String modelName;
    private final transient StatusDocument status;

    public StatusNotMetException(String modelName, StatusDocument status) {
        this(modelName, status, "Expected status not reached in " + modelName + ".");
    }

    public StatusNotMetException(String modelName, StatusDocument status, String message) {
        super(message);
        this.modelName = modelName;
        this.status = status;
    }

    public String modelName() {
        return modelName;
    }

    public StatusDocument status() {
        return status;
    }
}
