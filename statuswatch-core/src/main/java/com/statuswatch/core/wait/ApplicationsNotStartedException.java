package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

/**
 * Thrown when applications were not deployed in time.
 */
public class ApplicationsNotStartedException extends StatusNotMetException {

    public ApplicationsNotStartedException(String modelName, StatusDocument status) {
        super(modelName, status, "Timed out waiting for applications to start in " + modelName + ".");
    }
}
