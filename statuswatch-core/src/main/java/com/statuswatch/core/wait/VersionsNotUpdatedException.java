package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

/**
 * Thrown when agent versions did not reach the target.
 */
public class VersionsNotUpdatedException extends StatusNotMetException {

    public VersionsNotUpdatedException(String modelName, StatusDocument status) {
        super(modelName, status, "Some versions did not update.");
    }
}
