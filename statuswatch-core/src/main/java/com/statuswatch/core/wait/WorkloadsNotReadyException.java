package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

/**
 * Thrown when unit workloads did not become ready.
 */
public class WorkloadsNotReadyException extends StatusNotMetException {

    public WorkloadsNotReadyException(String modelName, StatusDocument status) {
        super(modelName, status, "Workloads not ready in " + modelName + ".");
    }
}
