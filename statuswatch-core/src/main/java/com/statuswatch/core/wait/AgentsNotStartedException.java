package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

/**
 * Thrown when agents did not start.
 */
public class AgentsNotStartedException extends StatusNotMetException {

    public AgentsNotStartedException(String modelName, StatusDocument status) {
        super(modelName, status, "Timed out waiting for agents to start in " + modelName + ".");
    }
}
