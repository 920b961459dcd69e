package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

/**
 * Thrown when controller machines did not all gain a vote.
 */
public class VotingNotEnabledException extends StatusNotMetException {

    public VotingNotEnabledException(String modelName, StatusDocument status) {
        super(modelName, status, "Timed out waiting for voting to be enabled in " + modelName + ".");
    }
}
