package com.statuswatch.core.wait;

import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.status.StatusDocument;

/**
 * Fetches one status snapshot.
 */
@FunctionalInterface
public interface StatusSource {

    /**
     * @return current status
     * @throws ProcessFailedException if the status command failed
     */
    StatusDocument fetch();
}
