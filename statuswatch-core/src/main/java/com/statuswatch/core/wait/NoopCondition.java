package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

import java.time.Duration;
import java.util.stream.Stream;

/**
 * A condition that never blocks.
 */
public class NoopCondition extends BaseCondition {

    public NoopCondition() {
        super();
    }

    public NoopCondition(Duration timeout, boolean alreadySatisfied) {
        super(timeout, alreadySatisfied);
    }

    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        return Stream.empty();
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new StatusNotMetException(modelName, status, "NoopCondition failed: " + modelName);
    }
}
