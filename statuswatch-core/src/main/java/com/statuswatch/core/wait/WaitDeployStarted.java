package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

import java.time.Duration;
import java.util.stream.Stream;

/**
 * Satisfied once status lists at least the given number of applications.
 */
public class WaitDeployStarted extends BaseCondition {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1200);

    private final int applicationCount;

    public WaitDeployStarted(int applicationCount) {
        this(applicationCount, DEFAULT_TIMEOUT);
    }

    public WaitDeployStarted(int applicationCount, Duration timeout) {
        super(timeout);
        if (applicationCount < 0) {
            throw new IllegalArgumentException("applicationCount must not be negative: " + applicationCount);
        }
        this.applicationCount = applicationCount;
    }

    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        int deployed = status.applicationCount();
        if (deployed >= applicationCount) {
            return Stream.empty();
        }
        return Stream.of(new BlockingState("applications", "deployed " + deployed + " of " + applicationCount));
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new ApplicationsNotStartedException(modelName, status);
    }
}
