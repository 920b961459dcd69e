package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

import java.time.Duration;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Satisfied once an application no longer appears in status.
 */
public class WaitApplicationNotPresent extends BaseCondition {

    private final String application;

    public WaitApplicationNotPresent(String application) {
        this(application, DEFAULT_TIMEOUT);
    }

    public WaitApplicationNotPresent(String application, Duration timeout) {
        super(timeout);
        this.application = Objects.requireNonNull(application, "application must not be null");
    }

    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        if (status.applications().has(application)) {
            return Stream.of(new BlockingState(application, "still-present"));
        }
        return Stream.empty();
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new StatusNotMetException(modelName, status,
            "Timed out waiting for application removal " + application);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        WaitApplicationNotPresent that = (WaitApplicationNotPresent) other;
        return application.equals(that.application) && timeout().equals(that.timeout());
    }

    @Override
    public int hashCode() {
        return Objects.hash(application, timeout());
    }
}
