package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

import java.time.Duration;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Satisfied once a machine no longer appears in status.
 */
public class WaitMachineNotPresent extends BaseCondition {

    private final String machine;

    public WaitMachineNotPresent(String machine) {
        this(machine, DEFAULT_TIMEOUT);
    }

    public WaitMachineNotPresent(String machine, Duration timeout) {
        super(timeout);
        this.machine = Objects.requireNonNull(machine, "machine must not be null");
    }

    public String machine() {
        return machine;
    }

    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        return status.machines(false).stream()
            .filter(entry -> entry.name().equals(machine))
            .map(entry -> new BlockingState(entry.name(), "still-present"));
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new StatusNotMetException(modelName, status, "Timed out waiting for machine removal " + machine);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        WaitMachineNotPresent that = (WaitMachineNotPresent) other;
        return machine.equals(that.machine) && timeout().equals(that.timeout());
    }

    @Override
    public int hashCode() {
        return Objects.hash(machine, timeout());
    }

    @Override
    public String toString() {
        return "WaitMachineNotPresent[machine=" + machine + ", timeout=" + timeout() + "]";
    }
}
