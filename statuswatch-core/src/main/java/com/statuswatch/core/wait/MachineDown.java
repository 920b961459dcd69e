package com.statuswatch.core.wait;

import com.fasterxml.jackson.databind.JsonNode;
import com.statuswatch.core.status.NoSuchEntityException;
import com.statuswatch.core.status.StatusDocument;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Satisfied once a machine's agent is reported {@code down}.
 */
public class MachineDown extends BaseCondition {

    private final String machineId;

    public MachineDown(String machineId) {
        this.machineId = Objects.requireNonNull(machineId, "machineId must not be null");
    }

    /**
     * Reports the machine's current agent status while it is not {@code down}.
     *
     * @throws NoSuchEntityException if the machine is not in status
     */
    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        JsonNode machine = status.status().path("machines").get(machineId);
        if (machine == null) {
            throw new NoSuchEntityException(machineId);
        }
        String current = machine.path("juju-status").path("current").asText("");
        if ("down".equals(current)) {
            return Stream.empty();
        }
        return Stream.of(new BlockingState(machineId, current));
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new StatusNotMetException(modelName, status,
            "Timed out waiting for juju to determine machine " + machineId + " down.");
    }
}
