package com.statuswatch.core.wait;

import com.fasterxml.jackson.databind.JsonNode;
import com.statuswatch.core.status.StatusDocument;
import com.statuswatch.core.status.StatusEntry;

import java.time.Duration;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Satisfied once every unit workload is {@code active} or reports no workload status.
 */
public class WaitWorkloadsReady extends BaseCondition {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(600);

    private static final Set<String> READY = Set.of("active", "unknown");

    public WaitWorkloadsReady() {
        this(DEFAULT_TIMEOUT);
    }

    public WaitWorkloadsReady(Duration timeout) {
        super(timeout);
    }

    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        return status.units().stream()
            .map(unit -> new BlockingState(unit.name(), workloadState(unit)))
            .filter(state -> !READY.contains(state.state()));
    }

    static String workloadState(StatusEntry unit) {
        JsonNode workload = unit.data().get("workload-status");
        if (workload == null || workload.isNull()) {
            return "unknown";
        }
        return workload.path("current").asText("unknown");
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new WorkloadsNotReadyException(modelName, status);
    }
}
