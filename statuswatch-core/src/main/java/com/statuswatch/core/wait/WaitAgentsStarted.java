package com.statuswatch.core.wait;

import com.statuswatch.core.status.ErroredUnitException;
import com.statuswatch.core.status.StatusDocument;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Stream;

/**
 * Satisfied once every machine, container and unit agent is started or idle.
 */
public class WaitAgentsStarted extends BaseCondition {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1200);

    private static final Set<String> READY = Set.of("started", "idle");

    public WaitAgentsStarted() {
        this(DEFAULT_TIMEOUT);
    }

    public WaitAgentsStarted(Duration timeout) {
        super(timeout);
    }

    /**
     * Reports every agent that is neither started nor idle.
     *
     * @throws ErroredUnitException if an agent reports an error
     */
    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        SortedMap<String, List<String>> states = status.checkAgentsStarted().orElse(null);
        if (states == null) {
            return Stream.empty();
        }
        return states.entrySet().stream()
            .filter(entry -> !READY.contains(entry.getKey()))
            .flatMap(WaitAgentsStarted::toBlocking);
    }

    private static Stream<BlockingState> toBlocking(Map.Entry<String, List<String>> group) {
        return group.getValue().stream().map(item -> new BlockingState(item, group.getKey()));
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new AgentsNotStartedException(modelName, status);
    }
}
