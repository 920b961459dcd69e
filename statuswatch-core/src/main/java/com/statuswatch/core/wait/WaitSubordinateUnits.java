package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;
import com.statuswatch.core.status.StatusEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Satisfied once every unit of an application carries a started subordinate whose name
 * begins with the given prefix.
 */
public class WaitSubordinateUnits extends BaseCondition {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1200);

    private static final Set<String> READY = Set.of("started", "idle");

    private final String application;
    private final String unitPrefix;

    public WaitSubordinateUnits(String application, String unitPrefix) {
        this(application, unitPrefix, DEFAULT_TIMEOUT);
    }

    public WaitSubordinateUnits(String application, String unitPrefix, Duration timeout) {
        super(timeout);
        this.application = Objects.requireNonNull(application, "application must not be null");
        this.unitPrefix = Objects.requireNonNull(unitPrefix, "unitPrefix must not be null");
    }

    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        if (!status.hasApplication(application)) {
            return Stream.of(new BlockingState(application, "absent"));
        }
        List<BlockingState> blocking = new ArrayList<>();
        int count = 0;
        for (StatusEntry sub : status.subordinateUnits(application)) {
            if (!sub.name().startsWith(unitPrefix + "/")) {
                continue;
            }
            count++;
            String state = StatusDocument.coalesceAgentStatus(sub.data());
            if (!READY.contains(state)) {
                blocking.add(new BlockingState(sub.name(), state));
            }
        }
        int expected = status.applicationUnitCount(application);
        if (count != expected) {
            blocking.add(new BlockingState(application, "subordinates " + count + " of " + expected));
        }
        return blocking.stream();
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new AgentsNotStartedException(modelName, status);
    }
}
