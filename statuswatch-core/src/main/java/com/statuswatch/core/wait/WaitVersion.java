package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

import java.time.Duration;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Satisfied once every agent reports the target version.
 *
 * <p>Agents on another version block with their current version as the state.
 */
public class WaitVersion extends BaseCondition {

    private final String targetVersion;

    public WaitVersion(String targetVersion) {
        this(targetVersion, DEFAULT_TIMEOUT);
    }

    public WaitVersion(String targetVersion, Duration timeout) {
        super(timeout);
        this.targetVersion = Objects.requireNonNull(targetVersion, "targetVersion must not be null");
    }

    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        return status.agentVersions().entrySet().stream()
            .filter(entry -> !entry.getKey().equals(targetVersion))
            .flatMap(entry -> entry.getValue().stream().map(agent -> new BlockingState(agent, entry.getKey())));
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new VersionsNotUpdatedException(modelName, status);
    }
}
