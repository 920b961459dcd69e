package com.statuswatch.core.wait;

import com.statuswatch.core.status.ErroredUnitException;
import com.statuswatch.core.status.StatusDocument;
import com.statuswatch.core.status.StatusEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Satisfied once at least three controller machines have a vote and no controller
 * machine is in any other member state.
 *
 * <p>Machines without a {@code controller-member-status} are ignored. Must be run against
 * the controller model.
 */
public class WaitHaEnabled extends BaseCondition {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1200);
    public static final int MINIMUM_VOTERS = 3;
    public static final String HAS_VOTE = "has-vote";

    public WaitHaEnabled() {
        this(DEFAULT_TIMEOUT);
    }

    public WaitHaEnabled(Duration timeout) {
        super(timeout);
    }

    /**
     * Reports controller machines without a vote, and a shortfall of voters if any.
     *
     * @throws ErroredUnitException if an agent reports an error
     */
    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        status.checkAgentsStarted();
        List<BlockingState> blocking = new ArrayList<>();
        int voters = 0;
        for (StatusEntry machine : status.machines(true)) {
            String member = StatusDocument.controllerMemberStatus(machine.data());
            if (member == null) {
                continue;
            }
            if (HAS_VOTE.equals(member)) {
                voters++;
            } else {
                blocking.add(new BlockingState(machine.name(), member));
            }
        }
        if (voters < MINIMUM_VOTERS) {
            blocking.add(new BlockingState("controller", "voters " + voters + " of " + MINIMUM_VOTERS));
        }
        return blocking.stream();
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new VotingNotEnabledException(modelName, status);
    }
}
