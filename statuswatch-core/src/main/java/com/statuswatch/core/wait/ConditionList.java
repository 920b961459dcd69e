package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Combines conditions: satisfied only when all members are.
 *
 * <p>The timeout is the longest member timeout ({@link #DEFAULT_TIMEOUT} when empty). On
 * timeout the first member raises.
 */
public class ConditionList extends BaseCondition {

    private final List<WaitCondition> conditions;

    public ConditionList(List<? extends WaitCondition> conditions) {
        super(longestTimeout(conditions), conditions.stream().allMatch(WaitCondition::alreadySatisfied));
        this.conditions = List.copyOf(conditions);
    }

    private static Duration longestTimeout(List<? extends WaitCondition> conditions) {
        return conditions.stream()
            .map(WaitCondition::timeout)
            .max(Comparator.naturalOrder())
            .orElse(DEFAULT_TIMEOUT);
    }

    public List<WaitCondition> conditions() {
        return conditions;
    }

    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        return conditions.stream().flatMap(condition -> condition.blockingStates(status));
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        if (conditions.isEmpty()) {
            throw new StatusNotMetException(modelName, status);
        }
        conditions.get(0).doRaise(modelName, status);
    }
}
