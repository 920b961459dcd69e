package com.statuswatch.core.wait;

import com.statuswatch.core.process.CommandTime;
import com.statuswatch.core.status.StatusDocument;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Wraps another condition and records when the command that started it actually
 * completed.
 *
 * <p>The command is marked complete the first time the wrapped condition stops
 * blocking, or immediately if the wrapped condition is already satisfied.
 */
public class CommandComplete extends BaseCondition {

    private final WaitCondition realCondition;
    private final CommandTime commandTime;

    public CommandComplete(WaitCondition realCondition, CommandTime commandTime) {
        super(realCondition.timeout(), realCondition.alreadySatisfied());
        this.realCondition = realCondition;
        this.commandTime = Objects.requireNonNull(commandTime, "commandTime must not be null");
        if (realCondition.alreadySatisfied()) {
            commandTime.actualCompletion();
        }
    }

    public CommandTime commandTime() {
        return commandTime;
    }

    @Override
    public Stream<BlockingState> blockingStates(StatusDocument status) {
        List<BlockingState> blocking = realCondition.blockingStates(status).toList();
        if (blocking.isEmpty()) {
            commandTime.actualCompletion();
        }
        return blocking.stream();
    }

    @Override
    public void doRaise(String modelName, StatusDocument status) {
        throw new StatusNotMetException(modelName, status, String.format(
            "Timed out waiting for \"%s\" command to complete: \"%s\"",
            commandTime.command(), String.join(" ", commandTime.fullArgs())));
    }
}
