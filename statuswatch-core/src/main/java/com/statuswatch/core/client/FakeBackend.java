package com.statuswatch.core.client;

import com.statuswatch.core.fake.CommandDispatcher;
import com.statuswatch.core.fake.ControllerState;
import com.statuswatch.core.process.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Runs commands against the in-memory simulator.
 *
 * <p>Several backends may share one {@link CommandDispatcher} and so one
 * {@link ControllerState}. Pauses return immediately.
 */
public class FakeBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(FakeBackend.class);

    private final CommandDispatcher dispatcher;

    public FakeBackend(CommandDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    public FakeBackend(ControllerState controller) {
        this(new CommandDispatcher(controller));
    }

    public CommandDispatcher dispatcher() {
        return dispatcher;
    }

    public ControllerState controller() {
        return dispatcher.controller();
    }

    @Override
    public CommandResult run(String command, List<String> args, String model, Duration timeout) {
        return dispatcher.dispatch(command, args, model);
    }

    @Override
    public void pause(Duration duration) {
        log.debug("Skipping pause of {}", duration);
    }
}
