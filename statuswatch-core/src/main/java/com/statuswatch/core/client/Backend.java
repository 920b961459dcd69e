package com.statuswatch.core.client;

import com.statuswatch.core.process.CommandResult;
import com.statuswatch.core.process.ProcessFailedException;

import java.time.Duration;
import java.util.List;

/**
 * Runs controller commands for a {@link ModelClient}.
 *
 * <p>{@link ProcessBackend} runs the real command-line tool; {@link FakeBackend} runs the
 * in-memory simulator. Status parsing, error classification and waiting are the same over
 * both.
 */
public interface Backend {

    /**
     * Runs one command.
     *
     * @param command command name, e.g. {@code show-status}
     * @param args    command arguments
     * @param model   model to run against, or null for controller commands
     * @param timeout how long the command may run, or null for no limit
     * @return result of a successful command
     * @throws ProcessFailedException if the command exits non-zero
     */
    CommandResult run(String command, List<String> args, String model, Duration timeout);

    /**
     * Pauses the caller, e.g. to let a controller settle.
     *
     * @param duration pause length
     */
    void pause(Duration duration);
}
