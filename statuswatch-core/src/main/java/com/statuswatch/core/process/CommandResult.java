package com.statuswatch.core.process;

import java.util.Objects;

/**
 * Outcome of a command that exited successfully.
 *
 * @param returnCode exit status (0 for success)
 * @param output captured output, empty for commands that print nothing
 * @param time timing record for the command
 */
public record CommandResult(int returnCode, String output, CommandTime time) {

    /**
     * Compact constructor with validation.
     */
    public CommandResult {
        Objects.requireNonNull(time, "time must not be null");
        if (output == null) {
            output = "";
        }
    }
}
