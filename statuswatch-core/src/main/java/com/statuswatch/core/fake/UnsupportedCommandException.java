package com.statuswatch.core.fake;

/**
 * Thrown when the simulator is asked to run a command it does not know.
 */
public class UnsupportedCommandException extends RuntimeException {

    private final String command;

    public UnsupportedCommandException(String command) {
        super("Unsupported command: " + command);
        this.command = command;
    }

    public String command() {
        return command;
    }
}
