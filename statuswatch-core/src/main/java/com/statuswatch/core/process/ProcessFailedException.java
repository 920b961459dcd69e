package com.statuswatch.core.process;

import java.util.List;

/**
 * A command exited unsuccessfully.
 *
 * <p>Raised both by the real process backend and by the simulator, so callers cannot tell a
 * simulated failure from a real one.
 */
public class ProcessFailedException extends RuntimeException {

    private final int returnCode;
    private final List<String> command;
    private final String output;
    private final String stderr;

    public ProcessFailedException(int returnCode, List<String> command, String output, String stderr) {
        super("Command " + String.join(" ", command) + " returned non-zero exit status " + returnCode
            + (stderr == null || stderr.isEmpty() ? "" : ": " + stderr));
        this.returnCode = returnCode;
        this.command = List.copyOf(command);
        this.output = output == null ? "" : output;
        this.stderr = stderr == null ? "" : stderr;
    }

    public ProcessFailedException(int returnCode, String command, String stderr) {
        this(returnCode, List.of(command), "", stderr);
    }

    public int returnCode() {
        return returnCode;
    }

    public List<String> command() {
        return command;
    }

    /**
     * Returns the captured standard output.
     *
     * @return stdout text, never null
     */
    public String output() {
        return output;
    }

    /**
     * Returns the captured standard error.
     *
     * @return stderr text, never null
     */
    public String stderr() {
        return stderr;
    }
}
