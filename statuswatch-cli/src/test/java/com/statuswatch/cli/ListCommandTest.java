package com.statuswatch.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new ListCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void list_default_listsConditionsWithSynopsis() {
        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .startsWith("Wait conditions:")
            .contains("  • started\n")
            .contains("  • subordinates <application> <unit-prefix>\n")
            .contains("  • version <version>\n");
    }

    @Test
    void list_commands_listsSimulatorCommandsWithScope() {
        int exitCode = commandLine.execute("commands");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .startsWith("Simulator commands:")
            .containsPattern("  • bootstrap +controller")
            .containsPattern("  • add-machine +model");
    }

    @Test
    void list_unknownType_returnsOne() {
        int exitCode = commandLine.execute("widgets");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown type: widgets");
    }
}
