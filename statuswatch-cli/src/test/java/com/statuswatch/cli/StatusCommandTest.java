package com.statuswatch.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StatusCommand}.
 */
class StatusCommandTest {

    private static final String HEALTHY = """
        model:
          name: ci
        machines:
          "0":
            juju-status: {current: started}
            containers:
              0/lxd/0:
                juju-status: {current: started}
        applications:
          wordpress:
            units:
              wordpress/0:
                workload-status: {current: active}
                juju-status: {current: idle}
        """;

    private static final String INSTALL_FAILED = """
        machines:
          "0":
            juju-status: {current: started}
        applications:
          wordpress:
            units:
              wordpress/0:
                workload-status: {current: error, message: 'hook failed: "install"'}
                juju-status: {current: idle}
        """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new StatusCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("status.yaml");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void status_healthy_listsEntitiesAndReturnsZero() throws IOException {
        int exitCode = commandLine.execute(write(HEALTHY).toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Model: ci")
            .contains("Machines (2):\n  • 0\n  • 0/lxd/0\n")
            .contains("Units (1):\n  • wordpress/0\n")
            .contains("  idle: wordpress/0")
            .contains("✓ No errors");
    }

    @Test
    void status_withError_listsErrorAndReturnsOne() throws IOException {
        int exitCode = commandLine.execute(write(INSTALL_FAILED).toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("Model: (unnamed)")
            .contains("Errors (1):")
            .contains("wordpress/0")
            .contains("(recoverable)");
    }

    @Test
    void status_ignoreRecoverable_skipsInstallFailure() throws IOException {
        int exitCode = commandLine.execute(write(INSTALL_FAILED).toString(), "--ignore-recoverable");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("✓ No errors");
    }

    @Test
    void status_missingFile_returnsOne() {
        int exitCode = commandLine.execute(tempDir.resolve("missing.yaml").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Status file not found");
    }

    @Test
    void status_unparseableFile_returnsOne() throws IOException {
        int exitCode = commandLine.execute(write("{ not: [valid").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Failed to read status");
    }
}
