package com.statuswatch.cli;

import com.statuswatch.core.status.ErrorClassifier;
import com.statuswatch.core.status.StatusDocument;
import com.statuswatch.core.status.StatusEntry;
import com.statuswatch.core.status.StatusError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Inspects a saved status document.
 *
 * <p>Prints machines, units and agent states, then every error the document reports, most
 * severe first. Exits with 1 when errors are present.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * statuswatch status status.yaml
 * statuswatch status status.json --ignore-recoverable
 * }</pre>
 */
@Command(
    name = "status",
    description = "Parse a status document and report its entities and errors",
    mixinStandardHelpOptions = true
)
public class StatusCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StatusCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Status file in YAML or JSON format"
    )
    private Path statusFile;

    @Option(
        names = {"--ignore-recoverable"},
        description = "Skip errors a wait would tolerate (default: false)"
    )
    private boolean ignoreRecoverable;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.isRegularFile(statusFile)) {
            err.println("✗ Status file not found: " + statusFile);
            return 1;
        }

        StatusDocument status;
        try {
            status = StatusDocument.fromText(Files.readString(statusFile));
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to read status file {}", statusFile, e);
            err.println("✗ Failed to read status: " + e.getMessage());
            return 1;
        }

        String model = status.modelName();
        out.println("Model: " + (model != null ? model : "(unnamed)"));

        List<StatusEntry> machines = status.machines(true);
        out.println();
        out.println("Machines (" + machines.size() + "):");
        machines.forEach(machine -> out.printf("  • %s%n", machine.name()));

        List<StatusEntry> units = status.units();
        out.println();
        out.println("Units (" + units.size() + "):");
        units.forEach(unit -> out.printf("  • %s%n", unit.name()));

        out.println();
        out.println("Agent states:");
        for (Map.Entry<String, List<String>> entry : status.agentStates().entrySet()) {
            out.printf("  %s: %s%n", entry.getKey(), String.join(", ", entry.getValue()));
        }

        List<StatusError> errors = status.checkForErrors(ignoreRecoverable, ErrorClassifier.defaults());
        out.println();
        if (errors.isEmpty()) {
            out.println("✓ No errors");
            return 0;
        }
        out.println("Errors (" + errors.size() + "):");
        for (StatusError error : errors) {
            out.printf("  ✗ %s %s: %s%s%n", error.kind(), error.itemName(), error.statusMessage(),
                error.recoverable() ? " (recoverable)" : "");
        }
        return 1;
    }
}
