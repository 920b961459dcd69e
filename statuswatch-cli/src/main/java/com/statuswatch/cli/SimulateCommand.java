package com.statuswatch.cli;

import com.statuswatch.core.client.FakeBackend;
import com.statuswatch.core.client.ModelClient;
import com.statuswatch.core.client.SoftDeadlineExceededException;
import com.statuswatch.core.fake.CommandDispatcher;
import com.statuswatch.core.fake.ControllerOperationException;
import com.statuswatch.core.fake.ControllerState;
import com.statuswatch.core.fake.UnsupportedCommandException;
import com.statuswatch.core.process.CommandResult;
import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.status.StatusError;
import com.statuswatch.core.wait.StatusNotMetException;
import com.statuswatch.core.wait.StatusTimeoutException;
import com.statuswatch.core.wait.WaitCondition;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs a command script against the in-memory controller simulator.
 *
 * <p>Each script line is one command with whitespace-separated arguments. Blank lines and
 * lines starting with {@code #} are skipped. {@code use <model>} switches the model later
 * lines run against. After the script the final status of the current model is printed, and
 * the optional {@code --wait} condition is checked against it.
 *
 * <p><b>Example script:</b>
 * <pre>{@code
 * bootstrap lxd ctl --default-model default
 * deploy dummy-source
 * add-unit dummy-source -n 2
 * use controller
 * enable-ha -n 3
 * }</pre>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * statuswatch simulate scenario.txt --wait ha
 * }</pre>
 */
@Command(
    name = "simulate",
    description = "Run a command script against the controller simulator",
    mixinStandardHelpOptions = true
)
public class SimulateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SimulateCommand.class);

    static final String USE_MODEL = "use";

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Script file, one command per line"
    )
    private Path script;

    @Option(
        names = {"-m", "--model"},
        description = "Model to run commands against (default: ${DEFAULT-VALUE})",
        defaultValue = "default"
    )
    private String model;

    @Option(
        names = {"-w", "--wait"},
        description = "Condition to wait for after the script (see 'statuswatch list conditions')"
    )
    private String waitCondition;

    @Option(
        names = {"--wait-arg"},
        description = "Argument of the wait condition; may be repeated"
    )
    private List<String> waitArgs = new ArrayList<>();

    @Option(
        names = {"--no-status"},
        description = "Do not print the final status"
    )
    private boolean noStatus;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.isRegularFile(script)) {
            err.println("✗ Script not found: " + script);
            return 1;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(script);
        } catch (IOException e) {
            log.error("Failed to read script {}", script, e);
            err.println("✗ Failed to read script: " + e.getMessage());
            return 1;
        }

        SimulatedClock clock = new SimulatedClock(Instant.now());
        FakeBackend backend = new FakeBackend(new CommandDispatcher(new ControllerState(), clock));
        ModelClient client = ModelClient.builder(backend)
            .modelName(model)
            .clock(clock)
            .sleeper(clock.sleeper())
            .out(out)
            .build();

        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            List<String> words = Arrays.asList(trimmed.split("\\s+"));
            String command = words.get(0);
            List<String> args = words.subList(1, words.size());

            if (USE_MODEL.equals(command)) {
                if (args.size() != 1) {
                    err.println("✗ Line " + lineNumber + ": use expects one model name");
                    return 2;
                }
                client = client.forModel(args.get(0));
                log.debug("Switched to model {}", client.modelName());
                continue;
            }

            try {
                CommandResult result = client.juju(command, args);
                if (!result.output().isEmpty()) {
                    out.println(result.output().stripTrailing());
                }
            } catch (UnsupportedCommandException e) {
                err.println("✗ Line " + lineNumber + ": " + e.getMessage());
                return 2;
            } catch (ProcessFailedException | ControllerOperationException | SoftDeadlineExceededException e) {
                log.error("Script line {} failed: {}", lineNumber, trimmed, e);
                err.println("✗ Line " + lineNumber + " failed: " + e.getMessage());
                return 1;
            }
        }
        out.println("✓ Ran " + script.getFileName() + " against model " + client.modelName());

        if (!noStatus) {
            try {
                out.println(client.getStatus().toText().stripTrailing());
            } catch (StatusTimeoutException e) {
                log.error("Status of model {} unavailable", client.modelName(), e);
                err.println("✗ Status failed: " + e.getMessage());
                return 1;
            }
        }

        if (waitCondition == null) {
            return 0;
        }
        return waitFor(client, out, err);
    }

    private int waitFor(ModelClient client, PrintWriter out, PrintWriter err) {
        WaitCondition condition;
        try {
            condition = ConditionFactory.create(waitCondition, waitArgs, null);
        } catch (IllegalArgumentException e) {
            err.println("✗ " + e.getMessage());
            return 2;
        }
        try {
            client.waitFor(condition, true);
            out.println("✓ Condition " + waitCondition + " met in " + client.modelName());
            return 0;
        } catch (StatusNotMetException | StatusTimeoutException | StatusError | ProcessFailedException
                 | SoftDeadlineExceededException e) {
            log.error("Wait failed", e);
            err.println("✗ Wait failed: " + e.getMessage());
            return 1;
        }
    }
}
