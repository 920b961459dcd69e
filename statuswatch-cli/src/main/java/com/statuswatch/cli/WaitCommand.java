package com.statuswatch.cli;

import com.statuswatch.core.client.Backend;
import com.statuswatch.core.client.ModelClient;
import com.statuswatch.core.client.ProcessBackend;
import com.statuswatch.core.client.SoftDeadlineExceededException;
import com.statuswatch.core.config.ConfigLoader;
import com.statuswatch.core.config.HarnessConfig;
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

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Waits for a condition on a live model.
 *
 * <p>Runs the configured command-line tool to fetch status until the condition holds or its
 * timeout passes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * statuswatch wait started
 * statuswatch wait version 2.9.1 -m mymodel --timeout 900
 * statuswatch wait ha -c ci/statuswatch.yaml
 * }</pre>
 */
@Command(
    name = "wait",
    description = "Wait for a condition on a live model",
    mixinStandardHelpOptions = true
)
public class WaitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WaitCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Condition name (see 'statuswatch list conditions')"
    )
    private String condition;

    @Parameters(
        index = "1..*",
        arity = "0..*",
        description = "Condition arguments"
    )
    private List<String> conditionArgs = new ArrayList<>();

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME
    )
    private Path configFile;

    @Option(
        names = {"-m", "--model"},
        description = "Model to watch (overrides configuration)"
    )
    private String model;

    @Option(
        names = {"--timeout"},
        description = "Timeout in seconds (default: the condition's own)"
    )
    private Long timeoutSeconds;

    @Option(
        names = {"--quiet"},
        description = "Do not print progress while waiting"
    )
    private boolean quietProgress;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        WaitCondition waitCondition;
        try {
            Duration timeout = timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null;
            waitCondition = ConditionFactory.create(condition, conditionArgs, timeout);
        } catch (IllegalArgumentException e) {
            err.println("✗ " + e.getMessage());
            return 2;
        }

        HarnessConfig config = ConfigLoader.load(configFile);
        ModelClient.Builder builder = ModelClient.configure(ModelClient.builder(backendFor(config)), config)
            .out(out);
        if (model != null) {
            builder.modelName(model);
        }
        ModelClient client = builder.build();

        log.info("Waiting for {} in model {}", waitCondition, client.modelName());
        try {
            client.waitFor(waitCondition, quietProgress);
            out.flush();
            out.println("✓ Condition " + condition + " met in " + client.modelName());
            return 0;
        } catch (StatusNotMetException | StatusTimeoutException | StatusError | SoftDeadlineExceededException e) {
            log.error("Wait failed", e);
            err.println("✗ Wait failed: " + e.getMessage());
            return 1;
        } catch (ProcessFailedException e) {
            log.error("Wait failed", e);
            err.println("✗ Wait failed: " + e.getMessage());
            return e.returnCode() == 0 ? 1 : e.returnCode();
        }
    }

    Backend backendFor(HarnessConfig config) {
        return ProcessBackend.fromConfig(config.cli());
    }
}
