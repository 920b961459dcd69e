package com.statuswatch;

import ch.qos.logback.classic.Level;
import com.statuswatch.cli.ListCommand;
import com.statuswatch.cli.SimulateCommand;
import com.statuswatch.cli.StatusCommand;
import com.statuswatch.cli.WaitCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for StatusWatch.
 *
 * <p>StatusWatch inspects controller status, waits for models to reach a state, and runs
 * scripted scenarios against an in-memory controller simulator.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code status} - Parse a status file and report its entities and errors</li>
 *   <li>{@code wait} - Wait for a condition on a live model</li>
 *   <li>{@code simulate} - Run a command script against the simulator</li>
 *   <li>{@code list} - List wait conditions or simulator commands</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Classify errors in a saved status
 * statuswatch status status.yaml
 *
 * # Wait for all agents of the configured model to start
 * statuswatch wait started --timeout 600
 *
 * # Run a simulator scenario and wait for HA
 * statuswatch simulate scenario.txt --wait ha
 * }</pre>
 */
@Command(
    name = "statuswatch",
    mixinStandardHelpOptions = true,
    version = "StatusWatch 1.0.0-SNAPSHOT",
    description = "Observe and wait on controller status, live or simulated",
    subcommands = {
        StatusCommand.class,
        WaitCommand.class,
        SimulateCommand.class,
        ListCommand.class
    }
)
public class StatusWatchCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StatusWatchCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("StatusWatch - Controller status observation and simulation");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'statuswatch --help' to see available commands");
        System.out.println("Use 'statuswatch <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        StatusWatchCLI cli = new StatusWatchCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
