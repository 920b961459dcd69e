package com.statuswatch.core.client;

import com.statuswatch.core.config.HarnessConfig.CliConfig;
import com.statuswatch.core.process.CommandResult;
import com.statuswatch.core.process.CommandTime;
import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.wait.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands through the real command-line tool as child processes.
 *
 * <p>Invocations take the form {@code <executable> <command> [-m <model>] <args...>}.
 * Standard output and standard error are captured separately.
 */
public class ProcessBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(ProcessBackend.class);

    static final int LAUNCH_FAILED = 127;
    static final int TIMED_OUT = 124;
    static final String DATA_DIR_VARIABLE = "JUJU_DATA";

    private final String executable;
    private final Map<String, String> environment;
    private final Clock clock;
    private final Sleeper sleeper;

    public ProcessBackend(String executable, Map<String, String> environment) {
        this(executable, environment, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public ProcessBackend(String executable, Map<String, String> environment, Clock clock, Sleeper sleeper) {
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Creates a backend for the configured executable, exporting the data directory if set.
     *
     * @param config command-line tool settings
     * @return process backend
     */
    public static ProcessBackend fromConfig(CliConfig config) {
        Map<String, String> environment = new HashMap<>();
        if (config.dataDir() != null) {
            environment.put(DATA_DIR_VARIABLE, config.dataDir());
        }
        return new ProcessBackend(config.path(), environment);
    }

    @Override
    public CommandResult run(String command, List<String> args, String model, Duration timeout) {
        List<String> fullArgs = fullArgs(command, args, model);
        log.info("{}", String.join(" ", fullArgs));
        CommandTime time = new CommandTime(command, fullArgs, environment, clock, null);

        ProcessBuilder builder = new ProcessBuilder(fullArgs);
        builder.environment().putAll(environment);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ProcessFailedException(LAUNCH_FAILED, fullArgs, "", e.getMessage());
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
        int returnCode;
        try {
            if (timeout == null) {
                returnCode = process.waitFor();
            } else if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                returnCode = process.exitValue();
            } else {
                process.destroyForcibly();
                throw new ProcessFailedException(TIMED_OUT, fullArgs, "", "Timed out after " + timeout);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running " + command, e);
        }

        String output = stdout.join();
        if (returnCode != 0) {
            String error = stderr.join();
            log.debug("{} exited with {}: {}", command, returnCode, error);
            throw new ProcessFailedException(returnCode, fullArgs, output, error);
        }
        return new CommandResult(returnCode, output, time);
    }

    List<String> fullArgs(String command, List<String> args, String model) {
        List<String> full = new ArrayList<>();
        full.add(executable);
        full.add(command);
        if (model != null) {
            full.add("-m");
            full.add(model);
        }
        full.addAll(args);
        return full;
    }

    private static String read(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void pause(Duration duration) {
        log.info("Pausing for {}", duration);
        sleeper.sleep(duration);
    }
}
