package com.statuswatch.core.process;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Timing of one command: when it was issued and when it actually completed.
 *
 * <p>A command that returns before its effects settle (for example {@code deploy}) is
 * completed later, when a wait condition observes the expected state. Only the first
 * completion is recorded.
 */
public class CommandTime {

    private final String command;
    private final List<String> fullArgs;
    private final Map<String, String> envVars;
    private final Clock clock;
    private final Instant start;
    private Instant end;

    public CommandTime(String command, List<String> fullArgs) {
        this(command, fullArgs, Map.of(), Clock.systemUTC(), null);
    }

    public CommandTime(String command, List<String> fullArgs, Map<String, String> envVars, Clock clock, Instant start) {
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.fullArgs = List.copyOf(fullArgs);
        this.envVars = envVars == null ? Map.of() : Map.copyOf(envVars);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.start = start != null ? start : clock.instant();
    }

    public String command() {
        return command;
    }

    public List<String> fullArgs() {
        return fullArgs;
    }

    public Map<String, String> envVars() {
        return envVars;
    }

    public Instant start() {
        return start;
    }

    public Optional<Instant> end() {
        return Optional.ofNullable(end);
    }

    /**
     * Marks the command complete now. Calls after the first are ignored.
     */
    public void actualCompletion() {
        actualCompletion(clock.instant());
    }

    /**
     * Marks the command complete at {@code at}. Calls after the first are ignored.
     *
     * @param at completion time
     */
    public void actualCompletion(Instant at) {
        if (end == null) {
            end = at;
        }
    }

    /**
     * Returns how long the command took.
     *
     * @return duration, or empty if it has not completed
     */
    public Optional<Duration> totalTime() {
        return end().map(finished -> Duration.between(start, finished));
    }
}
