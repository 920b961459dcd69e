package com.statuswatch.core.status;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a single {@link StatusItem} to a {@link StatusError}, or to nothing.
 *
 * <p><b>Rules, applied in order:</b>
 * <ol>
 *   <li>machine {@code error} → {@link StatusErrorKind#MACHINE_ERROR}</li>
 *   <li>machine {@code provisioning error} → {@link StatusErrorKind#PROVISIONING_ERROR}</li>
 *   <li>machine {@code allocating} → {@link StatusErrorKind#STUCK_ALLOCATING_ERROR}</li>
 *   <li>agent {@code allocating} → no error</li>
 *   <li>application {@code error} → {@link StatusErrorKind#APP_ERROR}</li>
 *   <li>workload {@code error} → install, hook or generic unit error by message</li>
 *   <li>agent {@code error} → {@link StatusErrorKind#AGENT_ERROR}, or
 *       {@link StatusErrorKind#AGENT_UNRESOLVED_ERROR} once the error is older than the
 *       grace period</li>
 * </ol>
 *
 * <p>Classification depends only on the item and the clock, so it is idempotent for a
 * fixed clock.
 */
public class ErrorClassifier {

    /**
     * Time an agent may stay in error before it counts as unresolved.
     */
    public static final Duration DEFAULT_AGENT_GRACE_PERIOD = Duration.ofMinutes(5);

    private static final String ERROR = "error";
    private static final String ALLOCATING = "allocating";
    private static final Pattern INSTALL_HOOK = Pattern.compile("hook failed: \".*install.*\".*", Pattern.DOTALL);
    private static final Pattern HOOK_FAILED = Pattern.compile("hook failed.*", Pattern.DOTALL);
    private static final Pattern HOOK_NAME = Pattern.compile("^hook failed: \"([^\"]+)\"$");

    private static final ErrorClassifier DEFAULT =
        new ErrorClassifier(Clock.systemUTC(), DEFAULT_AGENT_GRACE_PERIOD);

    private final Clock clock;
    private final Duration agentGracePeriod;

    public ErrorClassifier(Clock clock, Duration agentGracePeriod) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.agentGracePeriod = Objects.requireNonNull(agentGracePeriod, "agentGracePeriod must not be null");
    }

    /**
     * Returns the classifier using the system clock and the default grace period.
     *
     * @return default classifier
     */
    public static ErrorClassifier defaults() {
        return DEFAULT;
    }

    public Duration agentGracePeriod() {
        return agentGracePeriod;
    }

    /**
     * Classifies a status item.
     *
     * @param item status item
     * @return the error the item represents, or empty when it is healthy
     */
    public Optional<StatusError> classify(StatusItem item) {
        String current = item.current();
        String name = item.itemName();
        String message = item.message();

        return switch (item.kind()) {
            case MACHINE -> classifyMachine(current, name, message);
            case AGENT -> ERROR.equals(current) ? Optional.of(classifyAgent(item)) : Optional.empty();
            case APPLICATION -> ERROR.equals(current)
                ? Optional.of(new StatusError(StatusErrorKind.APP_ERROR, name, message))
                : Optional.empty();
            case WORKLOAD -> ERROR.equals(current)
                ? Optional.of(classifyWorkload(name, message))
                : Optional.empty();
        };
    }

    private Optional<StatusError> classifyMachine(String current, String name, String message) {
        if (ERROR.equals(current)) {
            return Optional.of(new StatusError(StatusErrorKind.MACHINE_ERROR, name, message));
        }
        if ("provisioning error".equals(current)) {
            return Optional.of(new StatusError(StatusErrorKind.PROVISIONING_ERROR, name, message));
        }
        if (ALLOCATING.equals(current)) {
            return Optional.of(new StatusError(StatusErrorKind.STUCK_ALLOCATING_ERROR, name,
                "Stuck allocating. Last message: " + message));
        }
        return Optional.empty();
    }

    private StatusError classifyWorkload(String name, String message) {
        if (message == null) {
            return new StatusError(StatusErrorKind.UNIT_ERROR, name, null);
        }
        if (INSTALL_HOOK.matcher(message).matches()) {
            return new StatusError(StatusErrorKind.INSTALL_ERROR, name, hookName(message));
        }
        if (HOOK_FAILED.matcher(message).matches()) {
            return new StatusError(StatusErrorKind.HOOK_FAILED_ERROR, name, hookName(message));
        }
        return new StatusError(StatusErrorKind.UNIT_ERROR, name, message);
    }

    private StatusError classifyAgent(StatusItem item) {
        Optional<Instant> since = item.sinceInstant();
        if (since.isEmpty()) {
            return new StatusError(StatusErrorKind.AGENT_ERROR, item.itemName(), item.message());
        }
        Duration elapsed = Duration.between(since.get(), clock.instant());
        if (elapsed.compareTo(agentGracePeriod) > 0) {
            return new StatusError(StatusErrorKind.AGENT_UNRESOLVED_ERROR, item.itemName(), item.message());
        }
        return new StatusError(StatusErrorKind.AGENT_ERROR, item.itemName(), item.message());
    }

    private static String hookName(String message) {
        Matcher matcher = HOOK_NAME.matcher(message);
        return matcher.matches() ? matcher.group(1) : message;
    }
}
