package com.statuswatch.core.wait;

import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.report.GroupReporter;
import com.statuswatch.core.status.ErrorClassifier;
import com.statuswatch.core.status.StatusDocument;
import com.statuswatch.core.status.StatusError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Polls status until a {@link WaitCondition} is met, a fatal error shows up, or the
 * condition times out.
 *
 * <p><b>Loop:</b>
 * <ol>
 *   <li>Fetch a snapshot; failed status calls are retried within the status budget.</li>
 *   <li>Throw the most severe non-recoverable {@link StatusError}, if any.</li>
 *   <li>Group the condition's blocking states by reason; return if there are none.</li>
 *   <li>Report the groups, sleep the poll interval, and repeat while time remains.</li>
 * </ol>
 *
 * <p>The first poll always happens. On timeout the last snapshot is checked once more for
 * any error, recoverable ones included, before the condition raises. A wait may overrun
 * its timeout by one status budget plus one poll interval.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StatusPoller poller = new StatusPoller(client::fetchStatus, Clock.systemUTC(),
 *     Sleeper.SYSTEM, PollSettings.defaults(), ErrorClassifier.defaults(), System.out);
 * StatusDocument status = poller.waitFor(new WaitAgentsStarted(), "default", false);
 * }</pre>
 */
public class StatusPoller {

    private static final Logger log = LoggerFactory.getLogger(StatusPoller.class);

    private final StatusSource source;
    private final Clock clock;
    private final Sleeper sleeper;
    private final PollSettings settings;
    private final ErrorClassifier classifier;
    private final Appendable out;

    public StatusPoller(StatusSource source, Clock clock, Sleeper sleeper, PollSettings settings,
                        ErrorClassifier classifier, Appendable out) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    public PollSettings settings() {
        return settings;
    }

    /**
     * Fetches one snapshot, retrying failed status calls until the status budget runs out.
     *
     * @return status snapshot
     * @throws StatusTimeoutException if no call succeeded within the budget
     */
    public StatusDocument fetchStatus() {
        Instant start = clock.instant();
        ProcessFailedException lastFailure;
        while (true) {
            try {
                return source.fetch();
            } catch (ProcessFailedException e) {
                lastFailure = e;
                log.debug("Status call failed with code {}: {}", e.returnCode(), e.stderr());
            }
            if (!hasTimeLeft(start, settings.statusBudget())) {
                break;
            }
            sleeper.sleep(settings.retryDelay());
        }
        throw new StatusTimeoutException("Timed out waiting for status to succeed", lastFailure);
    }

    /**
     * Waits until {@code condition} is met.
     *
     * @param condition condition to wait for
     * @param modelName model name passed to {@link WaitCondition#doRaise}
     * @param quiet     whether to suppress progress output
     * @return the snapshot in which the condition was met
     * @throws StatusError           if a fatal error appears, or any error remains at timeout
     * @throws StatusNotMetException (or whatever the condition raises) on timeout
     */
    public StatusDocument waitFor(WaitCondition condition, String modelName, boolean quiet) {
        Objects.requireNonNull(condition, "condition must not be null");
        if (condition.alreadySatisfied()) {
            return fetchStatus();
        }
        log.debug("Waiting up to {} for {}", condition.timeout(), condition);
        GroupReporter reporter = new GroupReporter(out, null, settings.reporterWidth());
        Instant start = clock.instant();
        StatusDocument status = null;
        try {
            do {
                status = fetchStatus();
                status.raiseHighestError(true, classifier);
                SortedMap<String, List<String>> groups = groupByState(condition, status);
                if (groups.isEmpty()) {
                    log.debug("{} met after {}", condition, Duration.between(start, clock.instant()));
                    return status;
                }
                if (!quiet) {
                    reporter.update(groups);
                }
                sleeper.sleep(settings.pollInterval());
            } while (hasTimeLeft(start, condition.timeout()));
            log.error("Timed out waiting for {}. Last status:\n{}", condition, status.statusText());
            status.raiseHighestError(false, classifier);
        } catch (StatusTimeoutException e) {
            log.warn("{}", e.getMessage());
        } finally {
            reporter.finish();
        }
        condition.doRaise(modelName, status);
        throw new IllegalStateException(condition + " did not raise on timeout");
    }

    private static SortedMap<String, List<String>> groupByState(WaitCondition condition, StatusDocument status) {
        SortedMap<String, List<String>> groups = new TreeMap<>();
        condition.blockingStates(status)
            .forEach(blocking -> groups.computeIfAbsent(blocking.state(), key -> new ArrayList<>()).add(blocking.item()));
        return groups;
    }

    private boolean hasTimeLeft(Instant start, Duration limit) {
        return Duration.between(start, clock.instant()).compareTo(limit) < 0;
    }
}
