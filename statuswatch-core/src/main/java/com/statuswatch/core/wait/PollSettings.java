package com.statuswatch.core.wait;

import com.statuswatch.core.report.GroupReporter;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of the poll loop.
 *
 * @param statusBudget  how long one status fetch may keep retrying failed calls
 * @param pollInterval  sleep between polls
 * @param retryDelay    sleep between failed status calls
 * @param reporterWidth column at which progress dots wrap
 */
public record PollSettings(Duration statusBudget, Duration pollInterval, Duration retryDelay, int reporterWidth) {

    public static final Duration DEFAULT_STATUS_BUDGET = Duration.ofSeconds(60);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    public PollSettings {
        Objects.requireNonNull(statusBudget, "statusBudget must not be null");
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        if (reporterWidth <= 0) {
            throw new IllegalArgumentException("reporterWidth must be positive: " + reporterWidth);
        }
    }

    public static PollSettings defaults() {
        return new PollSettings(DEFAULT_STATUS_BUDGET, DEFAULT_POLL_INTERVAL, DEFAULT_RETRY_DELAY,
            GroupReporter.DEFAULT_WRAP_WIDTH);
    }
}
