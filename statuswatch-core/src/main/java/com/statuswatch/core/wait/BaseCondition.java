package com.statuswatch.core.wait;

import java.time.Duration;
import java.util.Objects;

/**
 * Holds the timeout and the already-satisfied flag shared by all conditions.
 */
public abstract class BaseCondition implements WaitCondition {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    private final Duration timeout;
    private final boolean alreadySatisfied;

    protected BaseCondition() {
        this(DEFAULT_TIMEOUT, false);
    }

    protected BaseCondition(Duration timeout) {
        this(timeout, false);
    }

    protected BaseCondition(Duration timeout, boolean alreadySatisfied) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        this.alreadySatisfied = alreadySatisfied;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public boolean alreadySatisfied() {
        return alreadySatisfied;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[timeout=" + timeout + "]";
    }
}
