package com.statuswatch.cli;

import com.statuswatch.core.wait.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock for simulator runs; time only moves when the paired {@link Sleeper} sleeps.
 */
final class SimulatedClock extends Clock {

    private Instant now;

    SimulatedClock(Instant start) {
        this.now = start;
    }

    /**
     * Returns a sleeper that advances this clock instead of blocking.
     */
    Sleeper sleeper() {
        return this::advance;
    }

    void advance(Duration duration) {
        now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException("SimulatedClock is fixed to UTC");
    }

    @Override
    public Instant instant() {
        return now;
    }
}
