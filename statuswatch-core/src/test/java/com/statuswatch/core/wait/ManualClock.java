package com.statuswatch.core.wait;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Test clock that only moves when told to; its {@link #sleeper()} advances it.
 */
public class ManualClock extends Clock {

    private Instant now;
    private int sleeps;

    public ManualClock() {
        this(Instant.parse("2026-01-01T00:00:00Z"));
    }

    public ManualClock(Instant start) {
        this.now = start;
    }

    public Sleeper sleeper() {
        return this::advance;
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
        sleeps++;
    }

    public int sleeps() {
        return sleeps;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now;
    }
}
