package com.statuswatch.core.wait;

import java.time.Duration;

/**
 * Suspends the poll loop between status fetches.
 *
 * <p>Tests substitute an implementation that advances a manual clock instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps on the current thread.
     *
     * @throws IllegalStateException if the thread is interrupted; the interrupt flag is restored
     */
    Sleeper SYSTEM = duration -> {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting", e);
        }
    };

    void sleep(Duration duration);
}
