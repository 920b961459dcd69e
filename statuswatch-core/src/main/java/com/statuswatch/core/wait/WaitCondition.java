package com.statuswatch.core.wait;

import com.statuswatch.core.status.StatusDocument;

import java.time.Duration;
import java.util.stream.Stream;

/**
 * A state the poll loop waits for.
 *
 * <p>Implementations report what still blocks them for a given status snapshot. An empty
 * stream means the condition is met. Only blocking values may be reported: there is no
 * "expected" state to filter out afterwards.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * WaitCondition removed = new WaitMachineNotPresent("2");
 * poller.waitFor(removed, "default", false);
 * }</pre>
 *
 * @see StatusPoller
 */
public interface WaitCondition {

    /**
     * Returns how long the poll loop may wait before giving up.
     *
     * @return wait timeout
     */
    Duration timeout();

    /**
     * Returns whether the condition is known to hold without polling.
     *
     * @return true to skip the poll loop
     */
    boolean alreadySatisfied();

    /**
     * Lists the entities that still block this condition in {@code status}.
     *
     * @param status current status snapshot
     * @return blocking states, empty when the condition is met
     */
    Stream<BlockingState> blockingStates(StatusDocument status);

    /**
     * Throws the exception describing why the condition was not reached.
     *
     * <p>Always throws.
     *
     * @param modelName name of the model that was polled
     * @param status    last status snapshot, null if none could be fetched
     */
    void doRaise(String modelName, StatusDocument status);
}
