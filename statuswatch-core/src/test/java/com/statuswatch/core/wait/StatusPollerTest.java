package com.statuswatch.core.wait;

import com.statuswatch.core.process.ProcessFailedException;
import com.statuswatch.core.status.ErrorClassifier;
import com.statuswatch.core.status.StatusDocument;
import com.statuswatch.core.status.StatusError;
import com.statuswatch.core.status.StatusErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link StatusPoller}.
 */
class StatusPollerTest {

    private static final StatusDocument PENDING = StatusDocument.fromText("""
        machines:
          "0": {juju-status: {current: pending}}
        """);

    private static final StatusDocument STARTED = StatusDocument.fromText("""
        machines:
          "0": {juju-status: {current: started}}
        """);

    private static final StatusDocument MACHINE_ERROR = StatusDocument.fromText("""
        machines:
          "0":
            machine-status: {current: error, message: "no instance"}
            juju-status: {current: pending}
        """);

    private static final StatusDocument UNIT_ERROR = StatusDocument.fromText("""
        machines:
          "0": {juju-status: {current: started}}
        applications:
          app:
            units:
              app/0:
                workload-status: {current: error, message: "disk full"}
                juju-status: {current: executing}
        """);

    private ManualClock clock;
    private StringBuilder out;
    private int fetches;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        out = new StringBuilder();
        fetches = 0;
    }

    @Test
    void waitFor_conditionMetOnSecondPoll_returnsThatStatus() {
        StatusPoller poller = poller(sequence(PENDING, STARTED));

        StatusDocument status = poller.waitFor(new WaitAgentsStarted(), "default", false);

        assertThat(status).isSameAs(STARTED);
        assertThat(fetches).isEqualTo(2);
        assertThat(out).hasToString("pending: 0\n");
    }

    @Test
    void waitFor_neverMet_pollsUntilTimeoutThenRaises() {
        StatusPoller poller = poller(() -> {
            fetches++;
            return PENDING;
        });

        assertThatThrownBy(() -> poller.waitFor(new WaitAgentsStarted(Duration.ofSeconds(30)), "default", true))
            .isInstanceOf(AgentsNotStartedException.class)
            .hasMessage("Timed out waiting for agents to start in default.")
            .satisfies(e -> assertThat(((StatusNotMetException) e).status()).isSameAs(PENDING));
        assertThat(fetches).isEqualTo(6);
        assertThat(out).isEmpty();
    }

    @Test
    void waitFor_fatalError_abortsImmediately() {
        StatusPoller poller = poller(sequence(MACHINE_ERROR, STARTED));

        assertThatThrownBy(() -> poller.waitFor(new WaitAgentsStarted(), "default", true))
            .isInstanceOf(StatusError.class)
            .isEqualTo(new StatusError(StatusErrorKind.MACHINE_ERROR, "0", "no instance"));
        assertThat(fetches).isEqualTo(1);
    }

    @Test
    void waitFor_recoverableErrorAtTimeout_raisesTheError() {
        StatusPoller poller = poller(() -> {
            fetches++;
            return UNIT_ERROR;
        });

        assertThatThrownBy(() -> poller.waitFor(new WaitAgentsStarted(Duration.ofSeconds(10)), "default", true))
            .isInstanceOf(StatusError.class)
            .isEqualTo(new StatusError(StatusErrorKind.UNIT_ERROR, "app/0", "disk full"));
        assertThat(fetches).isEqualTo(2);
    }

    @Test
    void waitFor_alreadySatisfied_fetchesOnceWithoutChecking() {
        StatusPoller poller = poller(sequence(MACHINE_ERROR));

        StatusDocument status = poller.waitFor(new ConditionList(List.of()), "default", false);

        assertThat(status).isSameAs(MACHINE_ERROR);
        assertThat(clock.sleeps()).isZero();
    }

    @Test
    void waitFor_statusNeverAvailable_raisesConditionWithoutStatus() {
        StatusPoller poller = poller(() -> {
            fetches++;
            throw new ProcessFailedException(1, "show-status", "connection refused");
        });

        assertThatThrownBy(() -> poller.waitFor(new WaitAgentsStarted(), "ctl", true))
            .isInstanceOf(AgentsNotStartedException.class)
            .satisfies(e -> assertThat(((StatusNotMetException) e).status()).isNull());
        assertThat(fetches).isEqualTo(61);
    }

    @Test
    void fetchStatus_transientFailure_retriesAfterDelay() {
        Deque<Object> results = new ArrayDeque<>(List.of(
            new ProcessFailedException(1, "show-status", "busy"), STARTED));
        StatusPoller poller = poller(() -> {
            fetches++;
            Object next = results.pop();
            if (next instanceof ProcessFailedException failure) {
                throw failure;
            }
            return (StatusDocument) next;
        });

        StatusDocument status = poller.fetchStatus();

        assertThat(status).isSameAs(STARTED);
        assertThat(fetches).isEqualTo(2);
        assertThat(clock.sleeps()).isEqualTo(1);
    }

    @Test
    void fetchStatus_budgetExhausted_throwsTimeoutWithLastFailure() {
        ProcessFailedException failure = new ProcessFailedException(1, "show-status", "down");
        StatusPoller poller = poller(() -> {
            throw failure;
        });

        assertThatThrownBy(poller::fetchStatus)
            .isInstanceOf(StatusTimeoutException.class)
            .hasMessage("Timed out waiting for status to succeed")
            .hasCause(failure);
    }

    private StatusPoller poller(StatusSource source) {
        return new StatusPoller(source, clock, clock.sleeper(), PollSettings.defaults(),
            new ErrorClassifier(clock, ErrorClassifier.DEFAULT_AGENT_GRACE_PERIOD), out);
    }

    private StatusSource sequence(StatusDocument... documents) {
        Deque<StatusDocument> remaining = new ArrayDeque<>(List.of(documents));
        return () -> {
            fetches++;
            return remaining.size() > 1 ? remaining.pop() : remaining.peek();
        };
    }
}
