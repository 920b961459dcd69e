package com.statuswatch.core.status;

/**
 * Closed set of entity error kinds, ordered by severity.
 *
 * <p>Lower {@link #rank()} means higher severity. The rank drives both the sort order of
 * {@link StatusDocument#checkForErrors(boolean)} and the choice of which single error
 * {@link StatusDocument#raiseHighestError(boolean)} throws. Install, hook and generic unit
 * failures share one tier.
 */
public enum StatusErrorKind {
    MACHINE_ERROR(0, false),
    PROVISIONING_ERROR(1, false),
    STUCK_ALLOCATING_ERROR(2, false),
    APP_ERROR(3, false),
    INSTALL_ERROR(4, true),
    HOOK_FAILED_ERROR(4, true),
    UNIT_ERROR(4, true),
    AGENT_ERROR(5, true),
    AGENT_UNRESOLVED_ERROR(6, true);

    private final int rank;
    private final boolean recoverable;

    StatusErrorKind(int rank, boolean recoverable) {
        this.rank = rank;
        this.recoverable = recoverable;
    }

    /**
     * Returns the severity rank (0 is most severe).
     *
     * @return severity rank
     */
    public int rank() {
        return rank;
    }

    /**
     * Returns whether callers may ignore this kind while still waiting.
     *
     * @return true if recoverable
     */
    public boolean recoverable() {
        return recoverable;
    }
}
