package com.statuswatch.core.status;

import java.util.Comparator;
import java.util.Objects;

/**
 * An error found in one entity's status.
 *
 * <p>Carries the {@link StatusErrorKind}, the entity name and the status message. Two errors
 * are equal when kind, entity and message match, so repeated classification of the same
 * {@link StatusItem} yields equal errors.
 */
public class StatusError extends RuntimeException {

    /**
     * Orders errors by severity, most severe first.
     */
    public static final Comparator<StatusError> BY_SEVERITY =
        Comparator.comparingInt(error -> error.kind().rank());

    private final StatusErrorKind kind;
    private final String itemName;
    private final String statusMessage;

    public StatusError(StatusErrorKind kind, String itemName, String statusMessage) {
        super(itemName + ": " + statusMessage);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.itemName = Objects.requireNonNull(itemName, "itemName must not be null");
        this.statusMessage = statusMessage;
    }

    public StatusErrorKind kind() {
        return kind;
    }

    public String itemName() {
        return itemName;
    }

    /**
     * Returns the message reported by the entity, or {@code null} if it reported none.
     *
     * @return status message
     */
    public String statusMessage() {
        return statusMessage;
    }

    public boolean recoverable() {
        return kind.recoverable();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StatusError that)) {
            return false;
        }
        return kind == that.kind
            && itemName.equals(that.itemName)
            && Objects.equals(statusMessage, that.statusMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, itemName, statusMessage);
    }

    @Override
    public String toString() {
        return kind + "(" + itemName + ", " + statusMessage + ")";
    }
}
