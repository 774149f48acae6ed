package com.coordinator.core.model;

import java.util.Objects;

/**
 * The single final result of a coordination session.
 *
 * Invariants:
 * - result may be set only if type == COMPLETED
 * - error is always set if type == FAILED
 * - error is the cancellation cause if type == CANCELED, and may be null
 *
 * @param <R> the handler's result type
 */
public record TerminationOutcome<R>(
    OutcomeType type,
    R result,
    Throwable error
) {
    public TerminationOutcome {
        Objects.requireNonNull(type, "type");
        if (type != OutcomeType.COMPLETED && result != null) {
            throw new IllegalArgumentException("Only completed outcomes carry a result");
        }
        if (type == OutcomeType.COMPLETED && error != null) {
            throw new IllegalArgumentException("Completed outcomes carry no error");
        }
        if (type == OutcomeType.FAILED && error == null) {
            throw new IllegalArgumentException("Failed outcomes must carry an error");
        }
    }

    public static <R> TerminationOutcome<R> completed(R result) {
        return new TerminationOutcome<>(OutcomeType.COMPLETED, result, null);
    }

    public static <R> TerminationOutcome<R> failed(Throwable error) {
        return new TerminationOutcome<>(OutcomeType.FAILED, null, error);
    }

    /**
     * @param cause why the session was canceled; null for a clean cancel with no error payload
     */
    public static <R> TerminationOutcome<R> canceled(Throwable cause) {
        return new TerminationOutcome<>(OutcomeType.CANCELED, null, cause);
    }

    public boolean isCompleted() {
        return type == OutcomeType.COMPLETED;
    }

    public boolean isFailed() {
        return type == OutcomeType.FAILED;
    }

    public boolean isCanceled() {
        return type == OutcomeType.CANCELED;
    }
}
