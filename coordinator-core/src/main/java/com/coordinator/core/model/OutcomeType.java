package com.coordinator.core.model;

/**
 * The three ways a coordination session can end.
 */
public enum OutcomeType {
    /**
     * The handler reported that it is done.
     */
    COMPLETED,

    /**
     * Setup, a signal, or the handler itself failed.
     */
    FAILED,

    /**
     * The orchestration service asked for cancellation, or the task is gone.
     */
    CANCELED;

    /**
     * Check if the session produced a result.
     */
    public boolean isSuccess() {
        return this == COMPLETED;
    }
}
