package com.coordinator.core.model;

/**
 * Kinds of diagnostic events emitted while coordinating an activity task.
 */
public enum DiagnosticEventType {
    // Heartbeat monitor
    HEARTBEAT_RECORDED,
    HEARTBEAT_FAILED,
    HEARTBEAT_FAILURE_LIMIT_EXCEEDED,
    HEARTBEAT_STOPPED,
    ACTIVITY_GONE,
    CANCEL_REQUESTED,

    // Coordination adapter
    ACTIVITY_STARTED,
    SIGNAL_UPDATE,
    SIGNAL_UPDATE_FAILED,
    SESSION_LIFETIME_EXCEEDED,
    CANCEL_HANDLER_FAILED,

    // Terminal outcomes
    ACTIVITY_COMPLETED,
    ACTIVITY_FAILED,
    ACTIVITY_CANCELED;

    /**
     * Check if this event reports a problem worth a warning.
     */
    public boolean isProblem() {
        return switch (this) {
            case HEARTBEAT_FAILED, HEARTBEAT_FAILURE_LIMIT_EXCEEDED, ACTIVITY_GONE,
                 SIGNAL_UPDATE_FAILED, SESSION_LIFETIME_EXCEEDED, CANCEL_HANDLER_FAILED,
                 ACTIVITY_FAILED -> true;
            default -> false;
        };
    }
}
