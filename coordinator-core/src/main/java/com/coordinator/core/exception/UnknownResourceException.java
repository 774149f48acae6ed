package com.coordinator.core.exception;

/**
 * Thrown by the orchestration service when a call references a resource it no
 * longer knows about.
 *
 * The heartbeat monitor treats the "unknown activity" flavour of this fault as
 * the task being gone (closed, timed out or otherwise expired on the service side).
 */
public class UnknownResourceException extends CoordinatorException {
    
    public static final String ERROR_CODE = "UNKNOWN_RESOURCE";

    /**
     * Message fragment the service uses when the task token no longer maps to a live activity.
     */
    public static final String ACTIVITY_GONE = "Unknown activity";
    
    public UnknownResourceException(String message) {
        super(ERROR_CODE, message);
    }
    
    public UnknownResourceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    /**
     * Create the fault the service raises for a task token it no longer recognizes.
     */
    public static UnknownResourceException activityGone(String detail) {
        return new UnknownResourceException(ACTIVITY_GONE + ": " + detail);
    }

    /**
     * Check if this fault means the activity task itself is gone.
     */
    public boolean isActivityGone() {
        return getMessage() != null && getMessage().contains(ACTIVITY_GONE);
    }
}
