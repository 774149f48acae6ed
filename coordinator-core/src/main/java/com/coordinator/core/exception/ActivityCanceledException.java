package com.coordinator.core.exception;

/**
 * Marker cause for a session canceled because the orchestration service
 * asked for it through the heartbeat response.
 */
public class ActivityCanceledException extends CoordinatorException {
    
    public static final String ERROR_CODE = "ACTIVITY_CANCELED";

    private final String details;
    
    public ActivityCanceledException() {
        this(null);
    }

    public ActivityCanceledException(String details) {
        super(ERROR_CODE, details == null ? "Activity task cancel requested" : details);
        this.details = details;
    }

    /**
     * Details to report back with the cancellation, may be null.
     */
    public String getDetails() {
        return details;
    }
}
