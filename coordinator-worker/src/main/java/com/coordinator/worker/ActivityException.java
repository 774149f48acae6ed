package com.coordinator.worker;

/**
 * Exception thrown by coordinated activity handlers on failure.
 */
public class ActivityException extends Exception {
    
    private final String errorCode;
    private final boolean retryable;
    
    public ActivityException(String errorCode, String message) {
        this(errorCode, message, null, true);
    }
    
    public ActivityException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, null, retryable);
    }
    
    public ActivityException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true);
    }
    
    public ActivityException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    /**
     * Whether the dispatch loop may schedule the activity again after this failure.
     */
    public boolean isRetryable() {
        return retryable;
    }
    
    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static ActivityException permanent(String errorCode, String message) {
        return new ActivityException(errorCode, message, false);
    }
}
