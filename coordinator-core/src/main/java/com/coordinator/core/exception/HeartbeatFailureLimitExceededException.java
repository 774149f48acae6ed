package com.coordinator.core.exception;

/**
 * Cancellation cause raised when too many heartbeats in a row failed transiently.
 */
public class HeartbeatFailureLimitExceededException extends CoordinatorException {
    
    public static final String ERROR_CODE = "HEARTBEAT_FAILURE_LIMIT_EXCEEDED";
    
    public HeartbeatFailureLimitExceededException(int consecutiveFailures, Throwable lastFailure) {
        super(ERROR_CODE, String.format(
            "Heartbeat failed %d times in a row",
            consecutiveFailures
        ), lastFailure);
    }
}
