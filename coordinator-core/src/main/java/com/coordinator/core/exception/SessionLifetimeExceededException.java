package com.coordinator.core.exception;

import java.time.Duration;

/**
 * Cancellation cause raised when a session outlives the configured maximum lifetime.
 */
public class SessionLifetimeExceededException extends CoordinatorException {
    
    public static final String ERROR_CODE = "SESSION_LIFETIME_EXCEEDED";
    
    public SessionLifetimeExceededException(Duration maxLifetime) {
        super(ERROR_CODE, String.format(
            "Coordination session exceeded its maximum lifetime of %s",
            maxLifetime
        ));
    }
}
