package com.coordinator.core.exception;

/**
 * Base exception for all coordinator errors.
 */
public class CoordinatorException extends RuntimeException {
    
    private final String errorCode;
    
    public CoordinatorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public CoordinatorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
