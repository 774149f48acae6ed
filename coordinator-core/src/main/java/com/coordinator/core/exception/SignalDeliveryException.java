package com.coordinator.core.exception;

/**
 * Thrown when an activity started/updated signal cannot be delivered to the workflow.
 */
public class SignalDeliveryException extends CoordinatorException {
    
    public static final String ERROR_CODE = "SIGNAL_DELIVERY_FAILED";
    
    public SignalDeliveryException(String signalName, String workflowId, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Failed to deliver signal '%s' to workflow %s",
            signalName, workflowId
        ), cause);
    }
}
