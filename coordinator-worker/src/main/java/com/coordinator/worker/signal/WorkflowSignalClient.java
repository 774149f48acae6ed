package com.coordinator.worker.signal;

/**
 * Transport used to send a signal to a running workflow execution.
 */
@FunctionalInterface
public interface WorkflowSignalClient {

    /**
     * @param workflowId target workflow
     * @param runId target run, may be null for the current run
     * @param signalName signal name the workflow listens for
     * @param input JSON signal input
     */
    void signalWorkflow(String workflowId, String runId, String signalName, String input);
}
