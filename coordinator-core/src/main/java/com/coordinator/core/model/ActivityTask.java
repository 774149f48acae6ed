package com.coordinator.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One unit of work dispatched by the orchestration service and claimed by this worker.
 * Immutable for the lifetime of the task.
 *
 * Invariants:
 * - taskToken is never null or blank; every service call for the task carries it
 * - workflowId, activityType and activityId are for correlation only
 * - input is opaque to the coordinator
 */
public record ActivityTask(
    // Credential for all service calls on this task
    String taskToken,
    
    // Identity
    String workflowId,
    String runId,
    String activityType,
    String activityId,
    
    // Data
    JsonNode input
) {
    public ActivityTask {
        Objects.requireNonNull(taskToken, "taskToken");
        if (taskToken.isBlank()) {
            throw new IllegalArgumentException("taskToken must not be blank");
        }
    }

    /**
     * Short human-readable identity used in log lines and exception messages.
     */
    public String describe() {
        return "workflow-id=" + workflowId + " activity-type=" + activityType + " activity-id=" + activityId;
    }
}
