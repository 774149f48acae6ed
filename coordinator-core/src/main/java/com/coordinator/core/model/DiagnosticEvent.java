package com.coordinator.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Structured diagnostic event emitted by the coordinator components.
 * Listeners route these to logs, metrics or any other observability sink.
 */
public record DiagnosticEvent(
    String component,
    
    // Task identity
    String workflowId,
    String activityType,
    String activityId,
    
    DiagnosticEventType kind,
    Throwable error,
    Instant timestamp
) {
    public DiagnosticEvent {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Create an event for a task without an error.
     */
    public static DiagnosticEvent of(String component, ActivityTask task, DiagnosticEventType kind) {
        return of(component, task, kind, null);
    }

    /**
     * Create an event for a task.
     */
    public static DiagnosticEvent of(String component, ActivityTask task, DiagnosticEventType kind, Throwable error) {
        return new DiagnosticEvent(
            component,
            task.workflowId(),
            task.activityType(),
            task.activityId(),
            kind,
            error,
            Instant.now()
        );
    }

    public boolean hasError() {
        return error != null;
    }
}
