package com.coordinator.worker.logging;

import com.coordinator.core.model.ActivityTask;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures every log line written while coordinating a task carries its identity.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forActivity(task)) {
 *     log.info("Ticking"); // Automatically includes workflowId, activityType, activityId
 * }
 * </pre>
 *
 * MDC is per thread: the heartbeat thread opens its own context.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String RUN_ID = "runId";
    public static final String ACTIVITY_TYPE = "activityType";
    public static final String ACTIVITY_ID = "activityId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for an activity task.
     */
    public static LoggingContext forActivity(ActivityTask task) {
        return forActivity(task.workflowId(), task.runId(), task.activityType(), task.activityId());
    }

    /**
     * Create a logging context for an activity task identity.
     */
    public static LoggingContext forActivity(String workflowId, String runId, String activityType, String activityId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(WORKFLOW_ID, workflowId);
        putIfPresent(RUN_ID, runId);
        putIfPresent(ACTIVITY_TYPE, activityType);
        putIfPresent(ACTIVITY_ID, activityId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Get current workflow ID from context.
     */
    public static String getWorkflowId() {
        return MDC.get(WORKFLOW_ID);
    }

    /**
     * Get current activity ID from context.
     */
    public static String getActivityId() {
        return MDC.get(ACTIVITY_ID);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(RUN_ID);
        MDC.remove(ACTIVITY_TYPE);
        MDC.remove(ACTIVITY_ID);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
