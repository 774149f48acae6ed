package com.coordinator.worker.logging;

import com.coordinator.core.model.ActivityTask;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void tearDown() {
        LoggingContext.clearAll();
    }

    @Test
    void forActivity_shouldPopulateAndClearMdc() {
        ActivityTask task = new ActivityTask("token", "wf-1", "run-1", "transfer", "act-1", null);
        
        try (LoggingContext ctx = LoggingContext.forActivity(task)) {
            assertEquals("wf-1", LoggingContext.getWorkflowId());
            assertEquals("act-1", LoggingContext.getActivityId());
            assertEquals("transfer", MDC.get(LoggingContext.ACTIVITY_TYPE));
            assertEquals("run-1", MDC.get(LoggingContext.RUN_ID));
            assertNotNull(LoggingContext.getTraceId());
        }
        
        assertNull(LoggingContext.getWorkflowId());
        assertNull(MDC.get(LoggingContext.ACTIVITY_TYPE));
        assertNotNull(LoggingContext.getTraceId());
    }

    @Test
    void forActivity_shouldSkipMissingValues() {
        try (LoggingContext ctx = LoggingContext.forActivity("wf-2", null, "report", null)) {
            assertEquals("wf-2", LoggingContext.getWorkflowId());
            assertNull(MDC.get(LoggingContext.RUN_ID));
            assertNull(LoggingContext.getActivityId());
        }
    }

    @Test
    void forActivity_shouldKeepExistingTraceId() {
        MDC.put(LoggingContext.TRACE_ID, "abc12345");
        
        try (LoggingContext ctx = LoggingContext.forActivity("wf-3", null, "report", "act-3")) {
            assertEquals("abc12345", LoggingContext.getTraceId());
        }
    }
}
