package com.coordinator.core.model;

import com.coordinator.core.exception.ActivityCanceledException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TerminationOutcomeTest {

    @Test
    void completed_shouldCarryResultOnly() {
        TerminationOutcome<String> outcome = TerminationOutcome.completed("done");
        
        assertTrue(outcome.isCompleted());
        assertTrue(outcome.type().isSuccess());
        assertEquals("done", outcome.result());
        assertNull(outcome.error());
    }

    @Test
    void failed_shouldRequireError() {
        assertThrows(IllegalArgumentException.class, () -> TerminationOutcome.failed(null));
        
        IllegalStateException error = new IllegalStateException("boom");
        TerminationOutcome<String> outcome = TerminationOutcome.failed(error);
        assertTrue(outcome.isFailed());
        assertSame(error, outcome.error());
        assertFalse(outcome.type().isSuccess());
    }

    @Test
    void canceled_shouldAllowMissingCause() {
        TerminationOutcome<Object> clean = TerminationOutcome.canceled(null);
        assertTrue(clean.isCanceled());
        assertNull(clean.error());
        
        TerminationOutcome<Object> requested = TerminationOutcome.canceled(new ActivityCanceledException());
        assertInstanceOf(ActivityCanceledException.class, requested.error());
    }

    @Test
    void constructor_shouldRejectResultOnNonCompletedOutcome() {
        assertThrows(IllegalArgumentException.class,
            () -> new TerminationOutcome<>(OutcomeType.CANCELED, "partial", null));
        assertThrows(IllegalArgumentException.class,
            () -> new TerminationOutcome<>(OutcomeType.COMPLETED, "done", new RuntimeException()));
    }
}
