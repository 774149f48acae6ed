package com.coordinator.worker.diagnostics;

import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.model.DiagnosticEvent;
import com.coordinator.core.model.DiagnosticEventType;
import com.coordinator.worker.test.RecordingDiagnosticListener;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CompositeDiagnosticListenerTest {

    private final ActivityTask task = new ActivityTask("token", "wf-1", null, "transfer", "act-1", null);

    @Test
    void onEvent_shouldReachEveryListenerEvenIfOneFails() {
        RecordingDiagnosticListener first = new RecordingDiagnosticListener();
        RecordingDiagnosticListener last = new RecordingDiagnosticListener();
        CompositeDiagnosticListener composite = CompositeDiagnosticListener.of(
            first,
            event -> {
                throw new IllegalStateException("broken sink");
            },
            new LoggingDiagnosticListener(),
            last);

        composite.onEvent(DiagnosticEvent.of("test", task, DiagnosticEventType.HEARTBEAT_FAILED,
            new IllegalStateException("throttled")));
        composite.onEvent(DiagnosticEvent.of("test", task, DiagnosticEventType.ACTIVITY_STARTED));

        assertThat(first.kinds()).containsExactly(
            DiagnosticEventType.HEARTBEAT_FAILED, DiagnosticEventType.ACTIVITY_STARTED);
        assertThat(last.kinds()).isEqualTo(first.kinds());
        assertThat(last.getEvents().get(0).hasError()).isTrue();
    }
}
