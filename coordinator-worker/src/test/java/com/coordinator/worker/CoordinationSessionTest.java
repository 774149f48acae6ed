package com.coordinator.worker;

import com.coordinator.core.config.CoordinationOptions;
import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.model.DiagnosticEventType;
import com.coordinator.worker.test.RecordingDiagnosticListener;
import com.coordinator.worker.test.ScriptedLivenessService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class CoordinationSessionTest {

    private static final Duration HEARTBEAT = Duration.ofMillis(20);

    private final ActivityTask task = new ActivityTask("token-5", "wf-5", null, "transfer", "act-5", null);
    private final RecordingDiagnosticListener diagnostics = new RecordingDiagnosticListener();

    private CoordinationSession open(ScriptedLivenessService liveness, CoordinationOptions options) {
        return CoordinationSession.open(task, options, liveness, diagnostics, runnable -> {
            Thread thread = new Thread(runnable, "session-test-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Test
    @DisplayName("Closing the session leaves no heartbeat running")
    void closeJoinsHeartbeat() throws Exception {
        ScriptedLivenessService liveness = ScriptedLivenessService.recording().delayEachCallBy(Duration.ofMillis(150));
        CoordinationSession session = open(liveness, CoordinationOptions.of(HEARTBEAT, Duration.ofMillis(10)));
        while (liveness.getInFlight() == 0) {
            Thread.sleep(2);
        }

        session.close();

        assertThat(session.getHeartbeatMonitor().isStopped()).isTrue();
        assertThat(liveness.getInFlight()).isZero();
        assertThat(diagnostics.kinds()).endsWith(DiagnosticEventType.HEARTBEAT_STOPPED);
        int calls = liveness.getCallCount();
        Thread.sleep(HEARTBEAT.toMillis() * 4);
        assertThat(liveness.getCallCount()).isEqualTo(calls);
    }

    @Test
    @DisplayName("Cancellations raised after close are dropped")
    void cancelAfterCloseIsDropped() throws Exception {
        CoordinationSession session = open(ScriptedLivenessService.recording(),
            CoordinationOptions.of(Duration.ofSeconds(5), Duration.ofMillis(10)));

        session.close();
        session.cancel(new IllegalStateException("late"));

        assertThat(session.awaitCancellation(0)).isNull();
        assertThat(session.getHeartbeatMonitor().getHeartbeatsSent()).isZero();
    }

    @Test
    void isExpired_shouldFollowMaxLifetime() throws Exception {
        CoordinationOptions options = CoordinationOptions.builder()
            .heartbeatInterval(Duration.ofSeconds(5))
            .tickMinInterval(Duration.ofMillis(10))
            .maxSessionLifetime(Duration.ofMillis(30))
            .build();

        try (CoordinationSession session = open(ScriptedLivenessService.recording(), options)) {
            assertThat(session.isExpired()).isFalse();
            Thread.sleep(60);
            assertThat(session.isExpired()).isTrue();
            assertThat(session.getMaxLifetime()).isEqualTo(Duration.ofMillis(30));
        }
    }
}
