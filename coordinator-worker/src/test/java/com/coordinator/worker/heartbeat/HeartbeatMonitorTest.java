package com.coordinator.worker.heartbeat;

import com.coordinator.core.exception.ActivityCanceledException;
import com.coordinator.core.exception.UnknownResourceException;
import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.model.DiagnosticEventType;
import com.coordinator.worker.test.RecordingDiagnosticListener;
import com.coordinator.worker.test.ScriptedLivenessService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class HeartbeatMonitorTest {

    private static final Duration INTERVAL = Duration.ofMillis(20);
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final ActivityTask task = new ActivityTask("token-9", "wf-9", null, "report", "act-9", null);
    private final CancellationChannel channel = new CancellationChannel();
    private final RecordingDiagnosticListener diagnostics = new RecordingDiagnosticListener();
    private HeartbeatMonitor monitor;

    private HeartbeatMonitor start(ScriptedLivenessService liveness, int maxConsecutiveFailures) {
        monitor = new HeartbeatMonitor(task, liveness, INTERVAL, maxConsecutiveFailures, channel, diagnostics,
            runnable -> {
                Thread thread = new Thread(runnable, "heartbeat-test");
                thread.setDaemon(true);
                return thread;
            });
        monitor.start();
        return monitor;
    }

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.stop();
        }
    }

    @Test
    @DisplayName("Cancel request emits a single signal and ends heartbeating")
    void cancelRequestedEmitsOnce() throws Exception {
        ScriptedLivenessService liveness = ScriptedLivenessService.recording().thenRecord().thenRequestCancel();
        start(liveness, 0);

        CancellationSignal signal = channel.poll(TIMEOUT.toNanos());

        assertThat(signal).isNotNull();
        assertThat(signal.cause()).isInstanceOf(ActivityCanceledException.class);
        assertThat(monitor.awaitStopped(TIMEOUT)).isTrue();
        Thread.sleep(INTERVAL.toMillis() * 4);
        assertThat(liveness.getCallCount()).isEqualTo(2);
        assertThat(monitor.getHeartbeatsSent()).isEqualTo(2);
        assertThat(channel.poll(0)).isNull();
    }

    @Test
    @DisplayName("Task gone emits a clean signal without a cause")
    void activityGoneEmitsCleanSignal() throws Exception {
        ScriptedLivenessService liveness = ScriptedLivenessService.recording()
            .thenThrow(UnknownResourceException.activityGone("token-9"));
        start(liveness, 0);

        CancellationSignal signal = channel.poll(TIMEOUT.toNanos());

        assertThat(signal).isEqualTo(CancellationSignal.clean());
        assertThat(signal.cause()).isNull();
        assertThat(monitor.awaitStopped(TIMEOUT)).isTrue();
        assertThat(diagnostics.kinds()).containsSubsequence(
            DiagnosticEventType.ACTIVITY_GONE, DiagnosticEventType.HEARTBEAT_STOPPED);
        assertThat(diagnostics.kinds()).endsWith(DiagnosticEventType.HEARTBEAT_STOPPED);
    }

    @Test
    @DisplayName("An interrupted heartbeat thread cancels the task instead of going quiet")
    void interruptEmitsCancellation() throws Exception {
        ScriptedLivenessService liveness = ScriptedLivenessService.recording().thenRecord().thenInterrupt();
        start(liveness, 0);

        CancellationSignal signal = channel.poll(TIMEOUT.toNanos());

        assertThat(signal).isNotNull();
        assertThat(signal.cause()).isInstanceOf(InterruptedException.class);
        assertThat(monitor.awaitStopped(TIMEOUT)).isTrue();
        assertThat(liveness.getCallCount()).isEqualTo(2);
        assertThat(diagnostics.count(DiagnosticEventType.HEARTBEAT_FAILED)).isEqualTo(1);
        assertThat(diagnostics.count(DiagnosticEventType.HEARTBEAT_STOPPED)).isEqualTo(1);
    }

    @Test
    @DisplayName("Stopping waits for the heartbeat call in flight")
    void awaitStoppedWaitsForInFlightCall() throws Exception {
        ScriptedLivenessService liveness = ScriptedLivenessService.recording().delayEachCallBy(Duration.ofMillis(200));
        start(liveness, 0);
        while (liveness.getInFlight() == 0) {
            Thread.sleep(2);
        }

        monitor.stop();

        assertThat(monitor.isStopped()).isFalse();
        assertThat(monitor.awaitStopped(TIMEOUT)).isTrue();
        assertThat(liveness.getInFlight()).isZero();
        assertThat(liveness.getCallCount()).isEqualTo(1);
        assertThat(diagnostics.kinds()).endsWith(DiagnosticEventType.HEARTBEAT_STOPPED);
    }

    @Test
    @DisplayName("Stopping now interrupts a heartbeat call that does not return")
    void stopNowInterruptsInFlightCall() throws Exception {
        ScriptedLivenessService liveness = ScriptedLivenessService.recording().delayEachCallBy(Duration.ofSeconds(30));
        start(liveness, 0);
        while (liveness.getInFlight() == 0) {
            Thread.sleep(2);
        }

        monitor.stop();
        assertThat(monitor.awaitStopped(Duration.ofMillis(50))).isFalse();
        monitor.stopNow();

        assertThat(monitor.awaitStopped(TIMEOUT)).isTrue();
        assertThat(channel.poll(0)).isNull();
    }

    @Test
    @DisplayName("Other failures are reported and heartbeating continues")
    void transientFailuresContinue() throws Exception {
        ScriptedLivenessService liveness = ScriptedLivenessService.recording()
            .thenThrow(new UnknownResourceException("Unknown domain: reports"))
            .thenThrow(new IllegalStateException("connection reset"));
        start(liveness, 0);

        assertThat(diagnostics.await(DiagnosticEventType.HEARTBEAT_RECORDED, TIMEOUT)).isTrue();

        assertThat(diagnostics.count(DiagnosticEventType.HEARTBEAT_FAILED)).isEqualTo(2);
        assertThat(channel.poll(0)).isNull();
        assertThat(monitor.isStopped()).isFalse();
    }

    @Test
    @DisplayName("Stopping the monitor emits nothing")
    void stopEmitsNothing() throws Exception {
        ScriptedLivenessService liveness = ScriptedLivenessService.recording();
        start(liveness, 0);
        assertThat(diagnostics.await(DiagnosticEventType.HEARTBEAT_RECORDED, TIMEOUT)).isTrue();

        monitor.stop();

        assertThat(monitor.awaitStopped(TIMEOUT)).isTrue();
        int calls = liveness.getCallCount();
        Thread.sleep(INTERVAL.toMillis() * 4);
        assertThat(liveness.getCallCount()).isEqualTo(calls);
        assertThat(channel.poll(0)).isNull();
    }

    @Test
    @DisplayName("Nothing is written to a closed channel")
    void closedChannelDropsSignal() throws Exception {
        channel.close();
        start(ScriptedLivenessService.recording().thenRequestCancel(), 0);

        assertThat(monitor.awaitStopped(TIMEOUT)).isTrue();
        assertThat(channel.poll(0)).isNull();
        assertThat(channel.emit(CancellationSignal.clean())).isFalse();
    }

    @Test
    void constructor_shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> new HeartbeatMonitor(task, ScriptedLivenessService.recording(),
                Duration.ZERO, 0, channel, diagnostics, Thread::new))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
