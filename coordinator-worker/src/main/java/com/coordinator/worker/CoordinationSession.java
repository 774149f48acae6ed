package com.coordinator.worker;

import com.coordinator.core.config.CoordinationOptions;
import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.service.DiagnosticListener;
import com.coordinator.core.service.LivenessService;
import com.coordinator.worker.heartbeat.CancellationChannel;
import com.coordinator.worker.heartbeat.CancellationSignal;
import com.coordinator.worker.heartbeat.HeartbeatMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadFactory;

/**
 * The live execution of one task: its heartbeat monitor and its cancellation channel.
 * Opened after a successful start, closed on every exit path. Closing waits for the
 * heartbeat monitor to terminate, so no liveness call outlives the session.
 *
 * Usage:
 * <pre>
 * try (CoordinationSession session = CoordinationSession.open(task, options, liveness, listener, threads)) {
 *     CancellationSignal signal = session.awaitCancellation(nanos);
 * }
 * </pre>
 */
public final class CoordinationSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinationSession.class);

    private final CancellationChannel cancellations;
    private final HeartbeatMonitor heartbeatMonitor;
    private final Instant openedAt;
    private final Duration maxLifetime;
    private final Duration stopTimeout;

    private CoordinationSession(
            CancellationChannel cancellations,
            HeartbeatMonitor heartbeatMonitor,
            Duration maxLifetime,
            Duration stopTimeout) {
        this.cancellations = cancellations;
        this.heartbeatMonitor = heartbeatMonitor;
        this.openedAt = Instant.now();
        this.maxLifetime = maxLifetime;
        this.stopTimeout = stopTimeout;
    }

    /**
     * Open a session and schedule its heartbeats.
     */
    public static CoordinationSession open(
            ActivityTask task,
            CoordinationOptions options,
            LivenessService livenessService,
            DiagnosticListener listener,
            ThreadFactory heartbeatThreads) {
        CancellationChannel cancellations = new CancellationChannel();
        HeartbeatMonitor monitor = new HeartbeatMonitor(
            task,
            livenessService,
            options.heartbeatInterval(),
            options.maxConsecutiveHeartbeatFailures(),
            cancellations,
            listener,
            heartbeatThreads
        );
        CoordinationSession session = new CoordinationSession(
            cancellations, monitor, options.maxSessionLifetime(), options.heartbeatStopTimeout());
        monitor.start();
        return session;
    }

    /**
     * Wait for a cancellation signal.
     *
     * @param timeoutNanos how long to wait; non-positive values only check
     * @return the first pending signal, or null on timeout
     */
    public CancellationSignal awaitCancellation(long timeoutNanos) throws InterruptedException {
        return cancellations.poll(timeoutNanos);
    }

    /**
     * Queue a cancellation raised by the coordinating thread itself.
     * It is picked up by the next {@link #awaitCancellation} call.
     */
    public void cancel(Throwable cause) {
        cancellations.emit(CancellationSignal.of(cause));
    }

    /**
     * Check if the session outlived its configured maximum lifetime.
     */
    public boolean isExpired() {
        return maxLifetime != null && Instant.now().isAfter(openedAt.plus(maxLifetime));
    }

    public Duration getMaxLifetime() {
        return maxLifetime;
    }

    public HeartbeatMonitor getHeartbeatMonitor() {
        return heartbeatMonitor;
    }

    /**
     * Close the channel, stop the heartbeat monitor and wait for it to terminate.
     * A heartbeat call still running after the stop timeout is interrupted.
     */
    @Override
    public void close() {
        cancellations.close();
        heartbeatMonitor.stop();
        try {
            if (!heartbeatMonitor.awaitStopped(stopTimeout)) {
                log.warn("Heartbeat still in flight after {}, interrupting it", stopTimeout);
                heartbeatMonitor.stopNow();
            }
        } catch (InterruptedException e) {
            heartbeatMonitor.stopNow();
            Thread.currentThread().interrupt();
        }
    }
}
