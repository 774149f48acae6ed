package com.coordinator.worker.heartbeat;

import com.coordinator.core.exception.ActivityCanceledException;
import com.coordinator.core.exception.HeartbeatFailureLimitExceededException;
import com.coordinator.core.exception.UnknownResourceException;
import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.model.DiagnosticEvent;
import com.coordinator.core.model.DiagnosticEventType;
import com.coordinator.core.model.HeartbeatStatus;
import com.coordinator.core.service.DiagnosticListener;
import com.coordinator.core.service.LivenessService;
import com.coordinator.worker.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends heartbeats for one activity task with a fixed delay between calls until stopped.
 * Owns a single-threaded scheduler; calls never overlap.
 *
 * Outcomes surfaced on the {@link CancellationChannel}, at most one per monitor:
 * - cancel requested by the service: signal with an {@link ActivityCanceledException} cause
 * - task gone ({@link UnknownResourceException#isActivityGone()}): clean signal, no cause
 * - heartbeat thread interrupted: signal with an {@link InterruptedException} cause
 * - optional: too many transient failures in a row, signal with
 *   {@link HeartbeatFailureLimitExceededException}
 *
 * Any other heartbeat failure is reported and heartbeating continues.
 * The monitor stops itself right after emitting and never heartbeats again.
 * HEARTBEAT_STOPPED is always the last event and is reported once the scheduler has terminated.
 */
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    public static final String COMPONENT = "heartbeat-monitor";

    private final ActivityTask task;
    private final LivenessService livenessService;
    private final Duration interval;
    private final int maxConsecutiveFailures;
    private final CancellationChannel cancellations;
    private final DiagnosticListener listener;
    private final ScheduledThreadPoolExecutor scheduler;

    private final AtomicInteger heartbeatsSent = new AtomicInteger(0);
    private volatile boolean stopRequested = false;
    private ScheduledFuture<?> heartbeatFuture;
    private int consecutiveFailures = 0;

    public HeartbeatMonitor(
            ActivityTask task,
            LivenessService livenessService,
            Duration interval,
            int maxConsecutiveFailures,
            CancellationChannel cancellations,
            DiagnosticListener listener,
            ThreadFactory threadFactory) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Heartbeat interval must be > 0, got " + interval);
        }
        this.task = task;
        this.livenessService = livenessService;
        this.interval = interval;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.cancellations = cancellations;
        this.listener = listener;
        this.scheduler = new ScheduledThreadPoolExecutor(1, threadFactory) {
            @Override
            protected void terminated() {
                super.terminated();
                emit(DiagnosticEventType.HEARTBEAT_STOPPED, null);
            }
        };
    }

    /**
     * Schedule the first heartbeat one interval from now.
     */
    public synchronized void start() {
        if (heartbeatFuture != null) {
            throw new IllegalStateException("Heartbeat monitor already started for " + task.describe());
        }
        log.debug("Heartbeating every {}", interval);
        long nanos = interval.toNanos();
        heartbeatFuture = scheduler.scheduleWithFixedDelay(this::beat, nanos, nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Stop scheduling heartbeats. A call already in flight runs to completion;
     * use {@link #awaitStopped} to wait for it.
     */
    public synchronized void stop() {
        stopRequested = true;
        if (heartbeatFuture != null) {
            heartbeatFuture.cancel(false);
        }
        scheduler.shutdown();
    }

    /**
     * Stop and interrupt a heartbeat call still in flight.
     */
    public synchronized void stopNow() {
        stop();
        scheduler.shutdownNow();
    }

    /**
     * Wait for the in-flight heartbeat, if any, to finish after {@link #stop()}.
     * Nothing is emitted once this returns true.
     *
     * @return true if the monitor stopped within the timeout
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return scheduler.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean isStopped() {
        return scheduler.isTerminated();
    }

    /**
     * Number of heartbeat calls made so far, successful or not.
     */
    public int getHeartbeatsSent() {
        return heartbeatsSent.get();
    }

    private void beat() {
        if (stopRequested) {
            return;
        }
        boolean keepBeating;
        try (LoggingContext ctx = LoggingContext.forActivity(task)) {
            keepBeating = heartbeat();
        }
        if (!keepBeating) {
            stop();
        }
    }

    /**
     * Send one heartbeat.
     *
     * @return false if monitoring must end
     */
    private boolean heartbeat() {
        HeartbeatStatus status;
        try {
            heartbeatsSent.incrementAndGet();
            status = livenessService.recordHeartbeat(task.taskToken());
        } catch (UnknownResourceException e) {
            if (e.isActivityGone()) {
                emit(DiagnosticEventType.ACTIVITY_GONE, e);
                cancel(CancellationSignal.clean());
                return false;
            }
            return onTransientFailure(e);
        } catch (RuntimeException e) {
            if (Thread.interrupted()) {
                return onInterrupt();
            }
            return onTransientFailure(e);
        }

        if (Thread.interrupted()) {
            return onInterrupt();
        }
        consecutiveFailures = 0;
        emit(DiagnosticEventType.HEARTBEAT_RECORDED, null);
        if (status != null && status.cancelRequested()) {
            emit(DiagnosticEventType.CANCEL_REQUESTED, null);
            cancel(CancellationSignal.of(new ActivityCanceledException()));
            return false;
        }
        return true;
    }

    private boolean onTransientFailure(RuntimeException e) {
        consecutiveFailures++;
        emit(DiagnosticEventType.HEARTBEAT_FAILED, e);
        if (maxConsecutiveFailures > 0 && consecutiveFailures >= maxConsecutiveFailures) {
            HeartbeatFailureLimitExceededException limit =
                new HeartbeatFailureLimitExceededException(consecutiveFailures, e);
            emit(DiagnosticEventType.HEARTBEAT_FAILURE_LIMIT_EXCEEDED, limit);
            cancel(CancellationSignal.of(limit));
            return false;
        }
        return true;
    }

    private boolean onInterrupt() {
        if (stopRequested) {
            Thread.currentThread().interrupt();
            return false;
        }
        InterruptedException interrupted = new InterruptedException(
            "Heartbeat thread interrupted for " + task.describe());
        emit(DiagnosticEventType.HEARTBEAT_FAILED, interrupted);
        cancel(CancellationSignal.of(interrupted));
        Thread.currentThread().interrupt();
        return false;
    }

    private void cancel(CancellationSignal signal) {
        if (stopRequested || !cancellations.emit(signal)) {
            log.debug("Session already over, dropping cancellation");
        }
    }

    private void emit(DiagnosticEventType kind, Throwable error) {
        listener.onEvent(DiagnosticEvent.of(COMPONENT, task, kind, error));
    }
}
