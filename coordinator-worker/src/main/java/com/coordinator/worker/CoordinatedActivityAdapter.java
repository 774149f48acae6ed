package com.coordinator.worker;

import com.coordinator.core.config.CoordinationOptions;
import com.coordinator.core.exception.SessionLifetimeExceededException;
import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.model.DiagnosticEvent;
import com.coordinator.core.model.DiagnosticEventType;
import com.coordinator.core.model.TerminationOutcome;
import com.coordinator.core.service.DiagnosticListener;
import com.coordinator.core.service.LivenessService;
import com.coordinator.core.service.TaskUpdateSignaler;
import com.coordinator.worker.diagnostics.LoggingDiagnosticListener;
import com.coordinator.worker.heartbeat.CancellationSignal;
import com.coordinator.worker.logging.LoggingContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a {@link CoordinatedActivityHandler} through one task:
 * start, then heartbeats in the background while ticking at a bounded rate,
 * until the handler completes or fails, or the task is canceled.
 *
 * Usage:
 * <pre>
 * CoordinatedActivityAdapter&lt;TransferRequest, TransferProgress&gt; adapter =
 *     new CoordinatedActivityAdapter&lt;&gt;(handler, options, liveness, signaler);
 * TerminationOutcome&lt;TransferProgress&gt; outcome = adapter.coordinateJson(task);
 * </pre>
 *
 * Tick is invoked no sooner than {@code tickMinInterval} after the previous invocation
 * started; a slow tick simply delays the next one. A tick in progress always finishes
 * before a cancellation is acted upon. The heartbeat monitor is stopped, and its in-flight
 * call awaited, on every exit path.
 */
public class CoordinatedActivityAdapter<I, R> implements ActivityCoordinator<I, R> {

    private static final Logger log = LoggerFactory.getLogger(CoordinatedActivityAdapter.class);

    public static final String COMPONENT = "coordination-adapter";
    public static final String INVALID_INPUT = "INVALID_INPUT";

    private final CoordinatedActivityHandler<I, R> handler;
    private final CoordinationOptions options;
    private final LivenessService livenessService;
    private final TaskUpdateSignaler signaler;
    private final DiagnosticListener listener;
    private final ThreadFactory heartbeatThreads;
    private final ObjectMapper objectMapper;

    public CoordinatedActivityAdapter(
            CoordinatedActivityHandler<I, R> handler,
            CoordinationOptions options,
            LivenessService livenessService,
            TaskUpdateSignaler signaler) {
        this(handler, options, livenessService, signaler, new LoggingDiagnosticListener());
    }

    public CoordinatedActivityAdapter(
            CoordinatedActivityHandler<I, R> handler,
            CoordinationOptions options,
            LivenessService livenessService,
            TaskUpdateSignaler signaler,
            DiagnosticListener listener) {
        this(handler, options, livenessService, signaler, listener, heartbeatThreadFactory(), new ObjectMapper());
    }

    public CoordinatedActivityAdapter(
            CoordinatedActivityHandler<I, R> handler,
            CoordinationOptions options,
            LivenessService livenessService,
            TaskUpdateSignaler signaler,
            DiagnosticListener listener,
            ThreadFactory heartbeatThreads,
            ObjectMapper objectMapper) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.options = Objects.requireNonNull(options, "options");
        this.livenessService = Objects.requireNonNull(livenessService, "livenessService");
        this.signaler = Objects.requireNonNull(signaler, "signaler");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.heartbeatThreads = Objects.requireNonNull(heartbeatThreads, "heartbeatThreads");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public TerminationOutcome<R> coordinateJson(ActivityTask task) {
        I input;
        try {
            input = objectMapper.convertValue(task.input(), handler.inputType());
        } catch (IllegalArgumentException e) {
            TerminationOutcome<R> outcome = TerminationOutcome.failed(new ActivityException(
                INVALID_INPUT, "Cannot decode input as " + handler.inputType().getSimpleName(), e, false));
            emit(task, DiagnosticEventType.ACTIVITY_FAILED, outcome.error());
            return outcome;
        }
        return coordinate(task, input);
    }

    @Override
    public TerminationOutcome<R> coordinate(ActivityTask task, I input) {
        Objects.requireNonNull(task, "task");
        try (LoggingContext ctx = LoggingContext.forActivity(task)) {
            TerminationOutcome<R> outcome = run(task, input);
            report(task, outcome);
            return outcome;
        }
    }

    private TerminationOutcome<R> run(ActivityTask task, I input) {
        Object startUpdate;
        try {
            startUpdate = handler.start(task, input);
        } catch (ActivityException | RuntimeException e) {
            return TerminationOutcome.failed(e);
        }
        try {
            signaler.signalStart(task, startUpdate);
        } catch (RuntimeException e) {
            return TerminationOutcome.failed(e);
        }
        emit(task, DiagnosticEventType.ACTIVITY_STARTED, null);

        try (CoordinationSession session = CoordinationSession.open(
                task, options, livenessService, listener, heartbeatThreads)) {
            return tickLoop(session, task, input);
        }
    }

    private TerminationOutcome<R> tickLoop(CoordinationSession session, ActivityTask task, I input) {
        long tickIntervalNanos = options.tickMinInterval().toNanos();
        long nextTickAt = System.nanoTime() + tickIntervalNanos;
        while (true) {
            CancellationSignal signal;
            try {
                signal = session.awaitCancellation(nextTickAt - System.nanoTime());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                signal = CancellationSignal.of(e);
            }
            if (signal != null) {
                return cancel(task, input, signal);
            }

            if (session.isExpired()) {
                SessionLifetimeExceededException expired =
                    new SessionLifetimeExceededException(session.getMaxLifetime());
                emit(task, DiagnosticEventType.SESSION_LIFETIME_EXCEEDED, expired);
                session.cancel(expired);
                continue;
            }

            long tickStartedAt = System.nanoTime();
            nextTickAt = tickStartedAt + tickIntervalNanos;
            TickResult<R> tick;
            try {
                tick = Objects.requireNonNull(handler.tick(task, input), "tick result");
            } catch (ActivityException | RuntimeException e) {
                return TerminationOutcome.failed(e);
            }
            if (!tick.shouldContinue()) {
                return TerminationOutcome.completed(tick.result());
            }
            if (tick.hasResult()) {
                try {
                    signaler.signalUpdate(task, tick.result());
                    emit(task, DiagnosticEventType.SIGNAL_UPDATE, null);
                } catch (RuntimeException e) {
                    emit(task, DiagnosticEventType.SIGNAL_UPDATE_FAILED, e);
                    // picked up by the next awaitCancellation
                    session.cancel(e);
                }
            }
        }
    }

    private TerminationOutcome<R> cancel(ActivityTask task, I input, CancellationSignal signal) {
        try {
            handler.cancel(task, input);
        } catch (ActivityException | RuntimeException e) {
            emit(task, DiagnosticEventType.CANCEL_HANDLER_FAILED, e);
        }
        return TerminationOutcome.canceled(signal.cause());
    }

    private void report(ActivityTask task, TerminationOutcome<R> outcome) {
        switch (outcome.type()) {
            case COMPLETED -> emit(task, DiagnosticEventType.ACTIVITY_COMPLETED, null);
            case FAILED -> emit(task, DiagnosticEventType.ACTIVITY_FAILED, outcome.error());
            case CANCELED -> emit(task, DiagnosticEventType.ACTIVITY_CANCELED, outcome.error());
        }
        log.debug("Coordination ended with {}", outcome.type());
    }

    private void emit(ActivityTask task, DiagnosticEventType kind, Throwable error) {
        listener.onEvent(DiagnosticEvent.of(COMPONENT, task, kind, error));
    }

    private static ThreadFactory heartbeatThreadFactory() {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, "activity-heartbeat-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
