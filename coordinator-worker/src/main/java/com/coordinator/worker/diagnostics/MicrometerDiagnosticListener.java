package com.coordinator.worker.diagnostics;

import com.coordinator.core.model.DiagnosticEvent;
import com.coordinator.core.model.DiagnosticEventType;
import com.coordinator.core.service.DiagnosticListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Micrometer metrics for coordinated activities.
 *
 * Metrics exposed:
 * - Heartbeat calls by outcome
 * - Progress signals by outcome
 * - Cancellations by reason
 * - Finished sessions by outcome
 */
public class MicrometerDiagnosticListener implements DiagnosticListener, MeterBinder {

    // Metric names
    public static final String HEARTBEATS = "coordinator.heartbeats";
    public static final String SIGNAL_UPDATES = "coordinator.signal.updates";
    public static final String CANCELLATIONS = "coordinator.cancellations";
    public static final String SESSIONS = "coordinator.sessions";

    private volatile MeterRegistry registry;

    public MicrometerDiagnosticListener() {
    }

    public MicrometerDiagnosticListener(MeterRegistry registry) {
        bindTo(registry);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onEvent(DiagnosticEvent event) {
        if (registry == null) {
            return;
        }
        switch (event.kind()) {
            case HEARTBEAT_RECORDED -> increment(HEARTBEATS, event, "outcome", "recorded");
            case HEARTBEAT_FAILED -> increment(HEARTBEATS, event, "outcome", "failed");
            case SIGNAL_UPDATE -> increment(SIGNAL_UPDATES, event, "outcome", "delivered");
            case SIGNAL_UPDATE_FAILED -> increment(SIGNAL_UPDATES, event, "outcome", "failed");
            case CANCEL_REQUESTED, ACTIVITY_GONE, HEARTBEAT_FAILURE_LIMIT_EXCEEDED, SESSION_LIFETIME_EXCEEDED ->
                increment(CANCELLATIONS, event, "reason", reason(event.kind()));
            case ACTIVITY_COMPLETED -> increment(SESSIONS, event, "outcome", "completed");
            case ACTIVITY_FAILED -> increment(SESSIONS, event, "outcome", "failed");
            case ACTIVITY_CANCELED -> increment(SESSIONS, event, "outcome", "canceled");
            default -> {
                // not counted
            }
        }
    }

    private void increment(String name, DiagnosticEvent event, String tagKey, String tagValue) {
        Counter.builder(name)
            .tag("activity_type", event.activityType() == null ? "unknown" : event.activityType())
            .tag(tagKey, tagValue)
            .register(registry)
            .increment();
    }

    private static String reason(DiagnosticEventType kind) {
        return kind.name().toLowerCase().replace('_', '-');
    }
}
