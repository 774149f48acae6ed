package com.coordinator.worker.diagnostics;

import com.coordinator.core.model.DiagnosticEvent;
import com.coordinator.core.service.DiagnosticListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes diagnostic events to SLF4J.
 *
 * Problems go to WARN with the error attached, routine heartbeats to DEBUG,
 * everything else to INFO.
 */
public class LoggingDiagnosticListener implements DiagnosticListener {

    private final Logger log;

    public LoggingDiagnosticListener() {
        this(LoggerFactory.getLogger(LoggingDiagnosticListener.class));
    }

    public LoggingDiagnosticListener(Logger log) {
        this.log = log;
    }

    @Override
    public void onEvent(DiagnosticEvent event) {
        String kind = event.kind().name().toLowerCase().replace('_', '-');
        if (event.kind().isProblem()) {
            if (event.hasError()) {
                log.warn("component={} workflow-id={} activity-type={} activity-id={} at={} error={}",
                    event.component(), event.workflowId(), event.activityType(), event.activityId(),
                    kind, event.error().getMessage(), event.error());
            } else {
                log.warn("component={} workflow-id={} activity-type={} activity-id={} at={}",
                    event.component(), event.workflowId(), event.activityType(), event.activityId(), kind);
            }
            return;
        }
        switch (event.kind()) {
            case HEARTBEAT_RECORDED, HEARTBEAT_STOPPED, SIGNAL_UPDATE ->
                log.debug("component={} workflow-id={} activity-type={} activity-id={} at={}",
                    event.component(), event.workflowId(), event.activityType(), event.activityId(), kind);
            default ->
                log.info("component={} workflow-id={} activity-type={} activity-id={} at={}",
                    event.component(), event.workflowId(), event.activityType(), event.activityId(), kind);
        }
    }
}
