package com.coordinator.worker.diagnostics;

import com.coordinator.core.model.DiagnosticEvent;
import com.coordinator.core.service.DiagnosticListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans an event out to several listeners. A failing listener does not starve the others.
 */
public class CompositeDiagnosticListener implements DiagnosticListener {

    private static final Logger log = LoggerFactory.getLogger(CompositeDiagnosticListener.class);

    private final List<DiagnosticListener> listeners;

    public CompositeDiagnosticListener(List<DiagnosticListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public static CompositeDiagnosticListener of(DiagnosticListener... listeners) {
        return new CompositeDiagnosticListener(List.of(listeners));
    }

    @Override
    public void onEvent(DiagnosticEvent event) {
        for (DiagnosticListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Diagnostic listener {} failed on {}", listener.getClass().getName(), event.kind(), e);
            }
        }
    }
}
