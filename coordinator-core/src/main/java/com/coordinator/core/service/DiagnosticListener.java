package com.coordinator.core.service;

import com.coordinator.core.model.DiagnosticEvent;

/**
 * Receives diagnostic events from the coordinator.
 * Called synchronously from the emitting thread; implementations must be thread-safe
 * and must not throw.
 */
@FunctionalInterface
public interface DiagnosticListener {

    void onEvent(DiagnosticEvent event);
}
