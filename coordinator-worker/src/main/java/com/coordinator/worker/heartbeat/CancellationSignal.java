package com.coordinator.worker.heartbeat;

/**
 * A request to cancel the running session.
 *
 * @param cause why; null for a clean cancel that reports no error
 */
public record CancellationSignal(Throwable cause) {

    private static final CancellationSignal CLEAN = new CancellationSignal(null);

    public static CancellationSignal clean() {
        return CLEAN;
    }

    public static CancellationSignal of(Throwable cause) {
        return cause == null ? CLEAN : new CancellationSignal(cause);
    }
}
