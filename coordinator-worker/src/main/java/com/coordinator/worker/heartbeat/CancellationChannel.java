package com.coordinator.worker.heartbeat;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Carries cancellation signals from the heartbeat monitor (and the adapter itself)
 * to the coordinating thread. Single consumer. The first signal taken wins.
 *
 * Once closed, emits are refused, so nothing is written after the session ended.
 */
public final class CancellationChannel {

    private final BlockingQueue<CancellationSignal> signals = new LinkedBlockingQueue<>();
    private boolean closed = false;

    /**
     * Offer a signal.
     *
     * @return false if the channel was already closed and the signal was dropped
     */
    public synchronized boolean emit(CancellationSignal signal) {
        if (closed) {
            return false;
        }
        signals.add(signal);
        return true;
    }

    /**
     * Wait up to {@code timeoutNanos} for a signal. A non-positive timeout does not block.
     *
     * @return the signal, or null if none arrived in time
     */
    public CancellationSignal poll(long timeoutNanos) throws InterruptedException {
        if (timeoutNanos <= 0) {
            return signals.poll();
        }
        return signals.poll(timeoutNanos, TimeUnit.NANOSECONDS);
    }

    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
