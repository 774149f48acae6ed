package com.coordinator.worker.heartbeat;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CancellationChannelTest {

    @Test
    void poll_shouldReturnSignalsInOrder() throws InterruptedException {
        CancellationChannel channel = new CancellationChannel();
        IllegalStateException first = new IllegalStateException("first");
        
        assertTrue(channel.emit(CancellationSignal.of(first)));
        assertTrue(channel.emit(CancellationSignal.clean()));
        
        assertSame(first, channel.poll(0).cause());
        assertNull(channel.poll(TimeUnit.MILLISECONDS.toNanos(10)).cause());
        assertNull(channel.poll(0));
    }

    @Test
    void poll_shouldTimeOutWhenEmpty() throws InterruptedException {
        CancellationChannel channel = new CancellationChannel();
        long timeout = TimeUnit.MILLISECONDS.toNanos(30);
        
        long before = System.nanoTime();
        assertNull(channel.poll(timeout));
        assertTrue(System.nanoTime() - before >= timeout);
    }

    @Test
    void emit_shouldBeRefusedAfterClose() {
        CancellationChannel channel = new CancellationChannel();
        channel.close();
        
        assertTrue(channel.isClosed());
        assertFalse(channel.emit(CancellationSignal.clean()));
    }

    @Test
    void of_shouldMapNullCauseToClean() {
        assertSame(CancellationSignal.clean(), CancellationSignal.of(null));
    }
}
