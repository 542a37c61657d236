package com.kvmcloud.gateway.exchange;

import com.kvmcloud.common.time.Cancellable;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AbortSignalTest {

    @Test
    void abort_runsListenersOnceAndKeepsFirstReason() {
        AbortSignal signal = new AbortSignal();
        AtomicInteger runs = new AtomicInteger();
        signal.onAbort(runs::incrementAndGet);

        assertTrue(signal.abort("client disconnected"));
        assertFalse(signal.abort("again"));

        assertEquals(1, runs.get());
        assertTrue(signal.isAborted());
        assertEquals("client disconnected", signal.reason());
        assertEquals(0, signal.listenerCount());
    }

    @Test
    void withdrawnListener_isNotRun() {
        AbortSignal signal = new AbortSignal();
        AtomicInteger runs = new AtomicInteger();
        Cancellable registration = signal.onAbort(runs::incrementAndGet);

        assertTrue(registration.cancel());
        signal.abort(null);

        assertEquals(0, runs.get());
        assertEquals("aborted", signal.reason());
    }

    @Test
    void throwingListener_doesNotStopOthers() {
        AbortSignal signal = new AbortSignal();
        AtomicInteger runs = new AtomicInteger();
        signal.onAbort(() -> {
            throw new IllegalStateException("listener failed");
        });
        signal.onAbort(runs::incrementAndGet);

        signal.abort("gone");

        assertEquals(1, runs.get());
    }

    @Test
    void never_isNotAborted() {
        AbortSignal signal = AbortSignal.never();
        assertFalse(signal.isAborted());
        assertNull(signal.reason());
    }
}
