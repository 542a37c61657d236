package com.kvmcloud.gateway.exchange;

import com.kvmcloud.common.time.Cancellable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot cancellation signal raised when the originator of an exchange goes
 * away (for example the HTTP client disconnects).
 * <p>
 * Listeners registered after the signal fired run immediately. Registrations
 * can be withdrawn so a finished exchange leaves nothing behind.
 * </p>
 */
@Slf4j
public final class AbortSignal {

    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile String reason;

    /**
     * A signal nobody will ever raise.
     */
    public static AbortSignal never() {
        return new AbortSignal();
    }

    /**
     * Raise the signal. Only the first call has an effect.
     *
     * @return true if this call raised it
     */
    public boolean abort(String reason) {
        List<Runnable> toRun;
        synchronized (lock) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason != null ? reason : "aborted";
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : toRun) {
            runQuietly(listener);
        }
        return true;
    }

    public boolean isAborted() {
        return reason != null;
    }

    public String reason() {
        return reason;
    }

    /**
     * Register a listener.
     *
     * @return handle that withdraws the registration
     */
    public Cancellable onAbort(Runnable listener) {
        synchronized (lock) {
            if (reason == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        return listeners.remove(listener);
                    }
                };
            }
        }
        runQuietly(listener);
        return Cancellable.NOOP;
    }

    /** Number of registered listeners still waiting. */
    public int listenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }

    private static void runQuietly(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.error("abort listener failed: {}", e.getMessage(), e);
        }
    }
}
