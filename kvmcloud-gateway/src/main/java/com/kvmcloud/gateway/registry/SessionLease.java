package com.kvmcloud.gateway.registry;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle to a held session lock entry for one device. Call {@link #close()}
 * when the exchange ends.
 * <p>
 * The lease is the only way to listen on a device socket: {@link #bind}
 * attaches a listener to the device connection, and closing the lease detaches
 * it and frees the device for the next exchange. Closing is idempotent.
 * </p>
 */
@Getter
public final class SessionLease implements AutoCloseable {

    private final String deviceId;
    /** What holds the device, e.g. "relay" or "bridge". For logs. */
    private final String holder;
    private final Instant acquiredAt;

    @Getter(lombok.AccessLevel.NONE)
    private final SessionLock lock;
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean released = new AtomicBoolean(false);
    @Getter(lombok.AccessLevel.NONE)
    private volatile DeviceConnection boundTo;

    SessionLease(SessionLock lock, String deviceId, String holder, Instant acquiredAt) {
        this.lock = lock;
        this.deviceId = deviceId;
        this.holder = holder;
        this.acquiredAt = acquiredAt;
    }

    public boolean isHeld() {
        return !released.get();
    }

    /**
     * Attach {@code listener} to {@code connection}'s inbound stream until this
     * lease closes.
     *
     * @throws IllegalStateException if the lease is released or already bound
     * @throws com.kvmcloud.gateway.error.DeviceNotConnectedException if the
     *         connection closed in the meantime
     */
    public void bind(DeviceConnection connection, DeviceMessageListener listener) {
        if (!isHeld()) {
            throw new IllegalStateException("lease for " + deviceId + " already released");
        }
        if (boundTo != null) {
            throw new IllegalStateException("lease for " + deviceId + " already bound");
        }
        boundTo = connection;
        connection.attach(this, listener);
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        DeviceConnection connection = boundTo;
        if (connection != null) {
            connection.detach(this);
        }
        lock.release(this);
    }
}
