package com.kvmcloud.gateway.registry;

import com.kvmcloud.common.time.Cancellable;
import com.kvmcloud.gateway.error.DeviceNotConnectedException;
import com.kvmcloud.gateway.websocket.SignalingSocket;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live, authenticated device socket.
 *
 * <p>
 * The socket is owned by the device connection manager. Exchanges borrow it:
 * the holder of the device's {@link SessionLease} may attach one
 * {@link DeviceMessageListener}, which receives inbound frames until the lease
 * is closed. Without a listener, inbound frames are dropped.
 * </p>
 */
@Slf4j
@Getter
public class DeviceConnection {

    private final String deviceId;
    private final SignalingSocket socket;
    private final String sourceAddress;
    /** Device-reported software version, may be null. */
    private final String reportedVersion;
    private final Instant connectedAt;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<Consumer> consumer = new AtomicReference<>();
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean closed = new AtomicBoolean(false);
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean alive = new AtomicBoolean(true);
    @Getter(lombok.AccessLevel.NONE)
    private volatile Cancellable livenessCheck = Cancellable.NOOP;

    private record Consumer(SessionLease lease, DeviceMessageListener listener) {
    }

    public DeviceConnection(String deviceId, SignalingSocket socket, String sourceAddress,
            String reportedVersion, Instant connectedAt) {
        this.deviceId = deviceId;
        this.socket = socket;
        this.sourceAddress = sourceAddress;
        this.reportedVersion = reportedVersion;
        this.connectedAt = connectedAt;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean hasListener() {
        return consumer.get() != null;
    }

    public void send(String text) throws IOException {
        socket.sendText(text);
    }

    /**
     * Close the socket without waiting for the device.
     */
    public void terminate(CloseStatus status) {
        socket.close(status);
    }

    // ── Consumer slot (lease holders only) ───────────────────────

    void attach(SessionLease lease, DeviceMessageListener listener) {
        if (!lease.getDeviceId().equals(deviceId)) {
            throw new IllegalArgumentException("lease for " + lease.getDeviceId() + " cannot bind " + deviceId);
        }
        if (closed.get()) {
            throw new DeviceNotConnectedException("Device " + deviceId + " disconnected");
        }
        if (!consumer.compareAndSet(null, new Consumer(lease, listener))) {
            throw new IllegalStateException("device " + deviceId + " already has a listener");
        }
        // Lost a race with close/release: undo so nothing stays attached.
        if (!lease.isHeld() || closed.get()) {
            detach(lease);
            throw new DeviceNotConnectedException("Device " + deviceId + " disconnected");
        }
    }

    void detach(SessionLease lease) {
        consumer.updateAndGet(c -> c != null && c.lease() == lease ? null : c);
    }

    // ── Events (device connection manager only) ──────────────────

    /**
     * Hand an inbound frame to the current listener.
     *
     * @return false if nobody was listening
     */
    public boolean deliver(String payload) {
        Consumer current = consumer.get();
        if (current == null) {
            return false;
        }
        current.listener().onMessage(payload);
        return true;
    }

    public void notifyError(Throwable error) {
        Consumer current = consumer.get();
        if (current != null) {
            current.listener().onError(error);
        }
    }

    /**
     * Mark the connection closed and tell the current listener. Only the first
     * call does anything.
     *
     * @return true if this call closed it
     */
    public boolean markClosed(CloseStatus status) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        livenessCheck.cancel();
        Consumer current = consumer.get();
        if (current != null) {
            current.listener().onClosed(status);
        }
        return true;
    }

    // ── Liveness ─────────────────────────────────────────────────

    public void setLivenessCheck(Cancellable check) {
        this.livenessCheck = check;
        // closed while the check was being scheduled
        if (closed.get()) {
            check.cancel();
        }
    }

    public void markAlive() {
        alive.set(true);
    }

    /**
     * Consume the liveness flag for one check cycle.
     *
     * @return whether a pong (or the initial grace) arrived since the previous cycle
     */
    public boolean checkAliveAndReset() {
        return alive.getAndSet(false);
    }

    @Override
    public String toString() {
        return "DeviceConnection[" + deviceId + " socket=" + socket.id() + "]";
    }
}
