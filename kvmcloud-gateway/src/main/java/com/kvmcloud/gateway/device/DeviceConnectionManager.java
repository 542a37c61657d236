package com.kvmcloud.gateway.device;

import com.kvmcloud.common.logging.LogRedact;
import com.kvmcloud.common.time.BrokerScheduler;
import com.kvmcloud.common.time.Cancellable;
import com.kvmcloud.gateway.auth.IdentityService;
import com.kvmcloud.gateway.directory.DeviceDirectory;
import com.kvmcloud.gateway.error.DeviceBusyException;
import com.kvmcloud.gateway.error.UnauthorizedException;
import com.kvmcloud.gateway.registry.DeviceConnection;
import com.kvmcloud.gateway.registry.DeviceConnectionRegistry;
import com.kvmcloud.gateway.registry.SessionLock;
import com.kvmcloud.gateway.signaling.SignalingTypes;
import com.kvmcloud.gateway.websocket.SignalingSocket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Turns authenticated device socket upgrades into registry entries and keeps
 * them honest.
 *
 * <p>
 * Lifecycle of one device socket:
 * <ol>
 * <li>{@link #admit} – before the handshake: credential check, exclusivity check</li>
 * <li>{@link #open} – after the handshake: register, displace any older socket,
 * start liveness checks</li>
 * <li>{@link #onMessage}/{@link #onPong} – traffic</li>
 * <li>{@link #onTransportError}/{@link #onClosed} – idempotent teardown</li>
 * </ol>
 */
@Slf4j
public class DeviceConnectionManager implements DeviceDirectory.DeletionListener, AutoCloseable {

    /** Close code for a socket displaced by a newer connection of the same device. */
    public static final CloseStatus REPLACED = new CloseStatus(4000, "replaced by newer connection");
    /** Close code for a socket that missed a liveness check. */
    public static final CloseStatus LIVENESS_TIMEOUT = new CloseStatus(4001, "liveness check timed out");
    /** Close code for a socket whose device was deleted. */
    public static final CloseStatus DEREGISTERED = new CloseStatus(4002, "deregistered");
    /** Close code for a device that reconnected while an exchange held it. */
    public static final CloseStatus BUSY = new CloseStatus(4009, "device in flight");

    private final DeviceConnectionRegistry registry;
    private final SessionLock sessionLock;
    private final IdentityService identityService;
    private final DeviceDirectory deviceDirectory;
    private final BrokerScheduler scheduler;
    private final Duration livenessInterval;
    private final Clock clock;

    public DeviceConnectionManager(DeviceConnectionRegistry registry, SessionLock sessionLock,
            IdentityService identityService, DeviceDirectory deviceDirectory,
            BrokerScheduler scheduler, Duration livenessInterval, Clock clock) {
        this.registry = registry;
        this.sessionLock = sessionLock;
        this.identityService = identityService;
        this.deviceDirectory = deviceDirectory;
        this.scheduler = scheduler;
        this.livenessInterval = livenessInterval;
        this.clock = clock;
        deviceDirectory.addDeletionListener(this);
    }

    // ── Handshake ────────────────────────────────────────────────

    /**
     * Authenticate an upgrade request. Runs before the WebSocket handshake is
     * answered; a throw rejects the upgrade.
     *
     * @param secretToken     bearer credential, may be null
     * @param claimedDeviceId device identifier the caller claims, may be null
     * @return the authenticated device identifier
     * @throws UnauthorizedException missing/invalid credential, identifier
     *                               mismatch or lookup failure
     * @throws DeviceBusyException   the device is mid-exchange
     */
    public String admit(String secretToken, String claimedDeviceId) {
        if (secretToken == null || secretToken.isBlank()) {
            throw new UnauthorizedException("No authorization header provided");
        }
        Optional<String> resolved;
        try {
            resolved = identityService.resolveDevice(secretToken);
        } catch (RuntimeException e) {
            log.error("device:auth-error token={}: {}", LogRedact.maskToken(secretToken), e.getMessage(), e);
            throw new UnauthorizedException("Device authentication failed");
        }
        if (resolved.isEmpty()) {
            throw new UnauthorizedException("Invalid secret token provided");
        }
        String deviceId = resolved.get();
        if (claimedDeviceId == null || !claimedDeviceId.equals(deviceId)) {
            throw new UnauthorizedException("Invalid device ID or ID/token mismatch");
        }
        if (sessionLock.isHeld(deviceId)) {
            throw new DeviceBusyException("Device " + deviceId + " already has an in-flight exchange");
        }
        return deviceId;
    }

    /**
     * Register a freshly upgraded device socket. An older socket of the same
     * device is terminated and replaced; the newcomer always wins.
     *
     * @return the registered connection, or empty if the device became busy
     *         between admission and handshake completion (socket closed)
     */
    public Optional<DeviceConnection> open(String deviceId, SignalingSocket socket,
            String sourceAddress, String reportedVersion) {
        if (sessionLock.isHeld(deviceId)) {
            log.warn("device:reject device={} reason=in-flight", deviceId);
            socket.close(BUSY);
            return Optional.empty();
        }

        DeviceConnection connection = new DeviceConnection(deviceId, socket, sourceAddress,
                reportedVersion, clock.instant());
        registry.register(connection).ifPresent(previous -> {
            log.info("device:displace device={} old={} new={}", deviceId, previous.getSocket().id(), socket.id());
            previous.terminate(REPLACED);
            handleClosed(previous, REPLACED);
        });

        Cancellable check = scheduler.scheduleAtFixedRate(livenessInterval, () -> checkLiveness(connection));
        connection.setLivenessCheck(check);

        log.info("device:open device={} socket={} ip={} version={}",
                deviceId, socket.id(), sourceAddress, reportedVersion != null ? reportedVersion : "unknown");
        return Optional.of(connection);
    }

    // ── Traffic ──────────────────────────────────────────────────

    public void onMessage(DeviceConnection connection, String payload) {
        if (!connection.deliver(payload)) {
            log.debug("device:drop device={} reason=no-listener bytes={}",
                    connection.getDeviceId(), payload.length());
        }
    }

    public void onPong(DeviceConnection connection) {
        connection.markAlive();
    }

    // ── Teardown ─────────────────────────────────────────────────

    public void onTransportError(DeviceConnection connection, Throwable error) {
        log.warn("device:error device={} socket={}: {}",
                connection.getDeviceId(), connection.getSocket().id(), error.getMessage());
        connection.notifyError(error);
        connection.terminate(CloseStatus.SERVER_ERROR);
        handleClosed(connection, CloseStatus.SERVER_ERROR);
    }

    public void onClosed(DeviceConnection connection, CloseStatus status) {
        handleClosed(connection, status);
    }

    /**
     * Close and deregister a device's live socket after the device record was
     * deleted.
     */
    @Override
    public void onDeviceDeleted(String deviceId) {
        deregister(deviceId);
    }

    /**
     * Tell the device it was deregistered, then close its socket.
     *
     * @return true if a live socket was found
     */
    public boolean deregister(String deviceId) {
        Optional<DeviceConnection> found = registry.lookup(deviceId);
        if (found.isEmpty()) {
            return false;
        }
        DeviceConnection connection = found.get();
        try {
            connection.send(SignalingTypes.DEREGISTERED);
        } catch (IOException e) {
            log.debug("device:deregister-notice-failed device={}: {}", deviceId, e.getMessage());
        }
        connection.terminate(DEREGISTERED);
        handleClosed(connection, DEREGISTERED);
        log.info("device:deregister device={}", deviceId);
        return true;
    }

    /**
     * Terminate every live device socket. Devices reconnect to the next broker.
     */
    @Override
    public void close() {
        for (String deviceId : registry.connectedDeviceIds()) {
            registry.lookup(deviceId).ifPresent(connection -> {
                connection.terminate(CloseStatus.SERVICE_RESTARTED);
                handleClosed(connection, CloseStatus.SERVICE_RESTARTED);
            });
        }
    }

    // ── Internals ────────────────────────────────────────────────

    private void checkLiveness(DeviceConnection connection) {
        if (connection.isClosed()) {
            return;
        }
        if (!connection.checkAliveAndReset()) {
            log.warn("device:liveness-timeout device={} socket={}",
                    connection.getDeviceId(), connection.getSocket().id());
            connection.terminate(LIVENESS_TIMEOUT);
            handleClosed(connection, LIVENESS_TIMEOUT);
            return;
        }
        try {
            connection.getSocket().sendPing();
        } catch (IOException e) {
            onTransportError(connection, e);
        }
    }

    // Error and close events may both fire for one socket; only the first tears down.
    private void handleClosed(DeviceConnection connection, CloseStatus status) {
        if (!connection.markClosed(status)) {
            return;
        }
        boolean removed = registry.remove(connection);
        log.info("device:close device={} socket={} code={} deregistered={}",
                connection.getDeviceId(), connection.getSocket().id(), status.getCode(), removed);
        try {
            deviceDirectory.recordLastSeen(connection.getDeviceId(), clock.instant());
        } catch (RuntimeException e) {
            log.error("device:last-seen-failed device={}: {}", connection.getDeviceId(), e.getMessage(), e);
        }
    }
}
