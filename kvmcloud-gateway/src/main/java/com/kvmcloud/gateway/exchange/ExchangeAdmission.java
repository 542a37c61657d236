package com.kvmcloud.gateway.exchange;

import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.auth.IdentityService;
import com.kvmcloud.gateway.error.DeviceBusyException;
import com.kvmcloud.gateway.error.DeviceNotConnectedException;
import com.kvmcloud.gateway.error.DeviceNotFoundException;
import com.kvmcloud.gateway.error.InvalidRequestException;
import com.kvmcloud.gateway.registry.DeviceConnection;
import com.kvmcloud.gateway.registry.DeviceConnectionRegistry;
import com.kvmcloud.gateway.registry.SessionLease;
import com.kvmcloud.gateway.registry.SessionLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Preconditions shared by every client-initiated exchange: the caller may
 * reach the device, the device is connected, and nothing else holds it.
 * All checks run before any state is created; on success the caller owns a
 * {@link SessionLease} and must close it.
 */
@Slf4j
public class ExchangeAdmission {

    private final DeviceConnectionRegistry registry;
    private final SessionLock sessionLock;
    private final IdentityService identityService;

    public ExchangeAdmission(DeviceConnectionRegistry registry, SessionLock sessionLock,
            IdentityService identityService) {
        this.registry = registry;
        this.sessionLock = sessionLock;
        this.identityService = identityService;
    }

    /**
     * @param holder lease label for logs
     * @throws InvalidRequestException     blank device id
     * @throws DeviceNotFoundException     unknown device or not the caller's
     * @throws DeviceNotConnectedException device has no live socket
     * @throws DeviceBusyException         another exchange holds the device
     */
    public SessionLease admit(ClientIdentity identity, String deviceId, String holder) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new InvalidRequestException("Missing device id");
        }
        boolean allowed;
        try {
            allowed = identityService.canAccess(identity, deviceId);
        } catch (RuntimeException e) {
            log.error("{}:access-check-failed device={} subject={}: {}",
                    holder, deviceId, identity.subject(), e.getMessage(), e);
            allowed = false;
        }
        if (!allowed) {
            throw new DeviceNotFoundException("Device not found");
        }
        if (!registry.isConnected(deviceId)) {
            throw new DeviceNotConnectedException("No socket for device " + deviceId);
        }
        return sessionLock.tryAcquire(deviceId, holder)
                .orElseThrow(() -> new DeviceBusyException("Device " + deviceId + " already has an in-flight exchange"));
    }

    /**
     * Live connection to bind the lease to, re-read after the lease was taken.
     *
     * @throws DeviceNotConnectedException if the device went away meanwhile
     */
    public DeviceConnection currentConnection(String deviceId) {
        return registry.lookup(deviceId)
                .filter(connection -> !connection.isClosed())
                .orElseThrow(() -> new DeviceNotConnectedException("No socket for device " + deviceId));
    }
}
