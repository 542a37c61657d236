package com.kvmcloud.gateway.registry;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Devices currently connected to this broker, at most one live connection per
 * device. Lookups are linearizable: a client request sees a device if and
 * only if its registration completed before the lookup.
 */
@Slf4j
public class DeviceConnectionRegistry {

    private final ConcurrentMap<String, DeviceConnection> connections = new ConcurrentHashMap<>();

    /**
     * Insert or overwrite the device's entry.
     *
     * @return the connection this one displaced, for the caller to close
     */
    public Optional<DeviceConnection> register(DeviceConnection connection) {
        DeviceConnection previous = connections.put(connection.getDeviceId(), connection);
        if (previous != null && previous != connection) {
            log.debug("registry:replace device={} old={} new={}",
                    connection.getDeviceId(), previous.getSocket().id(), connection.getSocket().id());
            return Optional.of(previous);
        }
        return Optional.empty();
    }

    public Optional<DeviceConnection> lookup(String deviceId) {
        if (deviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connections.get(deviceId));
    }

    /**
     * Remove {@code connection}, but only if it is still the registered one.
     * A late cleanup of a displaced socket therefore cannot evict its successor.
     */
    public boolean remove(DeviceConnection connection) {
        return connections.remove(connection.getDeviceId(), connection);
    }

    public boolean isConnected(String deviceId) {
        return deviceId != null && connections.containsKey(deviceId);
    }

    public int size() {
        return connections.size();
    }

    public Set<String> connectedDeviceIds() {
        return Set.copyOf(connections.keySet());
    }
}
