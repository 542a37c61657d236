package com.kvmcloud.app.web;

import com.kvmcloud.app.directory.InMemoryDeviceDirectory;
import com.kvmcloud.app.directory.InMemoryDeviceDirectory.DeviceRecord;
import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.error.DeviceNotFoundException;
import com.kvmcloud.gateway.registry.DeviceConnectionRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Device presence and deletion for the caller's own devices.
 */
@Slf4j
@RestController
@RequestMapping("/devices")
public class DeviceController {

    /** Presence row: {@code online} is live registry membership. */
    public record DeviceStatus(String id, boolean online, Instant lastSeen) {
    }

    private final InMemoryDeviceDirectory directory;
    private final DeviceConnectionRegistry registry;

    public DeviceController(InMemoryDeviceDirectory directory, DeviceConnectionRegistry registry) {
        this.directory = directory;
        this.registry = registry;
    }

    @GetMapping
    public List<DeviceStatus> list(HttpServletRequest request) {
        ClientIdentity identity = ClientRequests.authenticate(directory, request);
        return directory.devicesOwnedBy(identity.subject()).stream()
                .map(this::status)
                .toList();
    }

    @GetMapping("/{id}")
    public DeviceStatus get(@PathVariable("id") String deviceId, HttpServletRequest request) {
        return status(owned(deviceId, request));
    }

    /**
     * Delete the device record. A live device socket is told it was
     * deregistered and closed.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") String deviceId, HttpServletRequest request) {
        owned(deviceId, request);
        directory.delete(deviceId);
        return ResponseEntity.noContent().build();
    }

    private DeviceRecord owned(String deviceId, HttpServletRequest request) {
        ClientIdentity identity = ClientRequests.authenticate(directory, request);
        return directory.find(deviceId)
                .filter(device -> directory.canAccess(identity, device.id()))
                .orElseThrow(() -> new DeviceNotFoundException("Device not found"));
    }

    private DeviceStatus status(DeviceRecord device) {
        return new DeviceStatus(device.id(), registry.isConnected(device.id()), device.lastSeen());
    }
}
