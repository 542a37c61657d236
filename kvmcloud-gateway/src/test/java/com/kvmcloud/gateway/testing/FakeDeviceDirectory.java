package com.kvmcloud.gateway.testing;

import com.kvmcloud.gateway.directory.DeviceDirectory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records last-seen writes and lets tests fire deletions.
 */
public final class FakeDeviceDirectory implements DeviceDirectory {

    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();
    private final List<DeletionListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void recordLastSeen(String deviceId, Instant seenAt) {
        if (failing) {
            throw new IllegalStateException("directory unavailable");
        }
        lastSeen.put(deviceId, seenAt);
    }

    @Override
    public void addDeletionListener(DeletionListener listener) {
        listeners.add(listener);
    }

    public void delete(String deviceId) {
        listeners.forEach(l -> l.onDeviceDeleted(deviceId));
    }

    public Instant lastSeen(String deviceId) {
        return lastSeen.get(deviceId);
    }

    public void failWrites() {
        this.failing = true;
    }
}
