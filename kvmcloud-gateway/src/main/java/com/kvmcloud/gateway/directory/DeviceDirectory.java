package com.kvmcloud.gateway.directory;

import java.time.Instant;

/**
 * Device record store collaborator. The broker only writes last-seen
 * timestamps and listens for deletions; device CRUD lives elsewhere.
 */
public interface DeviceDirectory {

    /**
     * Persist when a device was last connected. Unknown devices are ignored.
     */
    void recordLastSeen(String deviceId, Instant seenAt);

    /**
     * Subscribe to device deletions. The broker closes and deregisters the
     * device's live socket when notified.
     */
    void addDeletionListener(DeletionListener listener);

    @FunctionalInterface
    interface DeletionListener {
        void onDeviceDeleted(String deviceId);
    }
}
