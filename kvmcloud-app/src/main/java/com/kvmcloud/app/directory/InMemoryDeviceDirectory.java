package com.kvmcloud.app.directory;

import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.auth.IdentityService;
import com.kvmcloud.gateway.directory.DeviceDirectory;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Reference device directory and identity table held in memory, seeded from
 * configuration. Deployments with a real user/device store replace this bean.
 *
 * <p>
 * Seed formats (comma separated):
 * <ul>
 * <li>devices: {@code deviceId:secretToken:ownerSubject}</li>
 * <li>clients: {@code identityToken:subject}</li>
 * </ul>
 */
@Slf4j
public class InMemoryDeviceDirectory implements DeviceDirectory, IdentityService {

    /** One registered device. {@code lastSeen} is null until it first disconnects. */
    public record DeviceRecord(String id, String owner, Instant lastSeen) {
    }

    private record Entry(String secretToken, String owner) {
    }

    private final Map<String, Entry> devices = new ConcurrentHashMap<>();
    private final Map<String, String> secretToDevice = new ConcurrentHashMap<>();
    private final Map<String, String> clientTokens = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();
    private final List<DeletionListener> listeners = new CopyOnWriteArrayList<>();

    public static InMemoryDeviceDirectory fromConfig(String deviceSeed, String clientSeed) {
        InMemoryDeviceDirectory directory = new InMemoryDeviceDirectory();
        for (String[] parts : split(deviceSeed, 3, "kvmcloud.directory.devices")) {
            directory.addDevice(parts[0], parts[1], parts[2]);
        }
        for (String[] parts : split(clientSeed, 2, "kvmcloud.identity.clients")) {
            directory.addClient(parts[0], parts[1]);
        }
        log.info("directory:loaded devices={} clients={}", directory.devices.size(), directory.clientTokens.size());
        return directory;
    }

    private static List<String[]> split(String seed, int fields, String property) {
        if (seed == null || seed.isBlank()) {
            return List.of();
        }
        return Arrays.stream(seed.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> {
                    String[] parts = s.split(":", fields);
                    if (parts.length != fields || Arrays.stream(parts).anyMatch(String::isBlank)) {
                        throw new IllegalArgumentException("Malformed " + property + " entry: expected "
                                + fields + " ':'-separated fields");
                    }
                    return parts;
                })
                .toList();
    }

    // ── Administration ───────────────────────────────────────────

    public void addDevice(String deviceId, String secretToken, String owner) {
        Entry previous = devices.put(deviceId, new Entry(secretToken, owner));
        if (previous != null) {
            secretToDevice.remove(previous.secretToken());
        }
        secretToDevice.put(secretToken, deviceId);
    }

    public void addClient(String identityToken, String subject) {
        clientTokens.put(identityToken, subject);
    }

    /**
     * Delete a device record and notify listeners.
     *
     * @return false if the device did not exist
     */
    public boolean delete(String deviceId) {
        Entry removed = devices.remove(deviceId);
        if (removed == null) {
            return false;
        }
        secretToDevice.remove(removed.secretToken());
        lastSeen.remove(deviceId);
        log.info("directory:delete device={}", deviceId);
        for (DeletionListener listener : listeners) {
            try {
                listener.onDeviceDeleted(deviceId);
            } catch (RuntimeException e) {
                log.error("directory:deletion-listener-failed device={}: {}", deviceId, e.getMessage(), e);
            }
        }
        return true;
    }

    public Optional<DeviceRecord> find(String deviceId) {
        Entry entry = devices.get(deviceId);
        return entry == null
                ? Optional.empty()
                : Optional.of(new DeviceRecord(deviceId, entry.owner(), lastSeen.get(deviceId)));
    }

    public List<DeviceRecord> devicesOwnedBy(String subject) {
        return devices.entrySet().stream()
                .filter(e -> e.getValue().owner().equals(subject))
                .map(e -> new DeviceRecord(e.getKey(), e.getValue().owner(), lastSeen.get(e.getKey())))
                .sorted(Comparator.comparing(DeviceRecord::id))
                .toList();
    }

    // ── DeviceDirectory ──────────────────────────────────────────

    @Override
    public void recordLastSeen(String deviceId, Instant seenAt) {
        if (devices.containsKey(deviceId)) {
            lastSeen.put(deviceId, seenAt);
        }
    }

    @Override
    public void addDeletionListener(DeletionListener listener) {
        listeners.add(listener);
    }

    // ── IdentityService ──────────────────────────────────────────

    @Override
    public Optional<String> resolveDevice(String secretToken) {
        return Optional.ofNullable(secretToDevice.get(secretToken));
    }

    @Override
    public Optional<ClientIdentity> resolveClient(String identityToken) {
        return Optional.ofNullable(clientTokens.get(identityToken))
                .map(subject -> new ClientIdentity(subject, identityToken));
    }

    @Override
    public boolean canAccess(ClientIdentity identity, String deviceId) {
        Entry entry = devices.get(deviceId);
        return entry != null && entry.owner().equals(identity.subject());
    }
}
