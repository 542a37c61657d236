package com.kvmcloud.gateway.registry;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Set of devices currently engaged in an exclusive signaling exchange.
 * <p>
 * At most one exchange per device: {@link #tryAcquire} is an atomic
 * check-and-insert that fails instead of waiting. Entries leave the set only
 * when their {@link SessionLease} closes, so a stale lease can never release a
 * newer exchange's entry.
 * </p>
 */
@Slf4j
public class SessionLock {

    private final ConcurrentMap<String, SessionLease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionLock() {
        this(Clock.systemUTC());
    }

    public SessionLock(Clock clock) {
        this.clock = clock;
    }

    /**
     * Claim the device for one exchange.
     *
     * @param holder short label of the claimant, for logs
     * @return the lease, or empty if another exchange holds the device
     */
    public Optional<SessionLease> tryAcquire(String deviceId, String holder) {
        SessionLease candidate = new SessionLease(this, deviceId, holder, clock.instant());
        SessionLease existing = leases.putIfAbsent(deviceId, candidate);
        if (existing != null) {
            log.debug("lock:busy device={} holder={} heldBy={}", deviceId, holder, existing.getHolder());
            return Optional.empty();
        }
        log.debug("lock:acquire device={} holder={}", deviceId, holder);
        return Optional.of(candidate);
    }

    public boolean isHeld(String deviceId) {
        return leases.containsKey(deviceId);
    }

    public int size() {
        return leases.size();
    }

    /**
     * Snapshot of the leases currently held, oldest first.
     */
    public List<SessionLease> activeLeases() {
        return leases.values().stream()
                .sorted(Comparator.comparing(SessionLease::getAcquiredAt))
                .toList();
    }

    /** How long {@code lease} has been held so far. */
    public Duration heldFor(SessionLease lease) {
        return Duration.between(lease.getAcquiredAt(), clock.instant());
    }

    void release(SessionLease lease) {
        if (leases.remove(lease.getDeviceId(), lease)) {
            log.debug("lock:release device={} holder={} heldMs={}",
                    lease.getDeviceId(), lease.getHolder(), heldFor(lease).toMillis());
        }
    }
}
