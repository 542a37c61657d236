package com.kvmcloud.gateway.testing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kvmcloud.gateway.bridge.SessionBridge;
import com.kvmcloud.gateway.device.DeviceConnectionManager;
import com.kvmcloud.gateway.exchange.ExchangeAdmission;
import com.kvmcloud.gateway.registry.DeviceConnection;
import com.kvmcloud.gateway.registry.DeviceConnectionRegistry;
import com.kvmcloud.gateway.registry.SessionLock;
import com.kvmcloud.gateway.relay.ClientPairingRelay;
import com.kvmcloud.gateway.signaling.IceServers;
import com.kvmcloud.gateway.signaling.SignalingCodec;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * A complete broker wired by hand around fakes, one per test.
 */
public final class BrokerFixture {

    public static final Duration LIVENESS = Duration.ofSeconds(10);
    public static final Duration TIMEOUT = Duration.ofSeconds(15);
    public static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    public final ObjectMapper objectMapper = new ObjectMapper();
    public final SignalingCodec codec = new SignalingCodec(objectMapper);
    public final IceServers iceServers = IceServers.parse(IceServers.DEFAULT_SERVERS);
    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final DeterministicScheduler scheduler = new DeterministicScheduler();
    public final DeviceConnectionRegistry registry = new DeviceConnectionRegistry();
    public final SessionLock sessionLock = new SessionLock(clock);
    public final FakeIdentityService identity = new FakeIdentityService()
            .device("kvm-1", "secret-1")
            .device("kvm-2", "secret-2")
            .client("alice", "alice-token", "kvm-1", "kvm-2")
            .client("bob", "bob-token");
    public final FakeDeviceDirectory directory = new FakeDeviceDirectory();
    public final DeviceConnectionManager manager = new DeviceConnectionManager(registry, sessionLock,
            identity, directory, scheduler, LIVENESS, clock);
    public final ExchangeAdmission admission = new ExchangeAdmission(registry, sessionLock, identity);
    public final ClientPairingRelay relay = new ClientPairingRelay(admission, iceServers, codec);
    public final SessionBridge bridge = new SessionBridge(admission, iceServers, scheduler, TIMEOUT, codec);

    /**
     * Admit and open a device socket the way the upgrade path does.
     */
    public DeviceConnection connectDevice(String deviceId, RecordingSocket socket) {
        String secret = "secret-" + deviceId.substring(deviceId.indexOf('-') + 1);
        String admitted = manager.admit(secret, deviceId);
        return manager.open(admitted, socket, "203.0.113.7", "1.4.2").orElseThrow();
    }
}
