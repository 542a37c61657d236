package com.kvmcloud.gateway.device;

import com.kvmcloud.gateway.error.DeviceBusyException;
import com.kvmcloud.gateway.error.UnauthorizedException;
import com.kvmcloud.gateway.registry.DeviceConnection;
import com.kvmcloud.gateway.registry.SessionLease;
import com.kvmcloud.gateway.signaling.SignalingTypes;
import com.kvmcloud.gateway.testing.BrokerFixture;
import com.kvmcloud.gateway.testing.RecordingSocket;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DeviceConnectionManagerTest {

    private final BrokerFixture broker = new BrokerFixture();

    // ── admission ────────────────────────────────────────────────

    @Test
    void admit_matchingTokenAndId_returnsDeviceId() {
        assertEquals("kvm-1", broker.manager.admit("secret-1", "kvm-1"));
    }

    @ParameterizedTest
    @CsvSource(value = {
            "NULL, kvm-1",
            "'   ', kvm-1",
            "wrong-secret, kvm-1",
            "secret-1, kvm-2",
            "secret-1, NULL",
    }, nullValues = "NULL")
    void admit_badCredentials_rejected(String token, String claimedId) {
        assertThrows(UnauthorizedException.class, () -> broker.manager.admit(token, claimedId));
    }

    @Test
    void admit_lookupFailure_isRejectionNotCrash() {
        broker.identity.failLookups();
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> broker.manager.admit("secret-1", "kvm-1"));
        assertEquals(401, e.getStatus().value());
    }

    @Test
    void admit_deviceMidExchange_rejectedAsBusy() {
        broker.sessionLock.tryAcquire("kvm-1", "bridge").orElseThrow();
        assertThrows(DeviceBusyException.class, () -> broker.manager.admit("secret-1", "kvm-1"));
    }

    @Test
    void open_deviceBecameBusyAfterAdmission_closesSocket() {
        String deviceId = broker.manager.admit("secret-1", "kvm-1");
        broker.sessionLock.tryAcquire("kvm-1", "relay").orElseThrow();
        RecordingSocket socket = new RecordingSocket();

        assertTrue(broker.manager.open(deviceId, socket, "10.0.0.1", null).isEmpty());
        assertEquals(DeviceConnectionManager.BUSY, socket.closeStatus());
        assertFalse(broker.registry.isConnected("kvm-1"));
    }

    // ── registration / displacement ──────────────────────────────

    @Test
    void open_registersConnectionWithMetadata() {
        DeviceConnection conn = broker.connectDevice("kvm-1", new RecordingSocket());

        assertSame(conn, broker.registry.lookup("kvm-1").orElseThrow());
        assertEquals("1.4.2", conn.getReportedVersion());
        assertEquals("203.0.113.7", conn.getSourceAddress());
        assertEquals(BrokerFixture.NOW, conn.getConnectedAt());
    }

    @Test
    void open_sameDeviceTwice_newcomerWinsAndOldSocketIsClosed() {
        RecordingSocket oldSocket = new RecordingSocket();
        RecordingSocket newSocket = new RecordingSocket();
        DeviceConnection old = broker.connectDevice("kvm-1", oldSocket);
        DeviceConnection fresh = broker.connectDevice("kvm-1", newSocket);

        assertEquals(DeviceConnectionManager.REPLACED, oldSocket.closeStatus());
        assertTrue(old.isClosed());
        assertTrue(newSocket.isOpen());
        assertSame(fresh, broker.registry.lookup("kvm-1").orElseThrow());

        // late close event of the displaced socket must not evict the newcomer
        broker.manager.onClosed(old, CloseStatus.NORMAL);
        assertSame(fresh, broker.registry.lookup("kvm-1").orElseThrow());
    }

    // ── liveness ─────────────────────────────────────────────────

    @Test
    void liveness_pongEachCycle_keepsConnection() {
        RecordingSocket socket = new RecordingSocket();
        DeviceConnection conn = broker.connectDevice("kvm-1", socket);

        for (int i = 0; i < 5; i++) {
            broker.scheduler.advance(BrokerFixture.LIVENESS);
            broker.manager.onPong(conn);
        }

        assertEquals(5, socket.pings());
        assertTrue(socket.isOpen());
        assertTrue(broker.registry.isConnected("kvm-1"));
    }

    @Test
    void liveness_missedPong_terminatesAndDeregisters() {
        RecordingSocket socket = new RecordingSocket();
        broker.connectDevice("kvm-1", socket);

        broker.scheduler.advance(BrokerFixture.LIVENESS); // ping 1
        assertEquals(1, socket.pings());
        broker.scheduler.advance(BrokerFixture.LIVENESS); // no pong since ping 1

        assertEquals(DeviceConnectionManager.LIVENESS_TIMEOUT, socket.closeStatus());
        assertFalse(broker.registry.isConnected("kvm-1"));
        assertEquals(BrokerFixture.NOW, broker.directory.lastSeen("kvm-1"));
        assertEquals(0, broker.scheduler.pendingCount(), "liveness check cancelled on teardown");
    }

    @Test
    void liveness_pingFailure_tearsDown() {
        RecordingSocket socket = new RecordingSocket();
        broker.connectDevice("kvm-1", socket);
        socket.failSends();

        broker.scheduler.advance(BrokerFixture.LIVENESS);

        assertFalse(broker.registry.isConnected("kvm-1"));
        assertEquals(CloseStatus.SERVER_ERROR, socket.closeStatus());
    }

    // ── teardown ─────────────────────────────────────────────────

    @Test
    void errorThenClose_tearsDownOnce() {
        RecordingSocket socket = new RecordingSocket();
        DeviceConnection conn = broker.connectDevice("kvm-1", socket);
        SessionLease lease = broker.sessionLock.tryAcquire("kvm-1", "relay").orElseThrow();
        CountingListener listener = new CountingListener();
        lease.bind(conn, listener);

        broker.manager.onTransportError(conn, new IOException("reset"));
        broker.manager.onClosed(conn, CloseStatus.NO_CLOSE_FRAME);

        assertEquals(1, listener.errors);
        assertEquals(1, listener.closes);
        assertFalse(broker.registry.isConnected("kvm-1"));
        assertEquals(0, broker.scheduler.pendingCount());
    }

    @Test
    void lastSeenFailure_doesNotBreakTeardown() {
        DeviceConnection conn = broker.connectDevice("kvm-1", new RecordingSocket());
        broker.directory.failWrites();

        broker.manager.onClosed(conn, CloseStatus.NORMAL);

        assertFalse(broker.registry.isConnected("kvm-1"));
    }

    @Test
    void messagesWithoutListener_areDropped() {
        DeviceConnection conn = broker.connectDevice("kvm-1", new RecordingSocket());
        assertDoesNotThrow(() -> broker.manager.onMessage(conn, "{\"type\":\"answer\"}"));
    }

    // ── deletion ─────────────────────────────────────────────────

    @Test
    void deviceDeleted_noticeSentThenSocketClosed() {
        RecordingSocket socket = new RecordingSocket();
        broker.connectDevice("kvm-1", socket);

        broker.directory.delete("kvm-1");

        assertEquals(SignalingTypes.DEREGISTERED, socket.lastSent());
        assertEquals(DeviceConnectionManager.DEREGISTERED, socket.closeStatus());
        assertFalse(broker.registry.isConnected("kvm-1"));
    }

    @Test
    void deregister_unknownDevice_returnsFalse() {
        assertFalse(broker.manager.deregister("kvm-2"));
    }

    @Test
    void close_terminatesEverySocket() {
        RecordingSocket a = new RecordingSocket();
        RecordingSocket b = new RecordingSocket();
        broker.connectDevice("kvm-1", a);
        broker.connectDevice("kvm-2", b);

        broker.manager.close();

        assertEquals(CloseStatus.SERVICE_RESTARTED, a.closeStatus());
        assertEquals(CloseStatus.SERVICE_RESTARTED, b.closeStatus());
        assertEquals(0, broker.registry.size());
        broker.scheduler.advance(Duration.ofMinutes(1));
        assertEquals(0, a.pings() + b.pings());
    }

    private static final class CountingListener implements com.kvmcloud.gateway.registry.DeviceMessageListener {
        int errors;
        int closes;

        @Override
        public void onMessage(String payload) {
        }

        @Override
        public void onError(Throwable error) {
            errors++;
        }

        @Override
        public void onClosed(CloseStatus status) {
            closes++;
        }
    }
}
