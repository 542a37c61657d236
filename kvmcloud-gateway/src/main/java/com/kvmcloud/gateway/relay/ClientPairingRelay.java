package com.kvmcloud.gateway.relay;

import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.error.DeviceNotConnectedException;
import com.kvmcloud.gateway.exchange.ExchangeAdmission;
import com.kvmcloud.gateway.registry.DeviceConnection;
import com.kvmcloud.gateway.registry.SessionLease;
import com.kvmcloud.gateway.signaling.IceServers;
import com.kvmcloud.gateway.signaling.SignalingCodec;
import com.kvmcloud.gateway.websocket.SignalingSocket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.util.Optional;

/**
 * Pairs client sockets with registered device sockets for interactive
 * signaling.
 *
 * <p>
 * Two phases, mirroring the WebSocket upgrade:
 * <ol>
 * <li>{@link #admit} – before the handshake answer: authorization, presence,
 * lease acquisition. Failures reject the upgrade.</li>
 * <li>{@link #open} – after the handshake: bind to the device socket, send
 * device metadata, relay until either side disconnects.</li>
 * </ol>
 */
@Slf4j
public class ClientPairingRelay {

    static final String HOLDER = "relay";

    private final ExchangeAdmission admission;
    private final IceServers iceServers;
    private final SignalingCodec codec;

    public ClientPairingRelay(ExchangeAdmission admission, IceServers iceServers, SignalingCodec codec) {
        this.admission = admission;
        this.iceServers = iceServers;
        this.codec = codec;
    }

    /**
     * Check preconditions and claim the device.
     *
     * @throws com.kvmcloud.gateway.error.SignalingException on any rejection;
     *         nothing is held afterwards
     */
    public PendingPairing admit(ClientIdentity identity, String deviceId, String clientAddress) {
        SessionLease lease = admission.admit(identity, deviceId, HOLDER);
        log.debug("client:admit device={} subject={} ip={}", deviceId, identity.subject(), clientAddress);
        return new PendingPairing(identity, deviceId, clientAddress, lease);
    }

    /**
     * Give up an admitted pairing whose handshake never completed.
     */
    public void abandon(PendingPairing pending) {
        pending.lease().close();
    }

    /**
     * Start relaying. If the device vanished since admission the client socket
     * is closed and the lease released.
     *
     * @return the running session, or empty if pairing failed
     */
    public Optional<ClientRelaySession> open(PendingPairing pending, SignalingSocket clientSocket) {
        ClientRelaySession session = new ClientRelaySession(pending, clientSocket, iceServers, codec);
        try {
            DeviceConnection connection = admission.currentConnection(pending.deviceId());
            session.start(connection);
        } catch (DeviceNotConnectedException e) {
            log.info("client:pair-failed device={} reason=device-gone", pending.deviceId());
            session.end(ClientRelaySession.DEVICE_GONE);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("client:pair-failed device={}: {}", pending.deviceId(), e.getMessage());
            session.end(CloseStatus.SERVER_ERROR);
            return Optional.empty();
        }
        log.info("client:open device={} subject={} socket={}",
                pending.deviceId(), pending.identity().subject(), clientSocket.id());
        return Optional.of(session);
    }

    public void onClientMessage(ClientRelaySession session, String text) {
        session.onClientText(text);
    }

    public void onClientClosed(ClientRelaySession session, CloseStatus status) {
        session.onClientClosed(status);
    }

    public void onClientError(ClientRelaySession session, Throwable error) {
        log.debug("client:error device={}: {}", session.getDeviceId(), error.getMessage());
        session.end(CloseStatus.SERVER_ERROR);
    }
}
