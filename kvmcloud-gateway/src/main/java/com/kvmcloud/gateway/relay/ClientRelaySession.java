package com.kvmcloud.gateway.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.kvmcloud.common.logging.LogRedact;
import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.registry.DeviceConnection;
import com.kvmcloud.gateway.registry.DeviceMessageListener;
import com.kvmcloud.gateway.registry.SessionLease;
import com.kvmcloud.gateway.signaling.IceServers;
import com.kvmcloud.gateway.signaling.SignalingCodec;
import com.kvmcloud.gateway.signaling.SignalingTypes;
import com.kvmcloud.gateway.signaling.SignalingTypes.MessageType;
import com.kvmcloud.gateway.signaling.SignalingTypes.OfferPayload;
import com.kvmcloud.gateway.websocket.SignalingSocket;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One interactive pairing between a client socket and a device socket.
 * Receives device frames as the lease's {@link DeviceMessageListener} and
 * client frames from {@link ClientPairingRelay}. Lasts until either side goes
 * away; there is no timeout.
 */
@Slf4j
public class ClientRelaySession implements DeviceMessageListener {

    /** Client close code when the paired device socket went away. */
    public static final CloseStatus DEVICE_GONE = new CloseStatus(4004, "device disconnected");

    @Getter
    private final String deviceId;
    @Getter
    private final SignalingSocket clientSocket;
    private final String clientAddress;
    private final ClientIdentity identity;
    private final SessionLease lease;
    private final IceServers iceServers;
    private final SignalingCodec codec;
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private volatile DeviceConnection device;

    ClientRelaySession(PendingPairing pairing, SignalingSocket clientSocket,
            IceServers iceServers, SignalingCodec codec) {
        this.deviceId = pairing.deviceId();
        this.clientSocket = clientSocket;
        this.clientAddress = pairing.clientAddress();
        this.identity = pairing.identity();
        this.lease = pairing.lease();
        this.iceServers = iceServers;
        this.codec = codec;
    }

    /**
     * Take over the device's inbound stream and greet the client with the
     * device's version.
     */
    void start(DeviceConnection connection) throws IOException {
        lease.bind(connection, this);
        this.device = connection;
        clientSocket.sendText(codec.encode(MessageType.DEVICE_METADATA,
                new SignalingTypes.DeviceMetadata(connection.getReportedVersion())));
    }

    public boolean isEnded() {
        return ended.get();
    }

    // ── client → device ──────────────────────────────────────────

    void onClientText(String text) {
        if (ended.get()) {
            return;
        }
        if (SignalingTypes.PING.equals(text)) {
            sendToClient(SignalingTypes.PONG);
            return;
        }
        SignalingCodec.Inbound frame;
        try {
            frame = codec.decode(text);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("client:drop device={} reason=malformed: {}", deviceId,
                    LogRedact.redactSensitiveText(e.getMessage()));
            return;
        }
        if (frame.type().isEmpty()) {
            log.debug("client:drop device={} type={}", deviceId, frame.rawType());
            return;
        }
        switch (frame.type().get()) {
            case OFFER -> forwardOffer(frame.data());
            case NEW_ICE_CANDIDATE -> sendToDevice(text);
            default -> log.debug("client:drop device={} type={}", deviceId, frame.rawType());
        }
    }

    private void forwardOffer(JsonNode data) {
        JsonNode sd = data != null ? data.get("sd") : null;
        if (sd == null || sd.isNull()) {
            log.warn("client:drop device={} reason=offer-without-sd", deviceId);
            return;
        }
        OfferPayload offer = new OfferPayload(sd, clientAddress, iceServers.urls(), identity.identityToken());
        log.debug("client:offer device={} ip={}", deviceId, clientAddress);
        sendToDevice(codec.encode(MessageType.OFFER, offer));
    }

    // ── device → client ──────────────────────────────────────────

    @Override
    public void onMessage(String payload) {
        SignalingCodec.Inbound frame;
        try {
            frame = codec.decode(payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("device:drop device={} reason=malformed: {}", deviceId,
                    LogRedact.redactSensitiveText(e.getMessage()));
            return;
        }
        MessageType type = frame.type().orElse(null);
        if (type == MessageType.ANSWER || type == MessageType.NEW_ICE_CANDIDATE) {
            sendToClient(payload);
        } else {
            log.debug("device:drop device={} type={}", deviceId, frame.rawType());
        }
    }

    @Override
    public void onError(Throwable error) {
        log.warn("client:device-error device={}: {}", deviceId, error.getMessage());
        end(DEVICE_GONE);
    }

    @Override
    public void onClosed(CloseStatus status) {
        log.info("client:device-closed device={} code={}", deviceId, status.getCode());
        end(DEVICE_GONE);
    }

    // ── teardown ─────────────────────────────────────────────────

    /**
     * The client went away. The device socket stays registered.
     */
    void onClientClosed(CloseStatus status) {
        if (end(null)) {
            log.info("client:close device={} code={}", deviceId, status.getCode());
        }
    }

    /**
     * Release the device and, if {@code clientClose} is set, close the client.
     *
     * @return true on the first call
     */
    boolean end(CloseStatus clientClose) {
        if (!ended.compareAndSet(false, true)) {
            return false;
        }
        lease.close();
        if (clientClose != null) {
            clientSocket.close(clientClose);
        }
        return true;
    }

    private void sendToDevice(String text) {
        DeviceConnection target = device;
        if (target == null) {
            return;
        }
        try {
            target.send(text);
        } catch (IOException e) {
            log.warn("client:device-send-failed device={}: {}", deviceId, e.getMessage());
            end(DEVICE_GONE);
        }
    }

    private void sendToClient(String text) {
        try {
            clientSocket.sendText(text);
        } catch (IOException e) {
            log.debug("client:send-failed device={}: {}", deviceId, e.getMessage());
            end(CloseStatus.SERVER_ERROR);
        }
    }
}
