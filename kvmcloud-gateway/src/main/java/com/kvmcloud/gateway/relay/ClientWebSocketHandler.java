package com.kvmcloud.gateway.relay;

import com.kvmcloud.gateway.websocket.WebSocketSessionSocket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;

/**
 * Spring WebSocket endpoint for client sockets; forwards events to
 * {@link ClientPairingRelay}.
 */
@Slf4j
public class ClientWebSocketHandler extends TextWebSocketHandler {

    private static final String ATTR_SESSION = "client.session";

    private final ClientPairingRelay relay;

    public ClientWebSocketHandler(ClientPairingRelay relay) {
        this.relay = relay;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Map<String, Object> attrs = session.getAttributes();
        PendingPairing pending = (PendingPairing) attrs.remove(ClientHandshakeInterceptor.ATTR_PENDING);
        if (pending == null) {
            log.error("client:open without admission socket={}", session.getId());
            new WebSocketSessionSocket(session).close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        relay.open(pending, new WebSocketSessionSocket(session))
                .ifPresent(relaySession -> attrs.put(ATTR_SESSION, relaySession));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientRelaySession relaySession = sessionOf(session);
        if (relaySession != null) {
            relay.onClientMessage(relaySession, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ClientRelaySession relaySession = sessionOf(session);
        if (relaySession != null) {
            relay.onClientError(relaySession, exception);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientRelaySession relaySession = sessionOf(session);
        if (relaySession != null) {
            relay.onClientClosed(relaySession, status);
            return;
        }
        // Closed before afterConnectionEstablished ran: release the admitted lease.
        PendingPairing pending = (PendingPairing) session.getAttributes().remove(ClientHandshakeInterceptor.ATTR_PENDING);
        if (pending != null) {
            relay.abandon(pending);
        }
    }

    private static ClientRelaySession sessionOf(WebSocketSession session) {
        return (ClientRelaySession) session.getAttributes().get(ATTR_SESSION);
    }
}
