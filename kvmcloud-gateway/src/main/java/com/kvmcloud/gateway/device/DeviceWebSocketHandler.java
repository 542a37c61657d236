package com.kvmcloud.gateway.device;

import com.kvmcloud.gateway.registry.DeviceConnection;
import com.kvmcloud.gateway.websocket.WebSocketSessionSocket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;

/**
 * Spring WebSocket endpoint for device sockets. Thin adapter: every event is
 * forwarded to {@link DeviceConnectionManager}.
 */
@Slf4j
public class DeviceWebSocketHandler extends TextWebSocketHandler {

    private static final String ATTR_CONNECTION = "device.connection";

    private final DeviceConnectionManager connectionManager;

    public DeviceWebSocketHandler(DeviceConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Map<String, Object> attrs = session.getAttributes();
        String deviceId = (String) attrs.get(DeviceHandshakeInterceptor.ATTR_DEVICE_ID);
        if (deviceId == null) {
            // Only reachable if the interceptor was not applied.
            log.error("device:open without admission socket={}", session.getId());
            new WebSocketSessionSocket(session).close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        connectionManager.open(deviceId,
                new WebSocketSessionSocket(session),
                (String) attrs.get(DeviceHandshakeInterceptor.ATTR_SOURCE_ADDRESS),
                (String) attrs.get(DeviceHandshakeInterceptor.ATTR_VERSION))
                .ifPresent(connection -> attrs.put(ATTR_CONNECTION, connection));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        DeviceConnection connection = connectionOf(session);
        if (connection != null) {
            connectionManager.onMessage(connection, message.getPayload());
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        DeviceConnection connection = connectionOf(session);
        if (connection != null) {
            connectionManager.onPong(connection);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        DeviceConnection connection = connectionOf(session);
        if (connection != null) {
            connectionManager.onTransportError(connection, exception);
        } else {
            log.debug("device:error socket={}: {}", session.getId(), exception.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        DeviceConnection connection = connectionOf(session);
        if (connection != null) {
            connectionManager.onClosed(connection, status);
        }
    }

    private static DeviceConnection connectionOf(WebSocketSession session) {
        return (DeviceConnection) session.getAttributes().get(ATTR_CONNECTION);
    }
}
