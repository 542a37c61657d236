package com.kvmcloud.gateway.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link SignalingSocket} over a Spring {@link WebSocketSession}.
 * Sends go through a {@link ConcurrentWebSocketSessionDecorator} because the
 * relay writes to a socket from the peer socket's thread.
 */
@Slf4j
public class WebSocketSessionSocket implements SignalingSocket {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024; // 512KB

    private final WebSocketSession session;

    public WebSocketSessionSocket(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void sendText(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session closed");
        }
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void sendPing() throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session closed");
        }
        session.sendMessage(new PingMessage());
    }

    @Override
    public void close(CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(new CloseStatus(status.getCode(), truncateReason(status.getReason())));
            }
        } catch (Exception e) {
            log.debug("close error: {}", e.getMessage());
        }
    }

    private static String truncateReason(String reason) {
        // WebSocket close reason max 123 bytes
        if (reason == null)
            return null;
        return reason.length() > 120 ? reason.substring(0, 120) + "..." : reason;
    }
}
