package com.kvmcloud.gateway.websocket;

import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * Abstraction over one live WebSocket, device or client side.
 * <p>
 * Implemented by {@link WebSocketSessionSocket} for real sessions. Keeps the
 * broker services independent of the servlet WebSocket container so they can
 * be driven directly in tests.
 * </p>
 */
public interface SignalingSocket {

    /** Unique socket identifier, for logs. */
    String id();

    boolean isOpen();

    /** Send one text frame. Safe to call from any thread; frames keep call order. */
    void sendText(String text) throws IOException;

    /** Send a protocol-level ping; the peer answers with a pong. */
    void sendPing() throws IOException;

    /**
     * Close the socket. Never throws; a socket that is already gone is
     * left alone.
     */
    void close(CloseStatus status);
}
