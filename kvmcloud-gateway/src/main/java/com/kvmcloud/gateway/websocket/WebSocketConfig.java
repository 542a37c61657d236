package com.kvmcloud.gateway.websocket;

import com.kvmcloud.gateway.auth.IdentityService;
import com.kvmcloud.gateway.device.DeviceConnectionManager;
import com.kvmcloud.gateway.device.DeviceHandshakeInterceptor;
import com.kvmcloud.gateway.device.DeviceWebSocketHandler;
import com.kvmcloud.gateway.relay.ClientHandshakeInterceptor;
import com.kvmcloud.gateway.relay.ClientPairingRelay;
import com.kvmcloud.gateway.relay.ClientWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket configuration for the signaling broker.
 * Registers the device endpoint and the client endpoint, each behind its own
 * authenticating handshake interceptor. Any other upgrade path has no handler
 * and is refused by the servlet container.
 */
@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final DeviceConnectionManager deviceConnectionManager;
    private final ClientPairingRelay clientPairingRelay;
    private final IdentityService identityService;

    @Value("${kvmcloud.signaling.device-path:/webrtc/signaling/device}")
    private String devicePath;
    @Value("${kvmcloud.signaling.client-path:/webrtc/signaling/client}")
    private String clientPath;
    @Value("${kvmcloud.signaling.real-ip-header:}")
    private String realIpHeader;
    @Value("${kvmcloud.signaling.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(DeviceConnectionManager deviceConnectionManager,
            ClientPairingRelay clientPairingRelay, IdentityService identityService) {
        this.deviceConnectionManager = deviceConnectionManager;
        this.clientPairingRelay = clientPairingRelay;
        this.identityService = identityService;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(deviceWebSocketHandler(), devicePath)
                .addInterceptors(new DeviceHandshakeInterceptor(deviceConnectionManager, realIpHeader))
                .setAllowedOrigins(allowedOrigins);
        registry.addHandler(clientWebSocketHandler(), clientPath)
                .addInterceptors(new ClientHandshakeInterceptor(clientPairingRelay, identityService, realIpHeader))
                .setAllowedOrigins(allowedOrigins);
        log.info("ws:routes device={} client={}", devicePath, clientPath);
    }

    @Bean
    public DeviceWebSocketHandler deviceWebSocketHandler() {
        return new DeviceWebSocketHandler(deviceConnectionManager);
    }

    @Bean
    public ClientWebSocketHandler clientWebSocketHandler() {
        return new ClientWebSocketHandler(clientPairingRelay);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(512 * 1024); // 512KB
        container.setMaxBinaryMessageBufferSize(512 * 1024);
        // Device sockets are long-lived; liveness checks detect dead peers instead.
        container.setMaxSessionIdleTimeout(0L);
        return container;
    }
}
