package com.kvmcloud.gateway.relay;

import com.kvmcloud.common.logging.LogRedact;
import com.kvmcloud.gateway.auth.BearerTokens;
import com.kvmcloud.gateway.auth.ClientAuthentication;
import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.auth.IdentityService;
import com.kvmcloud.gateway.error.SignalingException;
import com.kvmcloud.gateway.websocket.RemoteAddresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Admits client upgrades on {@code <client-path>?id=<deviceId>}. The identity
 * token comes from the {@code Authorization} header or the {@code token}
 * query parameter. An admitted upgrade already holds the device's lease.
 */
@Slf4j
public class ClientHandshakeInterceptor implements HandshakeInterceptor {

    public static final String DEVICE_ID_PARAM = "id";

    static final String ATTR_PENDING = "client.pending";

    private final ClientPairingRelay relay;
    private final IdentityService identityService;
    private final String realIpHeader;

    public ClientHandshakeInterceptor(ClientPairingRelay relay, IdentityService identityService,
            String realIpHeader) {
        this.relay = relay;
        this.identityService = identityService;
        this.realIpHeader = realIpHeader;
    }

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @NonNull Map<String, Object> attributes) {
        String deviceId = BearerTokens.queryParam(request.getURI(), DEVICE_ID_PARAM);
        String clientAddress = RemoteAddresses.resolve(request, realIpHeader);
        try {
            String token = BearerTokens.fromHeaderOrQuery(
                    request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION), request.getURI());
            ClientIdentity identity = ClientAuthentication.authenticate(identityService, token);
            PendingPairing pending = relay.admit(identity, deviceId, clientAddress);
            attributes.put(ATTR_PENDING, pending);
            if (request instanceof ServletServerHttpRequest servletRequest) {
                servletRequest.getServletRequest().setAttribute(ATTR_PENDING, pending);
            }
            return true;
        } catch (SignalingException e) {
            log.warn("client:reject device={} remote={} status={} reason={} uri={}",
                    deviceId, clientAddress, e.getStatus().value(), e.getMessage(),
                    LogRedact.redactSensitiveText(String.valueOf(request.getURI())));
            response.setStatusCode(e.getStatus());
            return false;
        }
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @Nullable Exception exception) {
        boolean upgraded = exception == null && !(response instanceof ServletServerHttpResponse servletResponse
                && servletResponse.getServletResponse().getStatus() != HttpStatus.SWITCHING_PROTOCOLS.value());
        if (upgraded) {
            return;
        }
        // Admitted but never upgraded: the lease would otherwise stay held.
        if (request instanceof ServletServerHttpRequest servletRequest
                && servletRequest.getServletRequest().getAttribute(ATTR_PENDING) instanceof PendingPairing pending) {
            log.warn("client:handshake-failed device={}: {}", pending.deviceId(),
                    exception != null ? exception.getMessage() : "not upgraded");
            relay.abandon(pending);
        }
    }
}
