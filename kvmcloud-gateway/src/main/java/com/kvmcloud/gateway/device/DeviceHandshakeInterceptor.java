package com.kvmcloud.gateway.device;

import com.kvmcloud.common.logging.LogRedact;
import com.kvmcloud.gateway.auth.BearerTokens;
import com.kvmcloud.gateway.error.SignalingException;
import com.kvmcloud.gateway.websocket.RemoteAddresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Authenticates device upgrades before the handshake is answered and captures
 * connection metadata into the session attributes:
 * <ul>
 * <li>{@code Authorization: Bearer <secret>} – device credential</li>
 * <li>{@code X-Device-ID} – claimed device identifier</li>
 * <li>{@code X-App-Version} – reported software version (optional)</li>
 * </ul>
 * A rejected upgrade gets a plain HTTP status and no WebSocket session.
 */
@Slf4j
public class DeviceHandshakeInterceptor implements HandshakeInterceptor {

    public static final String DEVICE_ID_HEADER = "X-Device-ID";
    public static final String APP_VERSION_HEADER = "X-App-Version";

    static final String ATTR_DEVICE_ID = "device.id";
    static final String ATTR_VERSION = "device.version";
    static final String ATTR_SOURCE_ADDRESS = "device.sourceAddress";

    private final DeviceConnectionManager connectionManager;
    private final String realIpHeader;

    public DeviceHandshakeInterceptor(DeviceConnectionManager connectionManager, String realIpHeader) {
        this.connectionManager = connectionManager;
        this.realIpHeader = realIpHeader;
    }

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @NonNull Map<String, Object> attributes) {
        HttpHeaders headers = request.getHeaders();
        String secretToken = BearerTokens.fromAuthorizationHeader(headers.getFirst(HttpHeaders.AUTHORIZATION));
        String claimedId = headers.getFirst(DEVICE_ID_HEADER);
        String sourceAddress = RemoteAddresses.resolve(request, realIpHeader);

        String deviceId;
        try {
            deviceId = connectionManager.admit(secretToken, claimedId);
        } catch (SignalingException e) {
            String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
            log.warn("device:reject claimed={} remote={} status={} reason={} auth=[{}]",
                    claimedId, sourceAddress, e.getStatus().value(), e.getMessage(),
                    authorization == null ? "none"
                            : LogRedact.redactSensitiveText(HttpHeaders.AUTHORIZATION + ": " + authorization));
            response.setStatusCode(e.getStatus());
            return false;
        }

        attributes.put(ATTR_DEVICE_ID, deviceId);
        attributes.put(ATTR_SOURCE_ADDRESS, sourceAddress);
        String version = headers.getFirst(APP_VERSION_HEADER);
        if (version != null && !version.isBlank()) {
            attributes.put(ATTR_VERSION, version);
        }
        return true;
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @Nullable Exception exception) {
        if (exception != null) {
            log.warn("device:handshake-failed: {}", exception.getMessage());
        }
    }
}
