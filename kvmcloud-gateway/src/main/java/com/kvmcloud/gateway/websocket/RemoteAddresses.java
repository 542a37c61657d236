package com.kvmcloud.gateway.websocket;

import org.springframework.http.server.ServerHttpRequest;

import java.net.InetSocketAddress;

/**
 * Best-effort observed origin of a peer, honouring a configured real-IP header
 * when the broker sits behind a proxy.
 */
public final class RemoteAddresses {

    private RemoteAddresses() {
    }

    /**
     * Resolve the peer address.
     *
     * @param headerValue value of the configured real-IP header, may be null
     * @param remoteAddr  socket remote address, may be null
     * @return the first entry of the header if present, otherwise the socket
     *         address, otherwise {@code "unknown"}
     */
    public static String resolve(String headerValue, String remoteAddr) {
        if (headerValue != null && !headerValue.isBlank()) {
            // X-Forwarded-For style lists: the left-most entry is the original client.
            String first = headerValue.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (remoteAddr != null && !remoteAddr.isBlank()) {
            return remoteAddr;
        }
        return "unknown";
    }

    public static String resolve(ServerHttpRequest request, String realIpHeader) {
        String headerValue = (realIpHeader == null || realIpHeader.isBlank())
                ? null
                : request.getHeaders().getFirst(realIpHeader);
        InetSocketAddress remote = request.getRemoteAddress();
        String remoteAddr = (remote != null && remote.getAddress() != null)
                ? remote.getAddress().getHostAddress()
                : null;
        return resolve(headerValue, remoteAddr);
    }
}
