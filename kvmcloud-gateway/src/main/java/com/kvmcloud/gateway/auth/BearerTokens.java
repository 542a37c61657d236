package com.kvmcloud.gateway.auth;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Credential extraction from upgrade requests and HTTP calls.
 */
public final class BearerTokens {

    public static final String TOKEN_QUERY_PARAM = "token";

    private BearerTokens() {
    }

    /**
     * Token of an {@code Authorization: Bearer <token>} header, or null.
     */
    public static String fromAuthorizationHeader(String header) {
        if (header == null) {
            return null;
        }
        String trimmed = header.trim();
        if (trimmed.length() < 7 || !trimmed.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        String token = trimmed.substring(7).trim();
        return token.isEmpty() ? null : token;
    }

    /**
     * Header token first; browsers cannot set headers on WebSocket upgrades, so
     * fall back to the {@code token} query parameter.
     */
    public static String fromHeaderOrQuery(String header, URI uri) {
        String token = fromAuthorizationHeader(header);
        if (token != null) {
            return token;
        }
        return queryParam(uri, TOKEN_QUERY_PARAM);
    }

    /**
     * First non-empty value of a query parameter, URL-decoded, or null.
     * Splits the raw query so an encoded {@code &} or {@code =} stays inside the value.
     */
    public static String queryParam(URI uri, String name) {
        if (uri == null) {
            return null;
        }
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String param : query.split("&")) {
            String[] kv = param.split("=", 2);
            if (kv.length == 2 && name.equals(decode(kv[0])) && !kv[1].isEmpty()) {
                return decode(kv[1]);
            }
        }
        return null;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
