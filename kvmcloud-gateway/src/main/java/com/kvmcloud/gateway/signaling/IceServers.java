package com.kvmcloud.gateway.signaling;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Process-wide STUN list attached to every forwarded offer.
 * Only {@code stun:} URLs are kept: {@code turns:}/{@code turn:} entries need
 * credentials this broker does not mint, and scheme-less entries are ambiguous.
 */
@Slf4j
public final class IceServers {

    public static final String DEFAULT_SERVERS =
            "stun:stun.cloudflare.com:3478,stun:stun.l.google.com:19302,stun:stun1.l.google.com:5349";

    private final List<String> urls;

    private IceServers(List<String> urls) {
        this.urls = List.copyOf(urls);
    }

    /**
     * Parse a comma separated list of ICE server URLs.
     */
    public static IceServers parse(String commaSeparated) {
        List<String> kept = new ArrayList<>();
        if (commaSeparated != null) {
            for (String raw : commaSeparated.split(",")) {
                String url = raw.trim();
                if (url.isEmpty()) {
                    continue;
                }
                if (url.toLowerCase(Locale.ROOT).startsWith("stun:")) {
                    kept.add(url);
                } else {
                    log.warn("ice: dropping non-STUN server entry {}", url);
                }
            }
        }
        return new IceServers(kept);
    }

    public List<String> urls() {
        return urls;
    }

    @Override
    public String toString() {
        return String.join(",", urls);
    }
}
