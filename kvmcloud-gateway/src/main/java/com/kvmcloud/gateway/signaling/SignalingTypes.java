package com.kvmcloud.gateway.signaling;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Signaling wire types shared by the client relay and the session bridge.
 *
 * <p>
 * Relay frames are JSON text frames of the form {@code {type, data}}:
 * <ul>
 * <li>{@code offer} – client → device, augmented by the broker</li>
 * <li>{@code answer} – device → client</li>
 * <li>{@code new-ice-candidate} – either direction, relayed verbatim</li>
 * <li>{@code device-metadata} – broker → client, once at pairing time</li>
 * </ul>
 * The literal text frames {@code ping}/{@code pong} are keep-alives and are
 * never wrapped.
 */
public final class SignalingTypes {

    private SignalingTypes() {
    }

    public static final String PING = "ping";
    public static final String PONG = "pong";

    /** Sent to a device socket right before the broker closes it on deletion. */
    public static final String DEREGISTERED = "Deregistered from server";

    // ── Message types ────────────────────────────────────────────

    public enum MessageType {
        OFFER("offer"),
        ANSWER("answer"),
        NEW_ICE_CANDIDATE("new-ice-candidate"),
        DEVICE_METADATA("device-metadata");

        private final String wireName;

        MessageType(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Optional<MessageType> fromWire(String value) {
            for (MessageType type : values()) {
                if (type.wireName.equals(value)) {
                    return Optional.of(type);
                }
            }
            return Optional.empty();
        }
    }

    // ── Frame ────────────────────────────────────────────────────

    /** Relay frame: {type, data}. {@code data} is opaque to the broker. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SignalingFrame {
        private String type;
        private Object data;
    }

    // ── Payloads ─────────────────────────────────────────────────

    /**
     * Offer as the device receives it. The same object is sent bare (without
     * a frame) by the session bridge.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OfferPayload {
        /** Session description, byte-identical to what the client sent. */
        private JsonNode sd;
        private String ip;
        private List<String> iceServers;
        /** Caller's identity token; the device verifies it on its own. */
        @JsonProperty("OidcGoogle")
        private String identityToken;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeviceMetadata {
        private String deviceVersion;
    }
}
