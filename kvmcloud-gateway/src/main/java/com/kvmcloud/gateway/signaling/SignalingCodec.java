package com.kvmcloud.gateway.signaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kvmcloud.gateway.signaling.SignalingTypes.MessageType;
import com.kvmcloud.gateway.signaling.SignalingTypes.SignalingFrame;

import java.util.Optional;

/**
 * Reads and writes relay frames. Payloads stay as {@link JsonNode} so the
 * broker never reinterprets SDP or ICE content.
 */
public class SignalingCodec {

    private final ObjectMapper objectMapper;

    public SignalingCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decoded inbound frame. {@code type} is empty for frame types this broker
     * does not relay.
     */
    public record Inbound(Optional<MessageType> type, String rawType, JsonNode data) {
    }

    /**
     * Parse a relay frame.
     *
     * @throws JsonProcessingException if the text is not JSON
     * @throws IllegalArgumentException if it is JSON but not a {type, data} object
     */
    public Inbound decode(String text) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(text);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("frame is not a JSON object");
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new IllegalArgumentException("frame has no type");
        }
        String rawType = typeNode.asText();
        return new Inbound(MessageType.fromWire(rawType), rawType, node.get("data"));
    }

    public String encode(MessageType type, Object data) {
        return write(new SignalingFrame(type.wireName(), data));
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // Only reachable for types Jackson cannot serialize at all.
            throw new IllegalStateException("failed to encode signaling payload", e);
        }
    }

    public JsonNode readTree(String text) throws JsonProcessingException {
        return objectMapper.readTree(text);
    }
}
