package com.kvmcloud.gateway.signaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kvmcloud.gateway.signaling.SignalingTypes.MessageType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignalingCodecTest {

    private final SignalingCodec codec = new SignalingCodec(new ObjectMapper());

    @Test
    void decode_knownType() throws Exception {
        SignalingCodec.Inbound frame = codec.decode("{\"type\":\"new-ice-candidate\",\"data\":{\"candidate\":\"c\"}}");
        assertEquals(MessageType.NEW_ICE_CANDIDATE, frame.type().orElseThrow());
        assertEquals("c", frame.data().get("candidate").asText());
    }

    @Test
    void decode_unknownType_keepsRawName() throws Exception {
        SignalingCodec.Inbound frame = codec.decode("{\"type\":\"hello\"}");
        assertTrue(frame.type().isEmpty());
        assertEquals("hello", frame.rawType());
        assertNull(frame.data());
    }

    @Test
    void decode_rejectsNonFrames() {
        assertThrows(JsonProcessingException.class, () -> codec.decode("{oops"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("\"offer\""));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"type\":7}"));
    }

    @Test
    void encode_metadataFrame() {
        String json = codec.encode(MessageType.DEVICE_METADATA, new SignalingTypes.DeviceMetadata("2.0.1"));
        assertEquals("{\"type\":\"device-metadata\",\"data\":{\"deviceVersion\":\"2.0.1\"}}", json);
    }
}
