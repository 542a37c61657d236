package com.kvmcloud.gateway.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.kvmcloud.gateway.auth.ClientIdentity;

/**
 * One request/reply exchange: send {@code sd} to {@code deviceId} on behalf
 * of {@code identity}.
 */
public record BridgeRequest(ClientIdentity identity, String deviceId, JsonNode sd) {
}
