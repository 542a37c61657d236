package com.kvmcloud.gateway.relay;

import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.registry.SessionLease;

/**
 * Admitted client upgrade waiting for its handshake to complete. Holds the
 * device's lease from admission on, so the device cannot be claimed by
 * anything else between the upgrade check and the socket opening.
 */
public record PendingPairing(ClientIdentity identity, String deviceId, String clientAddress, SessionLease lease) {
}
