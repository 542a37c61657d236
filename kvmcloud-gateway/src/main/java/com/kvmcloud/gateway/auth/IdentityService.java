package com.kvmcloud.gateway.auth;

import java.util.Optional;

/**
 * Identity and authorization collaborator. The broker never verifies
 * credentials itself; it only asks this service.
 * Implementations may block on I/O and may throw; callers treat a throw as a
 * rejection.
 */
public interface IdentityService {

    /**
     * Resolve a device's bearer secret to the device identifier it was issued for.
     */
    Optional<String> resolveDevice(String secretToken);

    /**
     * Resolve an operator's identity token.
     */
    Optional<ClientIdentity> resolveClient(String identityToken);

    /**
     * Whether {@code identity} may open a signaling exchange with {@code deviceId}.
     */
    boolean canAccess(ClientIdentity identity, String deviceId);
}
