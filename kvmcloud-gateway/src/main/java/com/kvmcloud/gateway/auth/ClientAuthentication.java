package com.kvmcloud.gateway.auth;

import com.kvmcloud.common.logging.LogRedact;
import com.kvmcloud.gateway.error.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Resolves an operator's presented token through the {@link IdentityService}.
 * Shared by the client upgrade path and the HTTP session endpoint.
 */
@Slf4j
public final class ClientAuthentication {

    private ClientAuthentication() {
    }

    /**
     * @throws UnauthorizedException if the token is missing, unknown, or the
     *                               lookup itself failed
     */
    public static ClientIdentity authenticate(IdentityService identityService, String identityToken) {
        if (identityToken == null || identityToken.isBlank()) {
            throw new UnauthorizedException("No authorization token provided");
        }
        Optional<ClientIdentity> identity;
        try {
            identity = identityService.resolveClient(identityToken);
        } catch (RuntimeException e) {
            log.error("client:auth-error token={}: {}", LogRedact.maskToken(identityToken), e.getMessage(), e);
            throw new UnauthorizedException("Client authentication failed");
        }
        return identity.orElseThrow(() -> new UnauthorizedException("Invalid identity token"));
    }
}
