package com.kvmcloud.app.web;

import com.kvmcloud.gateway.auth.BearerTokens;
import com.kvmcloud.gateway.auth.ClientAuthentication;
import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.auth.IdentityService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

/**
 * Helpers shared by the HTTP controllers.
 */
final class ClientRequests {

    private ClientRequests() {
    }

    /**
     * @throws com.kvmcloud.gateway.error.UnauthorizedException if the
     *         bearer token is missing or unknown
     */
    static ClientIdentity authenticate(IdentityService identityService, HttpServletRequest request) {
        String token = BearerTokens.fromAuthorizationHeader(request.getHeader(HttpHeaders.AUTHORIZATION));
        return ClientAuthentication.authenticate(identityService, token);
    }
}
