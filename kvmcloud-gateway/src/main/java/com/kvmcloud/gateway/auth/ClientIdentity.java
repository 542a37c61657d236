package com.kvmcloud.gateway.auth;

/**
 * Authenticated operator behind a client request.
 *
 * @param subject       stable user identifier
 * @param identityToken the raw token the operator presented; forwarded to the
 *                      device inside offers so the device can verify the user itself
 */
public record ClientIdentity(String subject, String identityToken) {

    @Override
    public String toString() {
        return "ClientIdentity[subject=" + subject + "]";
    }
}
