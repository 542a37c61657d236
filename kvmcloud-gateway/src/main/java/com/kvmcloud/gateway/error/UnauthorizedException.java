package com.kvmcloud.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * Missing or invalid credential, or a device identifier that does not match it.
 */
public class UnauthorizedException extends SignalingException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, "unauthorized", message);
    }
}
