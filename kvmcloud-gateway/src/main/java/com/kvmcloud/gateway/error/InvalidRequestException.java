package com.kvmcloud.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * Request is missing a required field.
 */
public class InvalidRequestException extends SignalingException {

    public InvalidRequestException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_request", message);
    }
}
