package com.kvmcloud.gateway.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base failure of the signaling broker. Every failure is scoped to one
 * connection or one exchange and carries the HTTP status and short machine
 * code it is reported with, both on rejected socket upgrades and on HTTP calls.
 */
@Getter
public class SignalingException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public SignalingException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public SignalingException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }
}
