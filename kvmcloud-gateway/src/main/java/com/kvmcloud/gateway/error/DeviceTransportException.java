package com.kvmcloud.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * Device socket failed, closed or answered with garbage while an exchange was pending.
 */
public class DeviceTransportException extends SignalingException {

    public DeviceTransportException(String message) {
        super(HttpStatus.BAD_GATEWAY, "device_transport_error", message);
    }

    public DeviceTransportException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "device_transport_error", message, cause);
    }
}
