package com.kvmcloud.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * Device is unknown or the caller may not reach it.
 */
public class DeviceNotFoundException extends SignalingException {

    public DeviceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "device_not_found", message);
    }
}
