package com.kvmcloud.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * Another signaling exchange already holds the device.
 */
public class DeviceBusyException extends SignalingException {

    public DeviceBusyException(String message) {
        super(HttpStatus.CONFLICT, "device_in_flight", message);
    }
}
