package com.kvmcloud.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * Device exists but has no live socket registered with this broker.
 */
public class DeviceNotConnectedException extends SignalingException {

    public DeviceNotConnectedException(String message) {
        super(HttpStatus.NOT_FOUND, "kvm_socket_not_found", message);
    }
}
