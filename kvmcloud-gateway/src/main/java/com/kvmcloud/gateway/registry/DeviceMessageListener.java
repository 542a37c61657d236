package com.kvmcloud.gateway.registry;

import org.springframework.web.socket.CloseStatus;

/**
 * Consumer of a device socket's inbound traffic for the duration of one
 * exchange. Installed only through {@link SessionLease#bind}.
 * Callbacks arrive on the device socket's thread, in frame order, and must not block.
 */
public interface DeviceMessageListener {

    void onMessage(String payload);

    void onError(Throwable error);

    /**
     * The device socket is gone. May follow {@link #onError}.
     */
    void onClosed(CloseStatus status);
}
