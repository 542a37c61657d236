package com.kvmcloud.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * No reply from the device within the exchange window.
 */
public class ExchangeTimeoutException extends SignalingException {

    public ExchangeTimeoutException(String message) {
        super(HttpStatus.GATEWAY_TIMEOUT, "exchange_timeout", message);
    }
}
