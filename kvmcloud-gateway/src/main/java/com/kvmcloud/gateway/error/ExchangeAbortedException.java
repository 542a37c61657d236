package com.kvmcloud.gateway.error;

import org.springframework.http.HttpStatus;

/**
 * The originating caller went away before the device replied. Nobody is left
 * to read the response, so this is only ever logged.
 */
public class ExchangeAbortedException extends SignalingException {

    public ExchangeAbortedException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "exchange_aborted", message);
    }
}
