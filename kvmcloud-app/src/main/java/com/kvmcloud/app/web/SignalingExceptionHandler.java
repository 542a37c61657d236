package com.kvmcloud.app.web;

import com.kvmcloud.gateway.error.SignalingException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps broker failures raised by controllers to {@link ApiError} bodies.
 */
@Slf4j
@RestControllerAdvice
public class SignalingExceptionHandler {

    @ExceptionHandler(SignalingException.class)
    public ResponseEntity<Object> handleSignaling(SignalingException e, HttpServletRequest request) {
        log.warn("http:reject {} {} status={} code={}: {}",
                request.getMethod(), request.getRequestURI(), e.getStatus().value(), e.getCode(), e.getMessage());
        return ApiError.response(e);
    }
}
