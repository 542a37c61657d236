package com.kvmcloud.app.web;

import com.kvmcloud.gateway.error.SignalingException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.ResponseEntity;

/**
 * JSON error body: {@code {name, code, message}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

    private String name;
    private String code;
    private String message;

    public static ApiError of(SignalingException e) {
        return ApiError.builder()
                .name(e.getClass().getSimpleName())
                .code(e.getCode())
                .message(e.getMessage())
                .build();
    }

    public static ResponseEntity<Object> response(SignalingException e) {
        return ResponseEntity.status(e.getStatus()).body(of(e));
    }
}
