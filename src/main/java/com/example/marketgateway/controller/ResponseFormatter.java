package com.example.marketgateway.controller;

import com.example.marketgateway.error.ApiError;
import com.example.marketgateway.error.ClassifiedError;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * 성공: payload 그대로 200
 * 실패: {code, message} + 분류된 상태 코드
 */
@Component
public class ResponseFormatter {

    public <T> ResponseEntity<T> ok(T payload) {
        return ResponseEntity.ok(payload);
    }

    public ResponseEntity<ApiError> error(ClassifiedError error) {
        return ResponseEntity.status(error.getStatus())
                .body(new ApiError(error.getStatus().value(), error.getMessage()));
    }
}
