package com.example.marketgateway.error;

import org.springframework.http.HttpStatus;

/**
 * 실패 분류와 응답 상태 코드
 * VALIDATION_ERROR는 기존 API 계약대로 500으로 응답한다
 */
public enum ErrorKind {

    NOT_FOUND(HttpStatus.NOT_FOUND),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    VALIDATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
