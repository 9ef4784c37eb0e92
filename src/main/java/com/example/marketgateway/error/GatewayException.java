package com.example.marketgateway.error;

import lombok.Getter;

/**
 * 게이트웨이가 직접 판단한 실패 (부재, 검증 실패, 내부 이상)
 */
@Getter
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    public GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static GatewayException notFound(String message) {
        return new GatewayException(ErrorKind.NOT_FOUND, message);
    }

    public static GatewayException validation(String message) {
        return new GatewayException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static GatewayException internal(String message) {
        return new GatewayException(ErrorKind.INTERNAL_ERROR, message);
    }
}
