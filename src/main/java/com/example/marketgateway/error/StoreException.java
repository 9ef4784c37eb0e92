package com.example.marketgateway.error;

/**
 * 저장소 값이 손상되어 읽을 수 없는 경우
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
