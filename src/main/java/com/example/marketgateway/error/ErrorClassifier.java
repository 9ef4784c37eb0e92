package com.example.marketgateway.error;

import org.springframework.dao.DataAccessException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Component;

/**
 * 실패를 NOT_FOUND / INTERNAL_ERROR / VALIDATION_ERROR 로 분류
 * - 예외 타입만 본다 (메시지 내용은 보지 않음)
 * - 백엔드 오류의 상세 내용은 응답에 싣지 않고 로그에만 남긴다
 */
@Component
public class ErrorClassifier {

    static final String MALFORMED_REQUEST = "Request body could not be read";
    static final String BACKEND_UNAVAILABLE = "Backend store unavailable";
    static final String INTERNAL = "Internal error";

    public ClassifiedError classify(Throwable error) {
        if (error instanceof GatewayException gatewayException) {
            return new ClassifiedError(gatewayException.getKind(), gatewayException.getMessage());
        }
        if (error instanceof HttpMessageNotReadableException) {
            return new ClassifiedError(ErrorKind.VALIDATION_ERROR, MALFORMED_REQUEST);
        }
        if (error instanceof DataAccessException || error instanceof StoreException) {
            return new ClassifiedError(ErrorKind.INTERNAL_ERROR, BACKEND_UNAVAILABLE);
        }
        return new ClassifiedError(ErrorKind.INTERNAL_ERROR, INTERNAL);
    }
}
