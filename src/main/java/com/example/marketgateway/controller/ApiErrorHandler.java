package com.example.marketgateway.controller;

import com.example.marketgateway.error.ApiError;
import com.example.marketgateway.error.ClassifiedError;
import com.example.marketgateway.error.ErrorClassifier;
import com.example.marketgateway.error.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiErrorHandler {

    private final ErrorClassifier errorClassifier;
    private final ResponseFormatter responseFormatter;

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiError> handle(RuntimeException e, HttpServletRequest req) {
        ClassifiedError classified = errorClassifier.classify(e);
        if (classified.getKind() == ErrorKind.INTERNAL_ERROR) {
            log.error("[{}] {} at {}: {}", classified.getKind(), classified.getStatus().value(),
                    req.getRequestURI(), e.getMessage(), e);
        } else {
            log.warn("[{}] {} at {}: {}", classified.getKind(), classified.getStatus().value(),
                    req.getRequestURI(), e.getMessage());
        }
        return responseFormatter.error(classified);
    }
}
