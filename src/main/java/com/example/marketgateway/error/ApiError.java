package com.example.marketgateway.error;

import lombok.Value;

/**
 * 실패 응답 본문 {code, message}
 */
@Value
public class ApiError {

    int code;
    String message;
}
