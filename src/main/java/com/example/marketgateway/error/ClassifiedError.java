package com.example.marketgateway.error;

import lombok.Value;
import org.springframework.http.HttpStatus;

@Value
public class ClassifiedError {

    ErrorKind kind;
    String message;

    public HttpStatus getStatus() {
        return kind.getStatus();
    }
}
