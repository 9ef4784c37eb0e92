package com.example.marketgateway.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 차트 시간 버킷
 */
public enum Scale {

    FIVE_MINUTES("5m"),
    THIRTY_MINUTES("30m"),
    ONE_HOUR("1h"),
    FOUR_HOURS("4h"),
    ONE_DAY("1d"),
    ONE_WEEK("1w");

    private final String token;

    Scale(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /**
     * 토큰 정확히 일치하는 경우만 (대소문자 구분)
     */
    public static Optional<Scale> fromToken(String token) {
        return Arrays.stream(values())
                .filter(scale -> scale.token.equals(token))
                .findFirst();
    }

    public static List<String> tokens() {
        return Arrays.stream(values()).map(Scale::token).toList();
    }
}
