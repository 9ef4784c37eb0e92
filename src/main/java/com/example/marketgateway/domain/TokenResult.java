package com.example.marketgateway.domain;

import lombok.Value;

import java.util.List;

/**
 * 토큰 조회 응답 {result, count}
 */
@Value
public class TokenResult<T> {

    T result;
    int count;

    public static <T> TokenResult<T> of(T result) {
        return new TokenResult<>(result, 1);
    }

    public static <T> TokenResult<T> none() {
        return new TokenResult<>(null, 0);
    }

    public static <E> TokenResult<List<E>> list(List<E> items) {
        return new TokenResult<>(items, items.size());
    }
}
