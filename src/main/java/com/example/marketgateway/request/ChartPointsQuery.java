package com.example.marketgateway.request;

import com.example.marketgateway.domain.Scale;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * 차트 포인트 조회 키 (filter, exchange 또는 전체, symbol, scale)
 * exchange 없음 = 전체 거래소 집계 (별도 조회)
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChartPointsQuery {

    String filter;
    String exchange;
    String symbol;
    Scale scale;

    public static ChartPointsQuery forExchange(String filter, String exchange, String symbol, Scale scale) {
        return new ChartPointsQuery(filter, exchange, symbol, scale);
    }

    public static ChartPointsQuery allExchanges(String filter, String symbol, Scale scale) {
        return new ChartPointsQuery(filter, null, symbol, scale);
    }

    public boolean isAllExchanges() {
        return exchange == null;
    }

    public Optional<String> exchange() {
        return Optional.ofNullable(exchange);
    }
}
