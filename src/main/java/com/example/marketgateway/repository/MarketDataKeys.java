package com.example.marketgateway.repository;

import com.example.marketgateway.request.ChartPointsQuery;

/**
 * Redis 키 규칙
 * 차트 키는 거래소 지정/전체 집계가 서로 다른 네임스페이스를 쓴다
 */
final class MarketDataKeys {

    static final String PAIRS = "dia_pairs";
    static final String COINS = "dia_coins";
    static final String SYMBOLS = "dia_symbols";

    private static final String QUOTATION_PREFIX = "dia_quotation_";
    private static final String SUPPLY_PREFIX = "dia_supply_";
    private static final String SYMBOL_DETAILS_PREFIX = "dia_symbol_details_";
    private static final String FILTER_EXCHANGE_PREFIX = "dia_filter_points:exchange:";
    private static final String FILTER_AGGREGATE_PREFIX = "dia_filter_points:aggregate:";

    private MarketDataKeys() {
    }

    static String quotation(String symbol) {
        return QUOTATION_PREFIX + symbol;
    }

    static String supply(String symbol) {
        return SUPPLY_PREFIX + symbol;
    }

    static String symbolDetails(String symbol) {
        return SYMBOL_DETAILS_PREFIX + symbol;
    }

    static String filterPoints(ChartPointsQuery query) {
        String suffix = query.getFilter() + ":" + query.getSymbol() + ":" + query.getScale().token();
        if (query.isAllExchanges()) {
            return FILTER_AGGREGATE_PREFIX + suffix;
        }
        return FILTER_EXCHANGE_PREFIX + query.getExchange() + ":" + suffix;
    }
}
