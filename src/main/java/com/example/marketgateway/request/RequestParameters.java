package com.example.marketgateway.request;

import com.example.marketgateway.error.GatewayException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 경로/쿼리 파라미터와 요청 본문을 타입이 있는 요청 객체로 변환
 * 대소문자 변환이나 별칭 해석은 하지 않는다
 */
@Component
@RequiredArgsConstructor
public class RequestParameters {

    static final String UNREADABLE_SUPPLY = "Supply payload is not valid JSON";

    private final ScaleResolver scaleResolver;
    private final ObjectMapper objectMapper;

    /**
     * Content-Type과 무관하게 본문을 JSON으로 읽는다
     */
    public SupplyRequest supply(byte[] rawBody) {
        SupplyRequest request;
        try {
            request = objectMapper.readValue(rawBody, SupplyRequest.class);
        } catch (IOException e) {
            throw GatewayException.validation(UNREADABLE_SUPPLY);
        }
        if (request == null) {
            throw GatewayException.validation(UNREADABLE_SUPPLY);
        }
        return request;
    }

    public SymbolLookup symbol(String rawSymbol) {
        return new SymbolLookup(required("symbol", rawSymbol));
    }

    public TokenSymbolLookup tokenSymbol(String rawTokenSymbol) {
        return new TokenSymbolLookup(required("token symbol", rawTokenSymbol));
    }

    /**
     * exchange가 빈 값이면 전체 거래소 조회로 처리
     */
    public ChartPointsQuery chartPoints(String rawFilter, String rawExchange, String rawSymbol, String rawScale) {
        if (isAbsent(rawExchange)) {
            return chartPointsAllExchanges(rawFilter, rawSymbol, rawScale);
        }
        return ChartPointsQuery.forExchange(
                required("filter", rawFilter),
                rawExchange,
                required("symbol", rawSymbol),
                scaleResolver.resolve(rawScale));
    }

    public ChartPointsQuery chartPointsAllExchanges(String rawFilter, String rawSymbol, String rawScale) {
        return ChartPointsQuery.allExchanges(
                required("filter", rawFilter),
                required("symbol", rawSymbol),
                scaleResolver.resolve(rawScale));
    }

    private String required(String name, String value) {
        if (isAbsent(value)) {
            throw GatewayException.validation("Missing " + name);
        }
        return value;
    }

    private boolean isAbsent(String value) {
        return value == null || value.isEmpty();
    }
}
