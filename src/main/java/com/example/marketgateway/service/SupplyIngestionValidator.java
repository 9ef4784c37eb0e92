package com.example.marketgateway.service;

import com.example.marketgateway.config.GatewayProperties;
import com.example.marketgateway.domain.Supply;
import com.example.marketgateway.error.GatewayException;
import com.example.marketgateway.request.SupplyRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;

/**
 * 공급량 등록 요청 검증 + 기본값 적용
 * - 필수: symbol, circulatingSupply (0 불가)
 * - 기본값: source(플랫폼 기본 출처), time(수신 시각), name(심볼 이름 조회)
 */
@Component
@RequiredArgsConstructor
public class SupplyIngestionValidator {

    static final String MISSING_FIELDS = "Missing Symbol or CirculatingSupply value";

    private final SymbolNameResolver nameResolver;
    private final IngestionAuditLog auditLog;
    private final GatewayProperties properties;
    private final Clock clock;

    public Supply validate(SupplyRequest request) {
        if (!isComplete(request)) {
            auditLog.rejected(request);
            throw GatewayException.validation(MISSING_FIELDS);
        }
        auditLog.received(request);

        String source = StringUtils.hasText(request.getSource())
                ? request.getSource()
                : properties.getSupply().getDefaultSource();

        return Supply.builder()
                .time(Instant.now(clock))
                .name(nameResolver.nameFor(request.getSymbol()))
                .symbol(request.getSymbol())
                .source(source)
                .circulatingSupply(request.getCirculatingSupply())
                .build();
    }

    private boolean isComplete(SupplyRequest request) {
        return request != null
                && StringUtils.hasText(request.getSymbol())
                && request.getCirculatingSupply() != null
                && request.getCirculatingSupply() != 0.0d;
    }
}
