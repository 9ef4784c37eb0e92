package com.example.marketgateway.service;

import com.example.marketgateway.request.SupplyRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 수신/거부된 공급량 요청 기록 (거부 시 전체 payload)
 */
@Slf4j
@Component
public class IngestionAuditLog {

    public void received(SupplyRequest request) {
        log.info("[공급량 수신] payload={}", request);
    }

    public void rejected(SupplyRequest request) {
        log.error("[공급량 거부] payload={}", request);
    }
}
