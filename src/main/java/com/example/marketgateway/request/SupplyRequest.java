package com.example.marketgateway.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 공급량 등록 요청 본문
 * 클라이언트가 time/name을 보내도 읽지 않는다
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupplyRequest {

    private String symbol;
    private Double circulatingSupply;
    private String source;
}
