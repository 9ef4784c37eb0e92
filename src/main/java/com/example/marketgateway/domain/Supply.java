package com.example.marketgateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 유통 공급량 레코드
 * time, name은 게이트웨이가 채운다 (클라이언트 값은 받지 않음)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Supply implements Serializable {

    private String symbol;             // 심볼 (BTC, ETH 등)
    private String name;               // 표시 이름
    private String source;             // 데이터 출처
    private Double circulatingSupply;  // 유통 공급량
    private Instant time;              // 수집 시각
}
