package com.example.marketgateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * 심볼 상세 정보
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolDetails implements Serializable {

    private String symbol;
    private String name;
    private Double price;
    private Double change;
    private Double volume24h;
    private Double circulatingSupply;
    private Instant time;
    private List<String> exchanges;  // 심볼이 거래되는 거래소 목록
}
