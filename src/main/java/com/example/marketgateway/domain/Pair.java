package com.example.marketgateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 거래소별 거래쌍
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pair implements Serializable {

    private String symbol;
    private String foreignName;  // 거래소 표기 (BTCUSDT 등)
    private String exchange;
    private boolean ignore;
}
