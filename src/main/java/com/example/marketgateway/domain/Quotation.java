package com.example.marketgateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 코인 시세 정보
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Quotation implements Serializable {

    private String symbol;
    private String name;
    private Double price;
    private Double priceYesterday;
    private Double volumeYesterdayUSD;
    private String source;
    private Instant time;
    private String itin;
}
