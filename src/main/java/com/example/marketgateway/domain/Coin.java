package com.example.marketgateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Coin implements Serializable {

    private String symbol;
    private String name;
    private Double price;
    private Double priceYesterday;
    private Double volumeYesterdayUSD;
    private Double circulatingSupply;
    private Instant time;
}
