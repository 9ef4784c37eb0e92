package com.example.marketgateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 필터 차트 시계열
 * exchange가 null이면 전체 거래소 집계
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterPoints {

    private String filter;
    private String exchange;
    private String symbol;
    private Scale scale;
    private List<FilterPoint> points;
}
