package com.example.marketgateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 차트 포인트 한 개 (시간 버킷의 집계값)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterPoint implements Serializable {

    private Instant time;
    private Double value;
}
