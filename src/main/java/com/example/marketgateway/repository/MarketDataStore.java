package com.example.marketgateway.repository;

import com.example.marketgateway.domain.Coin;
import com.example.marketgateway.domain.FilterPoint;
import com.example.marketgateway.domain.Pair;
import com.example.marketgateway.domain.Quotation;
import com.example.marketgateway.domain.Supply;
import com.example.marketgateway.domain.SymbolDetails;
import com.example.marketgateway.request.ChartPointsQuery;

import java.util.List;
import java.util.Optional;

/**
 * 1차 저장소 (시세/공급량/차트 데이터)
 * 키 부재는 Optional.empty()로, 그 외 실패는 런타임 예외로 알린다
 */
public interface MarketDataStore {

    Optional<Quotation> findQuotation(String symbol);

    Optional<Supply> findSupply(String symbol);

    void saveSupply(Supply supply);

    Optional<SymbolDetails> findSymbolDetails(String symbol);

    List<Pair> findPairs();

    List<Coin> findCoins();

    List<String> findAllSymbols();

    /**
     * @param limit 최신 포인트 기준 최대 개수
     * @return 시간 오름차순 포인트
     */
    List<FilterPoint> findFilterPoints(ChartPointsQuery query, int limit);
}
