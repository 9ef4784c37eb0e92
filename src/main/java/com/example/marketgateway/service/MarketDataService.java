package com.example.marketgateway.service;

import com.example.marketgateway.config.GatewayProperties;
import com.example.marketgateway.domain.Coins;
import com.example.marketgateway.domain.FilterPoint;
import com.example.marketgateway.domain.FilterPoints;
import com.example.marketgateway.domain.Pairs;
import com.example.marketgateway.domain.Quotation;
import com.example.marketgateway.domain.Supply;
import com.example.marketgateway.domain.SymbolDetails;
import com.example.marketgateway.domain.Symbols;
import com.example.marketgateway.error.GatewayException;
import com.example.marketgateway.repository.MarketDataStore;
import com.example.marketgateway.request.ChartPointsQuery;
import com.example.marketgateway.request.SupplyRequest;
import com.example.marketgateway.request.SymbolLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 1차 저장소 조회/쓰기
 *
 * - 심볼 단건 조회: 키 부재 → NOT_FOUND
 * - 목록 조회: 빈 목록도 정상 (단, 전체 심볼 목록은 비어 있으면 INTERNAL_ERROR)
 * - 재시도 없음
 */
@Slf4j
@Service
public class MarketDataService {

    static final String NO_SYMBOLS = "cant find symbols";

    private final MarketDataStore store;
    private final SupplyIngestionValidator supplyValidator;
    private final int maxPoints;

    public MarketDataService(MarketDataStore store, SupplyIngestionValidator supplyValidator,
                             GatewayProperties properties) {
        int configured = properties.getChart().getMaxPoints();
        if (configured < 1) {
            throw new IllegalStateException("gateway.chart.max-points must be at least 1 but was " + configured);
        }
        this.store = store;
        this.supplyValidator = supplyValidator;
        this.maxPoints = configured;
    }

    public Supply submitSupply(SupplyRequest request) {
        Supply supply = supplyValidator.validate(request);
        store.saveSupply(supply);
        log.info("[공급량 저장] symbol={}, source={}", supply.getSymbol(), supply.getSource());
        return supply;
    }

    public Quotation getQuotation(SymbolLookup lookup) {
        return store.findQuotation(lookup.getSymbol())
                .orElseThrow(() -> GatewayException.notFound("Quotation not found: " + lookup.getSymbol()));
    }

    public Supply getSupply(SymbolLookup lookup) {
        return store.findSupply(lookup.getSymbol())
                .orElseThrow(() -> GatewayException.notFound("Supply not found: " + lookup.getSymbol()));
    }

    public SymbolDetails getSymbolDetails(SymbolLookup lookup) {
        return store.findSymbolDetails(lookup.getSymbol())
                .orElseThrow(() -> GatewayException.notFound("Symbol not found: " + lookup.getSymbol()));
    }

    public Pairs getPairs() {
        return new Pairs(store.findPairs());
    }

    public Coins getCoins() {
        return new Coins(store.findCoins());
    }

    public Symbols getAllSymbols() {
        List<String> symbols = store.findAllSymbols();
        if (symbols.isEmpty()) {
            throw GatewayException.internal(NO_SYMBOLS);
        }
        return new Symbols(symbols);
    }

    public FilterPoints getFilterPoints(ChartPointsQuery query) {
        List<FilterPoint> points = store.findFilterPoints(query, maxPoints);
        log.debug("[차트 조회] filter={}, exchange={}, symbol={}, scale={}, points={}",
                query.getFilter(), query.exchange().orElse("*"), query.getSymbol(), query.getScale().token(),
                points.size());
        return FilterPoints.builder()
                .filter(query.getFilter())
                .exchange(query.getExchange())
                .symbol(query.getSymbol())
                .scale(query.getScale())
                .points(points)
                .build();
    }
}
