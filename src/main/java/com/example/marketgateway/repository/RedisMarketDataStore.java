package com.example.marketgateway.repository;

import com.example.marketgateway.domain.Coin;
import com.example.marketgateway.domain.FilterPoint;
import com.example.marketgateway.domain.Pair;
import com.example.marketgateway.domain.Quotation;
import com.example.marketgateway.domain.Supply;
import com.example.marketgateway.domain.SymbolDetails;
import com.example.marketgateway.error.StoreException;
import com.example.marketgateway.request.ChartPointsQuery;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Redis 기반 1차 저장소
 * - 단건/목록: JSON 문자열 값
 * - 심볼 목록: Set
 * - 차트 포인트: Sorted Set (score = epoch millis, member = JSON 포인트)
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisMarketDataStore implements MarketDataStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<Quotation> findQuotation(String symbol) {
        return readValue(MarketDataKeys.quotation(symbol), Quotation.class);
    }

    @Override
    public Optional<Supply> findSupply(String symbol) {
        return readValue(MarketDataKeys.supply(symbol), Supply.class);
    }

    @Override
    public void saveSupply(Supply supply) {
        String key = MarketDataKeys.supply(supply.getSymbol());
        redisTemplate.opsForValue().set(key, encode(key, supply));
        log.debug("[공급량 저장] key={}", key);
    }

    @Override
    public Optional<SymbolDetails> findSymbolDetails(String symbol) {
        return readValue(MarketDataKeys.symbolDetails(symbol), SymbolDetails.class);
    }

    @Override
    public List<Pair> findPairs() {
        return readList(MarketDataKeys.PAIRS, Pair.class);
    }

    @Override
    public List<Coin> findCoins() {
        return readList(MarketDataKeys.COINS, Coin.class);
    }

    @Override
    public List<String> findAllSymbols() {
        Set<String> members = redisTemplate.opsForSet().members(MarketDataKeys.SYMBOLS);
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(new TreeSet<>(members));
    }

    @Override
    public List<FilterPoint> findFilterPoints(ChartPointsQuery query, int limit) {
        String key = MarketDataKeys.filterPoints(query);
        Set<String> newestFirst = redisTemplate.opsForZSet().reverseRange(key, 0, limit - 1L);
        if (newestFirst == null || newestFirst.isEmpty()) {
            log.debug("[차트 포인트 없음] key={}", key);
            return List.of();
        }
        List<FilterPoint> points = new ArrayList<>(newestFirst.size());
        for (String member : newestFirst) {
            points.add(decode(key, member, objectMapper.constructType(FilterPoint.class)));
        }
        Collections.reverse(points);
        return points;
    }

    private <T> Optional<T> readValue(String key, Class<T> type) {
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            log.debug("[키 없음] key={}", key);
            return Optional.empty();
        }
        return Optional.of(decode(key, json, objectMapper.constructType(type)));
    }

    private <T> List<T> readList(String key, Class<T> elementType) {
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            return List.of();
        }
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        return decode(key, json, listType);
    }

    private <T> T decode(String key, String json, JavaType type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot decode value at " + key, e);
        }
    }

    private String encode(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot encode value for " + key, e);
        }
    }
}
