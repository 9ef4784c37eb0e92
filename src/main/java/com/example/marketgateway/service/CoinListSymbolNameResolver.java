package com.example.marketgateway.service;

import com.example.marketgateway.domain.Coin;
import com.example.marketgateway.error.StoreException;
import com.example.marketgateway.repository.MarketDataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 1차 저장소의 코인 목록에서 이름을 찾고, 없으면 심볼을 그대로 쓴다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoinListSymbolNameResolver implements SymbolNameResolver {

    private final MarketDataStore store;

    @Override
    public String nameFor(String symbol) {
        try {
            return store.findCoins().stream()
                    .filter(coin -> symbol.equals(coin.getSymbol()))
                    .map(Coin::getName)
                    .filter(StringUtils::hasText)
                    .findFirst()
                    .orElse(symbol);
        } catch (DataAccessException | StoreException e) {
            log.warn("[이름 조회 실패] 심볼을 이름으로 사용 - symbol={}, cause={}", symbol, e.toString());
            return symbol;
        }
    }
}
