package com.example.marketgateway.service;

import com.example.marketgateway.config.GatewayProperties;
import com.example.marketgateway.domain.SecurityTokenDetails;
import com.example.marketgateway.domain.SecurityTokenSymbol;
import com.example.marketgateway.domain.TokenResult;
import com.example.marketgateway.repository.SecurityTokenRepository;
import com.example.marketgateway.request.TokenSymbolLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 증권형 토큰 참조 조회 (2차 저장소)
 * 행이 없으면 {result: null, count: 0}
 * gateway.tokens.degrade-on-failure=true 이면 DB 장애도 빈 결과로 응답 (로그만 남김)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityTokenService {

    private final SecurityTokenRepository repository;
    private final GatewayProperties properties;

    public TokenResult<SecurityTokenDetails> getTokenDetails(TokenSymbolLookup lookup) {
        try {
            return repository.findByTokenSymbol(lookup.getTokenSymbol())
                    .map(TokenResult::of)
                    .orElseGet(TokenResult::none);
        } catch (DataAccessException e) {
            if (!properties.getTokens().isDegradeOnFailure()) {
                throw e;
            }
            log.error("[토큰 조회 실패] 빈 결과로 응답 - tokenSymbol={}", lookup.getTokenSymbol(), e);
            return TokenResult.none();
        }
    }

    public TokenResult<List<SecurityTokenSymbol>> getAllTokenSymbols() {
        try {
            return TokenResult.list(repository.findAllSymbols());
        } catch (DataAccessException e) {
            if (!properties.getTokens().isDegradeOnFailure()) {
                throw e;
            }
            log.error("[토큰 목록 조회 실패] 빈 결과로 응답", e);
            return TokenResult.list(List.of());
        }
    }
}
