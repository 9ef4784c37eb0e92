package com.example.marketgateway.repository;

import com.example.marketgateway.domain.SecurityTokenDetails;
import com.example.marketgateway.domain.SecurityTokenSymbol;

import java.util.List;
import java.util.Optional;

/**
 * 2차 저장소 (관계형 참조 DB의 증권형 토큰 정보)
 */
public interface SecurityTokenRepository {

    Optional<SecurityTokenDetails> findByTokenSymbol(String tokenSymbol);

    List<SecurityTokenSymbol> findAllSymbols();
}
