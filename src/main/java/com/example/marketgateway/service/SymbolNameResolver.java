package com.example.marketgateway.service;

/**
 * 심볼 → 표시 이름
 */
public interface SymbolNameResolver {

    String nameFor(String symbol);
}
