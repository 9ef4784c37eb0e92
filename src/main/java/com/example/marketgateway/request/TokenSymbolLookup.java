package com.example.marketgateway.request;

import lombok.Value;

@Value
public class TokenSymbolLookup {

    String tokenSymbol;
}
