package com.example.marketgateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 증권형 토큰(STO) 참조 정보
 * 관계형 참조 DB의 SecurityTokens 한 행
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecurityTokenDetails {

    private String tokenName;
    private String tokenStatus;
    private String tokenSymbol;
    private String industry;
    private String amountRaised;
    private String currency;
    private String issuancePrice;
    private String minInvest;
    private String closingDate;
    private String targetInvestorType;
    private String jurisdictionsAvail;
    private String restrictedArea;
    private String secondaryMarket;
    private String website;
    private String whitepaper;
    private String prospectus;
    private String smartContract;
    private String github;
    private String blockchain;
    private String issuerAddress;
    private String tokenUsed;
    private String dividend;
    private String voting;
    private String equityOwnership;
    private String mmeClass;
    private String interest;
    private String portfolio;
}
