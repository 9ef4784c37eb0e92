package com.example.marketgateway.controller;

import com.example.marketgateway.domain.SecurityTokenDetails;
import com.example.marketgateway.domain.SecurityTokenSymbol;
import com.example.marketgateway.domain.TokenResult;
import com.example.marketgateway.request.RequestParameters;
import com.example.marketgateway.service.SecurityTokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 증권형 토큰 참조 API 컨트롤러
 */
@RestController
@RequestMapping("/v1/securityTokens")
@RequiredArgsConstructor
public class SecurityTokenController {

    private final SecurityTokenService securityTokenService;
    private final RequestParameters requestParameters;
    private final ResponseFormatter responseFormatter;

    @GetMapping
    public ResponseEntity<TokenResult<List<SecurityTokenSymbol>>> getAllTokenSymbols() {
        return responseFormatter.ok(securityTokenService.getAllTokenSymbols());
    }

    @GetMapping("/{tokenSymbol}")
    public ResponseEntity<TokenResult<SecurityTokenDetails>> getTokenDetails(
            @PathVariable("tokenSymbol") String tokenSymbol) {
        return responseFormatter.ok(securityTokenService.getTokenDetails(requestParameters.tokenSymbol(tokenSymbol)));
    }
}
