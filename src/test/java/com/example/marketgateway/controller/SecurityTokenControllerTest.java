package com.example.marketgateway.controller;

import com.example.marketgateway.config.GatewayProperties;
import com.example.marketgateway.domain.SecurityTokenDetails;
import com.example.marketgateway.domain.SecurityTokenSymbol;
import com.example.marketgateway.domain.TokenResult;
import com.example.marketgateway.error.ErrorClassifier;
import com.example.marketgateway.request.RequestParameters;
import com.example.marketgateway.request.ScaleResolver;
import com.example.marketgateway.request.TokenSymbolLookup;
import com.example.marketgateway.service.SecurityTokenService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SecurityTokenController.class)
@Import({ResponseFormatter.class, ErrorClassifier.class,
        RequestParameters.class, ScaleResolver.class, GatewayProperties.class})
@DisplayName("SecurityTokenController 테스트")
class SecurityTokenControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SecurityTokenService securityTokenService;

    @Test
    @DisplayName("토큰 상세 → {result, count:1}")
    void getTokenDetails_found() throws Exception {
        when(securityTokenService.getTokenDetails(new TokenSymbolLookup("BCAP"))).thenReturn(TokenResult.of(
                SecurityTokenDetails.builder().tokenSymbol("BCAP").tokenName("Blockchain Capital").build()));

        mockMvc.perform(get("/v1/securityTokens/BCAP"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.result.tokenName").value("Blockchain Capital"));
    }

    @Test
    @DisplayName("없는 토큰 → 200 {result:null, count:0}")
    void getTokenDetails_absent() throws Exception {
        when(securityTokenService.getTokenDetails(new TokenSymbolLookup("NONE"))).thenReturn(TokenResult.none());

        mockMvc.perform(get("/v1/securityTokens/NONE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0))
                .andExpect(jsonPath("$.result").isEmpty());
    }

    @Test
    @DisplayName("토큰 목록 → {result, count}")
    void getAllTokenSymbols() throws Exception {
        when(securityTokenService.getAllTokenSymbols()).thenReturn(TokenResult.list(List.of(
                new SecurityTokenSymbol("Aspen Digital", "ASPD"))));

        mockMvc.perform(get("/v1/securityTokens"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.result[0].tokenSymbol").value("ASPD"));
    }

    @Test
    @DisplayName("DB 장애가 전파되면 500")
    void getAllTokenSymbols_failure() throws Exception {
        when(securityTokenService.getAllTokenSymbols()).thenThrow(new CannotGetJdbcConnectionException("timeout"));

        mockMvc.perform(get("/v1/securityTokens"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value(500));
    }
}
