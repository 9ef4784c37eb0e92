package com.example.marketgateway.service;

import com.example.marketgateway.config.GatewayProperties;
import com.example.marketgateway.domain.SecurityTokenDetails;
import com.example.marketgateway.domain.SecurityTokenSymbol;
import com.example.marketgateway.domain.TokenResult;
import com.example.marketgateway.repository.SecurityTokenRepository;
import com.example.marketgateway.request.TokenSymbolLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SecurityTokenService 테스트")
class SecurityTokenServiceTest {

    @Mock
    private SecurityTokenRepository repository;

    private final GatewayProperties properties = new GatewayProperties();

    private SecurityTokenService service;

    @BeforeEach
    void setUp() {
        service = new SecurityTokenService(repository, properties);
    }

    @Test
    @DisplayName("토큰이 있으면 count=1")
    void details_present() {
        SecurityTokenDetails details = SecurityTokenDetails.builder().tokenSymbol("BCAP").build();
        when(repository.findByTokenSymbol("BCAP")).thenReturn(Optional.of(details));

        TokenResult<SecurityTokenDetails> result = service.getTokenDetails(new TokenSymbolLookup("BCAP"));

        assertThat(result.getResult()).isSameAs(details);
        assertThat(result.getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("토큰이 없으면 result=null, count=0")
    void details_absent() {
        when(repository.findByTokenSymbol("NONE")).thenReturn(Optional.empty());

        TokenResult<SecurityTokenDetails> result = service.getTokenDetails(new TokenSymbolLookup("NONE"));

        assertThat(result.getResult()).isNull();
        assertThat(result.getCount()).isZero();
    }

    @Test
    @DisplayName("토큰 목록과 개수")
    void symbols_withCount() {
        when(repository.findAllSymbols()).thenReturn(List.of(
                new SecurityTokenSymbol("Aspen Digital", "ASPD"),
                new SecurityTokenSymbol("Blockchain Capital", "BCAP")));

        TokenResult<List<SecurityTokenSymbol>> result = service.getAllTokenSymbols();

        assertThat(result.getCount()).isEqualTo(2);
        assertThat(result.getResult()).extracting(SecurityTokenSymbol::getTokenSymbol).containsExactly("ASPD", "BCAP");
    }

    @Test
    @DisplayName("기본 설정: DB 장애는 전파한다")
    void failure_propagatesByDefault() {
        when(repository.findByTokenSymbol("BCAP")).thenThrow(new CannotGetJdbcConnectionException("pool exhausted"));
        when(repository.findAllSymbols()).thenThrow(new CannotGetJdbcConnectionException("pool exhausted"));

        assertThatThrownBy(() -> service.getTokenDetails(new TokenSymbolLookup("BCAP")))
                .isInstanceOf(CannotGetJdbcConnectionException.class);
        assertThatThrownBy(() -> service.getAllTokenSymbols())
                .isInstanceOf(CannotGetJdbcConnectionException.class);
    }

    @Test
    @DisplayName("degrade 설정: DB 장애 시 빈 결과")
    void failure_degradesWhenConfigured() {
        properties.getTokens().setDegradeOnFailure(true);
        when(repository.findByTokenSymbol("BCAP")).thenThrow(new CannotGetJdbcConnectionException("pool exhausted"));
        when(repository.findAllSymbols()).thenThrow(new CannotGetJdbcConnectionException("pool exhausted"));

        TokenResult<SecurityTokenDetails> details = service.getTokenDetails(new TokenSymbolLookup("BCAP"));
        TokenResult<List<SecurityTokenSymbol>> symbols = service.getAllTokenSymbols();

        assertThat(details.getResult()).isNull();
        assertThat(details.getCount()).isZero();
        assertThat(symbols.getResult()).isEmpty();
        assertThat(symbols.getCount()).isZero();
    }
}
