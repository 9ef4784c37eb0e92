package com.example.marketgateway.repository;

import com.example.marketgateway.domain.SecurityTokenDetails;
import com.example.marketgateway.domain.SecurityTokenSymbol;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JdbcTemplate 기반 참조 DB 조회
 * 커넥션은 공유 풀(HikariCP)에서 쿼리마다 빌리고 반납한다
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcSecurityTokenRepository implements SecurityTokenRepository {

    private static final String DETAILS_SQL = """
            SELECT token_name, token_status, token_symbol, industry, amount_raised, currency, issuance_price,
                   min_invest, closing_date, target_investor_type, jurisdictions_avail, restricted_area,
                   secondary_market, website, whitepaper, prospectus, smart_contract, github, blockchain,
                   issuer_address, token_used, dividend, voting, equity_ownership, mme_class, interest, portfolio
            FROM SecurityTokens
            WHERE token_symbol = ?
            """;

    private static final String SYMBOLS_SQL = """
            SELECT token_name, token_symbol
            FROM SecurityTokens
            ORDER BY token_symbol
            """;

    private static final RowMapper<SecurityTokenDetails> DETAILS_MAPPER = (rs, rowNum) -> SecurityTokenDetails.builder()
            .tokenName(rs.getString("token_name"))
            .tokenStatus(rs.getString("token_status"))
            .tokenSymbol(rs.getString("token_symbol"))
            .industry(rs.getString("industry"))
            .amountRaised(rs.getString("amount_raised"))
            .currency(rs.getString("currency"))
            .issuancePrice(rs.getString("issuance_price"))
            .minInvest(rs.getString("min_invest"))
            .closingDate(rs.getString("closing_date"))
            .targetInvestorType(rs.getString("target_investor_type"))
            .jurisdictionsAvail(rs.getString("jurisdictions_avail"))
            .restrictedArea(rs.getString("restricted_area"))
            .secondaryMarket(rs.getString("secondary_market"))
            .website(rs.getString("website"))
            .whitepaper(rs.getString("whitepaper"))
            .prospectus(rs.getString("prospectus"))
            .smartContract(rs.getString("smart_contract"))
            .github(rs.getString("github"))
            .blockchain(rs.getString("blockchain"))
            .issuerAddress(rs.getString("issuer_address"))
            .tokenUsed(rs.getString("token_used"))
            .dividend(rs.getString("dividend"))
            .voting(rs.getString("voting"))
            .equityOwnership(rs.getString("equity_ownership"))
            .mmeClass(rs.getString("mme_class"))
            .interest(rs.getString("interest"))
            .portfolio(rs.getString("portfolio"))
            .build();

    private static final RowMapper<SecurityTokenSymbol> SYMBOL_MAPPER = (rs, rowNum) -> SecurityTokenSymbol.builder()
            .tokenName(rs.getString("token_name"))
            .tokenSymbol(rs.getString("token_symbol"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<SecurityTokenDetails> findByTokenSymbol(String tokenSymbol) {
        List<SecurityTokenDetails> rows = jdbcTemplate.query(DETAILS_SQL, DETAILS_MAPPER, tokenSymbol);
        if (rows.isEmpty()) {
            log.debug("[토큰 없음] tokenSymbol={}", tokenSymbol);
            return Optional.empty();
        }
        return Optional.of(rows.get(0));
    }

    @Override
    public List<SecurityTokenSymbol> findAllSymbols() {
        return jdbcTemplate.query(SYMBOLS_SQL, SYMBOL_MAPPER);
    }
}
