package com.example.marketgateway.controller;

import com.example.marketgateway.domain.Coins;
import com.example.marketgateway.domain.FilterPoints;
import com.example.marketgateway.domain.Pairs;
import com.example.marketgateway.domain.Quotation;
import com.example.marketgateway.domain.Supply;
import com.example.marketgateway.domain.SymbolDetails;
import com.example.marketgateway.domain.Symbols;
import com.example.marketgateway.request.RequestParameters;
import com.example.marketgateway.service.MarketDataService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 시세/공급량/차트 API 컨트롤러
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class MarketDataController {

    private final MarketDataService marketDataService;
    private final RequestParameters requestParameters;
    private final ResponseFormatter responseFormatter;

    @PostMapping(value = "/supply", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Supply> postSupply(@RequestBody byte[] body) {
        return responseFormatter.ok(marketDataService.submitSupply(requestParameters.supply(body)));
    }

    @GetMapping("/quotation/{symbol}")
    public ResponseEntity<Quotation> getQuotation(@PathVariable("symbol") String symbol) {
        return responseFormatter.ok(marketDataService.getQuotation(requestParameters.symbol(symbol)));
    }

    @GetMapping("/supply/{symbol}")
    public ResponseEntity<Supply> getSupply(@PathVariable("symbol") String symbol) {
        return responseFormatter.ok(marketDataService.getSupply(requestParameters.symbol(symbol)));
    }

    @GetMapping("/pairs")
    public ResponseEntity<Pairs> getPairs() {
        return responseFormatter.ok(marketDataService.getPairs());
    }

    @GetMapping("/symbol/{symbol}")
    public ResponseEntity<SymbolDetails> getSymbolDetails(@PathVariable("symbol") String symbol) {
        return responseFormatter.ok(marketDataService.getSymbolDetails(requestParameters.symbol(symbol)));
    }

    @GetMapping("/coins")
    public ResponseEntity<Coins> getCoins() {
        return responseFormatter.ok(marketDataService.getCoins());
    }

    @GetMapping("/chartPoints/{filter}/{exchange}/{symbol}")
    public ResponseEntity<FilterPoints> getChartPoints(@PathVariable("filter") String filter,
                                                       @PathVariable("exchange") String exchange,
                                                       @PathVariable("symbol") String symbol,
                                                       @RequestParam(name = "scale", required = false) String scale) {
        return responseFormatter.ok(marketDataService.getFilterPoints(
                requestParameters.chartPoints(filter, exchange, symbol, scale)));
    }

    @GetMapping("/chartPointsAllExchanges/{filter}/{symbol}")
    public ResponseEntity<FilterPoints> getChartPointsAllExchanges(@PathVariable("filter") String filter,
                                                                   @PathVariable("symbol") String symbol,
                                                                   @RequestParam(name = "scale", required = false) String scale) {
        return responseFormatter.ok(marketDataService.getFilterPoints(
                requestParameters.chartPointsAllExchanges(filter, symbol, scale)));
    }

    @GetMapping("/symbols")
    public ResponseEntity<Symbols> getAllSymbols() {
        return responseFormatter.ok(marketDataService.getAllSymbols());
    }
}
