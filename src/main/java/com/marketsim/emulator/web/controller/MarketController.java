package com.marketsim.emulator.web.controller;

import com.marketsim.emulator.core.execution.FillMetrics;
import com.marketsim.emulator.core.execution.OrderEstimate;
import com.marketsim.emulator.core.model.Candle;
import com.marketsim.emulator.core.model.CandleInterval;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.TickSnapshot;
import com.marketsim.emulator.core.query.MarketQueryService;
import com.marketsim.emulator.core.query.RegimeStatus;
import com.marketsim.emulator.web.dto.OrderBookDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
public class MarketController {

    private final MarketQueryService queryService;

    @GetMapping("/prices")
    public List<TickSnapshot> getPrices() {
        List<TickSnapshot> prices = queryService.prices();
        log.debug("REST GetPrices: {} instruments", prices.size());
        return prices;
    }

    @GetMapping("/prices/{ticker}")
    public ResponseEntity<TickSnapshot> getPrice(@PathVariable String ticker) {
        log.debug("REST GetPrice: ticker={}", ticker);
        return queryService.price(ticker)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/candles/{ticker}")
    public ResponseEntity<List<Candle>> getCandles(@PathVariable String ticker,
                                                   @RequestParam(defaultValue = "1m") String interval,
                                                   @RequestParam(defaultValue = "100") int limit) {
        log.debug("REST GetCandles: ticker={}, interval={}, limit={}", ticker, interval, limit);
        CandleInterval candleInterval;
        try {
            candleInterval = CandleInterval.fromSuffix(interval);
        } catch (IllegalArgumentException e) {
            log.warn("REST GetCandles: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
        if (limit <= 0) {
            return ResponseEntity.badRequest().build();
        }
        return queryService.candles(ticker, candleInterval, limit)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/regime")
    public RegimeStatus getRegime() {
        return queryService.regime();
    }

    @GetMapping("/orderbook/{ticker}")
    public ResponseEntity<OrderBookDto> getOrderBook(@PathVariable String ticker) {
        log.debug("REST GetOrderBook: ticker={}", ticker);
        return queryService.orderBook(ticker)
                .map(book -> ResponseEntity.ok(OrderBookDto.from(book)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/estimate")
    public ResponseEntity<OrderEstimate> estimate(@RequestParam String ticker,
                                                  @RequestParam OrderSide side,
                                                  @RequestParam long qty,
                                                  @RequestParam(required = false) String userId) {
        log.debug("REST Estimate: {} {} x{} user={}", side, ticker, qty, userId);
        if (qty <= 0) {
            return ResponseEntity.badRequest().build();
        }
        return queryService.estimate(userId, ticker, side, qty)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/execution-metrics")
    public FillMetrics getExecutionMetrics(@RequestParam(defaultValue = "300000") long windowMs) {
        return queryService.executionMetrics(windowMs);
    }
}
