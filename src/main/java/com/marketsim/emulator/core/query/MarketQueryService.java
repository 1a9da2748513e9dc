package com.marketsim.emulator.core.query;

import com.marketsim.emulator.core.execution.ExecutionCostModel;
import com.marketsim.emulator.core.execution.FillMetrics;
import com.marketsim.emulator.core.execution.FillMetricsTracker;
import com.marketsim.emulator.core.execution.OrderEstimate;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.Candle;
import com.marketsim.emulator.core.model.CandleInterval;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.OrderBook;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeRecord;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.model.TickSnapshot;
import com.marketsim.emulator.core.orderbook.OrderBookSimulator;
import com.marketsim.emulator.core.price.CandleAggregator;
import com.marketsim.emulator.core.price.MacroFactorProcess;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.price.StochasticPriceProcess;
import com.marketsim.emulator.core.regime.RegimeController;
import com.marketsim.emulator.core.store.ExchangeStore;
import com.marketsim.emulator.core.store.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view over live market state for the REST layer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketQueryService {

    public static final int MAX_CANDLES = 1000;

    private final InstrumentCatalog catalog;
    private final PriceStateStore priceStates;
    private final StochasticPriceProcess priceProcess;
    private final CandleAggregator candleAggregator;
    private final MacroFactorProcess macroFactors;
    private final RegimeController regimeController;
    private final ExecutionCostModel costModel;
    private final FillMetricsTracker fillMetrics;
    private final OrderBookSimulator orderBookSimulator;
    private final ExchangeStore store;
    private final Clock clock;

    public List<TickSnapshot> prices() {
        RegimeType regime = regimeController.current();
        Instant now = clock.instant();
        List<TickSnapshot> snapshots = new ArrayList<>();
        for (String ticker : catalog.tickers()) {
            priceProcess.snapshot(ticker, regime, now).ifPresent(snapshots::add);
        }
        return snapshots;
    }

    public Optional<TickSnapshot> price(String ticker) {
        return priceProcess.snapshot(ticker, regimeController.current(), clock.instant());
    }

    /**
     * Stored bars plus the bar still being built, oldest first, at most {@code limit}.
     *
     * @return empty if the ticker is unknown
     */
    public Optional<List<Candle>> candles(String ticker, CandleInterval interval, int limit) {
        if (!catalog.contains(ticker)) {
            return Optional.empty();
        }
        int bounded = Math.max(1, Math.min(limit, MAX_CANDLES));
        List<Candle> candles;
        try {
            candles = new ArrayList<>(store.findCandles(ticker, interval, bounded));
        } catch (StorageUnavailableException e) {
            log.warn("Candle history for {} unavailable: {}", ticker, e.getMessage());
            candles = new ArrayList<>();
        }
        Optional<Candle> open = candleAggregator.current(ticker, interval);
        if (open.isPresent()) {
            Candle current = open.get();
            if (!candles.isEmpty() && candles.get(candles.size() - 1).getOpenTime() == current.getOpenTime()) {
                candles.set(candles.size() - 1, current);
            } else {
                candles.add(current);
            }
        }
        if (candles.size() > bounded) {
            candles = new ArrayList<>(candles.subList(candles.size() - bounded, candles.size()));
        }
        return Optional.of(candles);
    }

    public RegimeStatus regime() {
        RegimeRecord record = regimeController.currentRecord();
        RegimeType regime = record.getRegime();
        return RegimeStatus.builder()
                .regime(regime)
                .since(record.getStartedAt())
                .reason(record.getReason())
                .liquidityMultiplier(regime.getLiquidityMultiplier())
                .volatilityMultiplier(regime.getVolatilityMultiplier())
                .newsMultiplier(regime.getNewsMultiplier())
                .borrowMultiplier(regime.getBorrowMultiplier())
                .shockHoldUntil(regimeController.getShockHoldUntil())
                .nextReviewAt(regimeController.getNextReviewAt())
                .factors(macroFactors.current().asMap())
                .build();
    }

    public Optional<OrderBook> orderBook(String ticker) {
        return orderBookSimulator.generate(ticker);
    }

    /**
     * Pre-trade cost of a market order at the current touch. For sells, the part of
     * {@code qty} beyond the user's long holding is priced as opening a short.
     *
     * @param userId may be null, in which case a sell is treated as fully opening a short
     * @return empty if the ticker is unknown or not priced yet
     */
    public Optional<OrderEstimate> estimate(String userId, String ticker, OrderSide side, long qty) {
        if (qty <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        Optional<InstrumentDefinition> def = catalog.find(ticker);
        Optional<PriceState> state = priceStates.get(ticker);
        if (def.isEmpty() || state.isEmpty()) {
            return Optional.empty();
        }
        RegimeType regime = regimeController.current();
        PriceState s = state.get();
        double reference = side == OrderSide.BUY ? s.getAsk() : s.getBid();
        double volatility = priceProcess.effectiveVolatility(def.get(), s.getVolatility(), regime, clock.instant());
        long openedShort = side == OrderSide.SELL ? qty - Math.min(qty, longHolding(userId, ticker)) : 0;
        return Optional.of(costModel.estimateOrder(def.get(), side, qty, reference, s.getMid(), volatility,
                regime, openedShort));
    }

    public FillMetrics executionMetrics(long windowMs) {
        return fillMetrics.recentMetrics(windowMs);
    }

    private long longHolding(String userId, String ticker) {
        if (userId == null) {
            return 0;
        }
        return store.findPositions(userId).stream()
                .filter(p -> p.getTicker().equals(ticker))
                .mapToLong(Position::getQuantity)
                .filter(q -> q > 0)
                .findFirst()
                .orElse(0);
    }
}
