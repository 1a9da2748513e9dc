package com.marketsim.emulator.core.matching;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.price.StochasticPriceProcess;
import com.marketsim.emulator.core.store.ExchangeStore;
import com.marketsim.emulator.core.store.LockContentionException;
import com.marketsim.emulator.core.support.RateLimitedLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Scans every working order once per tick and hands triggered ones to the {@link FillExecutor}.
 * A failure on one order never stops the scan.
 */
@Slf4j
@Service
public class OrderMatchingLoop {

    private final ExchangeStore store;
    private final InstrumentCatalog catalog;
    private final PriceStateStore priceStates;
    private final StochasticPriceProcess priceProcess;
    private final FillExecutor fillExecutor;
    private final RateLimitedLogger errorLog;

    public OrderMatchingLoop(ExchangeStore store, InstrumentCatalog catalog, PriceStateStore priceStates,
                             StochasticPriceProcess priceProcess, FillExecutor fillExecutor, Clock clock,
                             EmulatorProperties properties) {
        this.store = store;
        this.catalog = catalog;
        this.priceStates = priceStates;
        this.priceProcess = priceProcess;
        this.fillExecutor = fillExecutor;
        this.errorLog = new RateLimitedLogger(log, clock, properties.getEngine().getErrorLogIntervalMs());
    }

    /**
     * @return number of fills executed
     */
    public int matchAll(RegimeType regime, Instant now) {
        List<Order> openOrders = store.findOpenOrders();
        if (openOrders.isEmpty()) {
            return 0;
        }
        int fills = 0;
        for (Order order : openOrders) {
            InstrumentDefinition def = catalog.find(order.getTicker()).orElse(null);
            PriceState state = def == null ? null : priceStates.get(order.getTicker()).orElse(null);
            if (state == null) {
                log.debug("Skipping order {}: no market for {}", order.getId(), order.getTicker());
                continue;
            }
            MarketContext market = MarketContext.builder()
                    .instrument(def)
                    .price(state.getPrice())
                    .bid(state.getBid())
                    .ask(state.getAsk())
                    .volatility(priceProcess.effectiveVolatility(def, state.getVolatility(), regime, now))
                    .regime(regime)
                    .build();
            try {
                if (process(order, market)) {
                    fills++;
                }
            } catch (LockContentionException e) {
                log.debug("Order {} busy ({}), retrying next tick", order.getId(), e.getMessage());
            } catch (RuntimeException e) {
                errorLog.warn("match-order", "Error processing order " + order.getId(), e);
            }
        }
        return fills;
    }

    boolean process(Order order, MarketContext market) {
        switch (order.getType()) {
            case MARKET:
                return fill(order, market.touch(order.getSide()), null, market);
            case LIMIT:
                return checkLimit(order, market);
            case STOP:
            case STOP_LOSS:
                return checkStop(order, market);
            case STOP_LIMIT:
                return checkStopLimit(order, market);
            case TAKE_PROFIT:
                return checkTakeProfit(order, market);
            case TRAILING_STOP:
                return checkTrailingStop(order, market);
            default:
                log.warn("Unsupported order type {} for order {}", order.getType(), order.getId());
                return false;
        }
    }

    private boolean checkLimit(Order order, MarketContext market) {
        if (order.getLimitPrice() == null) {
            return false;
        }
        double limit = order.getLimitPrice().doubleValue();
        if (order.getSide() == OrderSide.BUY && market.getAsk() <= limit) {
            return fill(order, Math.min(market.getAsk(), limit), limit, market);
        }
        if (order.getSide() == OrderSide.SELL && market.getBid() >= limit) {
            return fill(order, Math.max(market.getBid(), limit), limit, market);
        }
        return false;
    }

    private boolean checkStop(Order order, MarketContext market) {
        if (order.getStopPrice() == null || !stopCrossed(order, market.getPrice())) {
            return false;
        }
        return fill(order, market.touch(order.getSide()), null, market);
    }

    private boolean checkStopLimit(Order order, MarketContext market) {
        if (!order.isStopTriggered()) {
            if (order.getStopPrice() == null || !stopCrossed(order, market.getPrice())) {
                return false;
            }
            order.setStopTriggered(true);
            updateOrder(order.getId(), o -> o.setStopTriggered(true));
            log.info("Stop-limit {} triggered at {}", order.getId(), market.getPrice());
        }
        return checkLimit(order, market);
    }

    private boolean checkTakeProfit(Order order, MarketContext market) {
        if (order.getStopPrice() == null) {
            return false;
        }
        double target = order.getStopPrice().doubleValue();
        boolean reached = order.getSide() == OrderSide.SELL
                ? market.getPrice() >= target
                : market.getPrice() <= target;
        return reached && fill(order, market.touch(order.getSide()), null, market);
    }

    /**
     * Sell trailing stops follow the running high and fire a percentage below it; buys mirror
     * that with the running low.
     */
    private boolean checkTrailingStop(Order order, MarketContext market) {
        Double trailPct = order.getTrailPct();
        if (trailPct == null || trailPct <= 0) {
            return false;
        }
        double price = market.getPrice();
        Double previous = order.getTrailExtreme();
        double extreme = previous == null ? price : previous;
        boolean sell = order.getSide() == OrderSide.SELL;
        if (sell ? price > extreme : price < extreme) {
            extreme = price;
        }
        if (previous == null || extreme != previous) {
            double updated = extreme;
            order.setTrailExtreme(updated);
            updateOrder(order.getId(), o -> o.setTrailExtreme(updated));
        }
        double stop = sell ? extreme * (1 - trailPct / 100) : extreme * (1 + trailPct / 100);
        boolean fired = sell ? price <= stop : price >= stop;
        return fired && fill(order, market.touch(order.getSide()), null, market);
    }

    private boolean stopCrossed(Order order, double price) {
        double stop = order.getStopPrice().doubleValue();
        return order.getSide() == OrderSide.BUY ? price >= stop : price <= stop;
    }

    private boolean fill(Order order, double referencePrice, Double limitPrice, MarketContext market) {
        return fillExecutor.execute(order.getId(), order.getRemainingQuantity(), referencePrice, limitPrice, market)
                .isFilled();
    }

    private void updateOrder(UUID orderId, Consumer<Order> update) {
        store.runInTransaction(tx -> tx.lockOrder(orderId)
                .filter(Order::isWorking)
                .ifPresent(order -> {
                    update.accept(order);
                    tx.saveOrder(order);
                }));
    }
}
