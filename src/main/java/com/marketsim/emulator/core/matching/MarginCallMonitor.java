package com.marketsim.emulator.core.matching;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.event.FillEvent;
import com.marketsim.emulator.core.event.MarginCallEvent;
import com.marketsim.emulator.core.execution.ExecutionCostModel;
import com.marketsim.emulator.core.execution.ExecutionQuote;
import com.marketsim.emulator.core.execution.ExecutionRequest;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.model.Trade;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.price.StochasticPriceProcess;
import com.marketsim.emulator.core.store.ExchangeStore;
import com.marketsim.emulator.core.store.LockContentionException;
import com.marketsim.emulator.core.support.Numbers;
import com.marketsim.emulator.core.support.RateLimitedLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Liquidates every short of a user whose equity falls below the maintenance ratio times
 * their short exposure. All buy-backs of one user happen in a single transaction.
 */
@Slf4j
@Service
public class MarginCallMonitor {

    private final ExchangeStore store;
    private final InstrumentCatalog catalog;
    private final PriceStateStore priceStates;
    private final StochasticPriceProcess priceProcess;
    private final ExecutionCostModel costModel;
    private final ApplicationEventPublisher eventPublisher;
    private final RateLimitedLogger errorLog;
    private final BigDecimal maintenanceRatio;

    public MarginCallMonitor(ExchangeStore store, InstrumentCatalog catalog, PriceStateStore priceStates,
                             StochasticPriceProcess priceProcess, ExecutionCostModel costModel,
                             ApplicationEventPublisher eventPublisher, Clock clock, EmulatorProperties properties) {
        this.store = store;
        this.catalog = catalog;
        this.priceStates = priceStates;
        this.priceProcess = priceProcess;
        this.costModel = costModel;
        this.eventPublisher = eventPublisher;
        this.errorLog = new RateLimitedLogger(log, clock, properties.getEngine().getErrorLogIntervalMs());
        this.maintenanceRatio = BigDecimal.valueOf(properties.getMargin().getMaintenanceRatio());
    }

    /**
     * @return number of users liquidated
     */
    public int check(RegimeType regime, Instant now) {
        Set<String> users = new LinkedHashSet<>();
        for (Position position : store.findShortPositions()) {
            users.add(position.getUserId());
        }
        int liquidated = 0;
        Map<String, PriceState> prices = priceStates.snapshot();
        for (String userId : users) {
            try {
                if (checkUser(userId, prices, regime, now)) {
                    liquidated++;
                }
            } catch (LockContentionException e) {
                log.debug("Margin check for {} deferred: {}", userId, e.getMessage());
            } catch (RuntimeException e) {
                errorLog.warn("margin-call", "Margin check failed for user " + userId, e);
            }
        }
        return liquidated;
    }

    private boolean checkUser(String userId, Map<String, PriceState> prices, RegimeType regime, Instant now) {
        Account snapshot = store.findAccount(userId).orElse(null);
        if (snapshot == null) {
            return false;
        }
        Exposure precheck = exposure(snapshot, store.findPositions(userId), prices);
        if (!precheck.breached(maintenanceRatio)) {
            return false;
        }

        Liquidation liquidation = store.inTransaction(tx -> {
            Account account = tx.lockAccount(userId).orElse(null);
            if (account == null) {
                return null;
            }
            List<Position> locked = new ArrayList<>();
            for (Position position : store.findPositions(userId)) {
                tx.lockPosition(userId, position.getTicker()).ifPresent(locked::add);
            }
            Exposure exposure = exposure(account, locked, prices);
            if (!exposure.breached(maintenanceRatio)) {
                return null;
            }
            List<Trade> trades = new ArrayList<>();
            for (Position position : locked) {
                if (!position.isShort()) {
                    continue;
                }
                InstrumentDefinition def = catalog.find(position.getTicker()).orElse(null);
                PriceState state = prices.get(position.getTicker());
                if (def == null || state == null) {
                    continue;
                }
                long qty = Math.abs(position.getQuantity());
                ExecutionQuote quote = costModel.quote(ExecutionRequest.builder()
                        .instrument(def)
                        .side(OrderSide.BUY)
                        .quantity(qty)
                        .referencePrice(state.getAsk())
                        .midPrice(state.getMid())
                        .volatility(priceProcess.effectiveVolatility(def, state.getVolatility(), regime, now))
                        .regime(regime)
                        .build());
                BigDecimal fillPrice = Numbers.price(quote.getFillPrice());
                BigDecimal notional = Numbers.money(quote.getNotional());
                BigDecimal commission = Numbers.money(quote.getCommission());
                account.debit(notional.add(commission));

                PositionAccounting.Leg leg = PositionAccounting.apply(position, userId, position.getTicker(),
                        OrderSide.BUY, qty, fillPrice, now);
                tx.deletePosition(userId, position.getTicker());

                Trade trade = Trade.builder()
                        .id(UUID.randomUUID())
                        .orderId(Trade.MARGIN_CALL_ORDER_ID)
                        .userId(userId)
                        .ticker(position.getTicker())
                        .side(OrderSide.BUY)
                        .quantity(qty)
                        .price(fillPrice)
                        .notional(notional)
                        .pnl(Numbers.money(leg.getRealizedPnl().subtract(commission).subtract(leg.getRealizedBorrow())))
                        .midPrice(Numbers.price(quote.getMidPrice()))
                        .slippageBps(BigDecimal.valueOf(quote.getSlippageBps()))
                        .slippageCost(Numbers.money(quote.getSlippageCost()))
                        .commission(commission)
                        .borrowCost(Numbers.money(leg.getRealizedBorrow()))
                        .executionQualityScore(BigDecimal.valueOf(quote.getExecutionQualityScore()))
                        .regime(quote.getRegime())
                        .executedAt(now)
                        .build();
                tx.appendTrade(trade);
                trades.add(trade);
            }
            tx.saveAccount(account);
            return new Liquidation(exposure, trades);
        });

        if (liquidation == null || liquidation.trades().isEmpty()) {
            return false;
        }
        log.warn("Margin call: user={} equity={} shortExposure={} liquidated {} shorts",
                userId, liquidation.exposure().equity(), liquidation.exposure().shortExposure(),
                liquidation.trades().size());
        for (Trade trade : liquidation.trades()) {
            priceProcess.addOrderFlowImpact(trade.getTicker(), trade.getSide(), trade.getNotional().doubleValue());
        }
        eventPublisher.publishEvent(new MarginCallEvent(this, userId, liquidation.exposure().equity(),
                liquidation.exposure().shortExposure(), liquidation.trades()));
        for (Trade trade : liquidation.trades()) {
            eventPublisher.publishEvent(new FillEvent(this, trade));
        }
        return true;
    }

    static Exposure exposure(Account account, List<Position> positions, Map<String, PriceState> prices) {
        BigDecimal equity = account.getCash();
        BigDecimal shortExposure = BigDecimal.ZERO;
        for (Position position : positions) {
            PriceState state = prices.get(position.getTicker());
            if (state == null) {
                continue;
            }
            BigDecimal price = Numbers.price(state.getPrice());
            BigDecimal qty = BigDecimal.valueOf(position.getQuantity());
            equity = equity.add(qty.multiply(price));
            if (position.isShort()) {
                shortExposure = shortExposure.add(qty.abs().multiply(price));
            }
        }
        return new Exposure(Numbers.money(equity), Numbers.money(shortExposure));
    }

    record Exposure(BigDecimal equity, BigDecimal shortExposure) {
        boolean breached(BigDecimal ratio) {
            return shortExposure.signum() > 0 && equity.compareTo(ratio.multiply(shortExposure)) < 0;
        }
    }

    private record Liquidation(Exposure exposure, List<Trade> trades) {
    }
}
