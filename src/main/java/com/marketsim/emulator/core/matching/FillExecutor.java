package com.marketsim.emulator.core.matching;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.event.FillEvent;
import com.marketsim.emulator.core.execution.ExecutionCostModel;
import com.marketsim.emulator.core.execution.ExecutionQuote;
import com.marketsim.emulator.core.execution.ExecutionRequest;
import com.marketsim.emulator.core.execution.FillMetricsTracker;
import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.Trade;
import com.marketsim.emulator.core.price.StochasticPriceProcess;
import com.marketsim.emulator.core.store.ExchangeStore;
import com.marketsim.emulator.core.store.LedgerTransaction;
import com.marketsim.emulator.core.support.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Executes one candidate fill of a resting order as a single ledger transaction: order,
 * account and position rows are locked, cash and position are updated, a trade is
 * appended and OCO siblings are cancelled. Nothing is visible until commit, and the
 * order-flow feedback, event and metrics only happen after it.
 */
@Slf4j
@Service
public class FillExecutor {

    private final ExchangeStore store;
    private final ExecutionCostModel costModel;
    private final StochasticPriceProcess priceProcess;
    private final FillMetricsTracker fillMetrics;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxAffordabilityIterations;

    public FillExecutor(ExchangeStore store, ExecutionCostModel costModel, StochasticPriceProcess priceProcess,
                        FillMetricsTracker fillMetrics, ApplicationEventPublisher eventPublisher, Clock clock,
                        EmulatorProperties properties) {
        this.store = store;
        this.costModel = costModel;
        this.priceProcess = priceProcess;
        this.fillMetrics = fillMetrics;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxAffordabilityIterations = properties.getExecution().getMaxAffordabilityIterations();
    }

    /**
     * @param orderId        order to fill
     * @param requestedQty   quantity wanted; clamped to what is still unfilled
     * @param referencePrice price before impact
     * @param limitPrice     cap applied by the cost model, null for none
     */
    public FillResult execute(UUID orderId, long requestedQty, double referencePrice, Double limitPrice,
                              MarketContext market) {
        Instant now = clock.instant();
        FillResult result = store.inTransaction(tx -> fill(tx, orderId, requestedQty, referencePrice,
                limitPrice, market, now));

        if (result.isFilled()) {
            Trade trade = result.getTrade();
            priceProcess.addOrderFlowImpact(trade.getTicker(), trade.getSide(), trade.getNotional().doubleValue());
            fillMetrics.record(now.toEpochMilli(), trade.getSlippageBps().doubleValue(),
                    trade.getExecutionQualityScore().doubleValue());
            log.info("Fill: order={} user={} {} {} x{} @ {} pnl={} commission={}",
                    trade.getOrderId(), trade.getUserId(), trade.getSide(), trade.getTicker(),
                    trade.getQuantity(), trade.getPrice(), trade.getPnl(), trade.getCommission());
            if (!result.getCancelledSiblings().isEmpty()) {
                log.info("OCO: order {} filled, cancelled siblings {}", orderId, result.getCancelledSiblings());
            }
            eventPublisher.publishEvent(new FillEvent(this, trade));
        } else if (result.getStatus() == FillResult.Status.CANCELLED) {
            log.info("Order {} cancelled: cash does not cover a single unit", orderId);
        }
        return result;
    }

    private FillResult fill(LedgerTransaction tx, UUID orderId, long requestedQty, double referencePrice,
                            Double limitPrice, MarketContext market, Instant now) {
        Order order = tx.lockOrder(orderId).orElse(null);
        if (order == null || !order.isWorking()) {
            log.debug("Order {} is no longer open, skipping fill", orderId);
            return FillResult.skipped();
        }
        Account account = tx.lockAccount(order.getUserId()).orElse(null);
        if (account == null) {
            log.warn("Order {} references unknown account {}, cancelling", orderId, order.getUserId());
            order.cancel(now);
            tx.saveOrder(order);
            return FillResult.cancelled();
        }
        Position position = tx.lockPosition(order.getUserId(), order.getTicker()).orElse(null);

        long qty = Math.min(requestedQty, order.getRemainingQuantity());
        if (qty <= 0) {
            return FillResult.skipped();
        }

        ExecutionQuote quote = quote(order.getSide(), qty, referencePrice, limitPrice, market);
        if (order.getSide() == OrderSide.BUY && !affordable(account, quote)) {
            quote = reduceToAffordable(account, order.getSide(), qty, quote, referencePrice, limitPrice, market);
            if (quote == null) {
                order.cancel(now);
                tx.saveOrder(order);
                return FillResult.cancelled();
            }
            log.debug("Order {} reduced from {} to {} to fit cash {}", orderId, qty, quote.getQuantity(),
                    account.getCash());
            qty = quote.getQuantity();
        }

        if (order.getSide() == OrderSide.SELL && position != null && position.isShort()) {
            settleBorrow(account, position, market, now);
        }

        BigDecimal fillPrice = Numbers.price(quote.getFillPrice());
        BigDecimal notional = Numbers.money(quote.getNotional());
        BigDecimal commission = Numbers.money(quote.getCommission());
        if (order.getSide() == OrderSide.BUY) {
            account.debit(notional.add(commission));
        } else {
            account.credit(notional.subtract(commission));
        }
        tx.saveAccount(account);

        PositionAccounting.Leg leg = PositionAccounting.apply(position, order.getUserId(), order.getTicker(),
                order.getSide(), qty, fillPrice, now);
        if (leg.getPosition() == null) {
            tx.deletePosition(order.getUserId(), order.getTicker());
        } else {
            tx.savePosition(leg.getPosition());
        }

        BigDecimal netPnl = leg.getRealizedPnl().subtract(commission).subtract(leg.getRealizedBorrow());
        Trade trade = Trade.builder()
                .id(UUID.randomUUID())
                .orderId(order.getId().toString())
                .userId(order.getUserId())
                .ticker(order.getTicker())
                .side(order.getSide())
                .quantity(qty)
                .price(fillPrice)
                .notional(notional)
                .pnl(Numbers.money(netPnl))
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

        order.fill(qty, fillPrice, now);
        tx.saveOrder(order);

        List<UUID> cancelled = new ArrayList<>();
        if (order.getOcoId() != null) {
            for (Order sibling : tx.lockOcoSiblings(order.getOcoId(), order.getId())) {
                if (sibling.cancel(now)) {
                    tx.saveOrder(sibling);
                    cancelled.add(sibling.getId());
                }
            }
        }
        return FillResult.filled(trade, cancelled);
    }

    /**
     * Walks the quantity down from the cash-implied size one unit at a time until the fill
     * plus commission fits in cash.
     *
     * @return the affordable quote, or null if not even one unit is affordable
     */
    private ExecutionQuote reduceToAffordable(Account account, OrderSide side, long qty, ExecutionQuote initial,
                                              double referencePrice, Double limitPrice, MarketContext market) {
        if (account.getCash().signum() <= 0 || !(initial.getFillPrice() > 0)) {
            return null;
        }
        long cashImplied = account.getCash()
                .divide(BigDecimal.valueOf(initial.getFillPrice()), 0, RoundingMode.FLOOR)
                .longValue();
        long candidate = Math.min(qty - 1, cashImplied);
        int iterations = 0;
        while (candidate > 0 && iterations++ < maxAffordabilityIterations) {
            ExecutionQuote quote = quote(side, candidate, referencePrice, limitPrice, market);
            if (affordable(account, quote)) {
                return quote;
            }
            candidate--;
        }
        return null;
    }

    /**
     * Charges the borrow an existing short has run up since its last accrual, so units added
     * by this fill only accrue from now.
     */
    private void settleBorrow(Account account, Position position, MarketContext market, Instant now) {
        long elapsedMs = now.toEpochMilli() - BorrowAccrualService.lastAccrual(position).toEpochMilli();
        if (elapsedMs <= 0) {
            return;
        }
        double notional = Math.abs(position.getQuantity()) * market.getPrice();
        BigDecimal amount = Numbers.price(costModel.estimateBorrowAccrual(notional,
                market.getInstrument().getMicrostructure().getBorrowAprShort(), elapsedMs, market.getRegime()));
        account.debit(amount);
        BigDecimal accrued = position.getAccruedBorrow() == null ? BigDecimal.ZERO : position.getAccruedBorrow();
        position.setAccruedBorrow(accrued.add(amount));
        position.setLastBorrowAccrualAt(now);
        log.debug("Borrow settled before extending short: user={} ticker={} elapsedMs={} amount={}",
                position.getUserId(), position.getTicker(), elapsedMs, amount);
    }

    private ExecutionQuote quote(OrderSide side, long qty, double referencePrice, Double limitPrice,
                                 MarketContext market) {
        return costModel.quote(ExecutionRequest.builder()
                .instrument(market.getInstrument())
                .side(side)
                .quantity(qty)
                .referencePrice(referencePrice)
                .midPrice(market.getMid())
                .volatility(market.getVolatility())
                .regime(market.getRegime())
                .openedShortQuantity(0)
                .limitPrice(limitPrice)
                .build());
    }

    private static boolean affordable(Account account, ExecutionQuote quote) {
        BigDecimal required = Numbers.money(quote.getNotional()).add(Numbers.money(quote.getCommission()));
        return account.getCash().compareTo(required) >= 0;
    }
}
