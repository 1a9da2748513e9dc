package com.marketsim.emulator.core.execution;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.Microstructure;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.support.Numbers;
import org.springframework.stereotype.Component;

/**
 * Transaction cost model. Stateless: every method is a pure function of its arguments and
 * the realism switch.
 * <p>
 * Impact grows with the order's share of average daily dollar volume to the power
 * {@value #IMPACT_EXPONENT}, scaled by the regime liquidity multiplier and a volatility
 * multiplier. Commission has a per-fill minimum. Borrow is charged per day on newly opened
 * short quantity.
 */
@Component
public class ExecutionCostModel {

    public static final String LEGACY_REGIME_TAG = "legacy";

    private static final double IMPACT_EXPONENT = 0.6;
    private static final double BPS = 10_000.0;
    private static final double YEAR_MS = 365.0 * 24 * 60 * 60 * 1000;
    private static final double MIN_MID_PRICE = 0.0000001;

    private final boolean realismEnabled;

    public ExecutionCostModel(EmulatorProperties properties) {
        this.realismEnabled = properties.getExecution().isRealismEnabled();
    }

    public boolean isRealismEnabled() {
        return realismEnabled;
    }

    public ExecutionQuote quote(ExecutionRequest request) {
        long qty = Math.max(0, request.getQuantity());
        double referencePrice = Math.max(0, finiteOr(request.getReferencePrice(), 0));
        double midPrice = Math.max(MIN_MID_PRICE, finiteOr(request.getMidPrice(), referencePrice));
        boolean realism = request.getApplyRealism() != null ? request.getApplyRealism() : realismEnabled;

        if (!realism) {
            double notional = referencePrice * qty;
            return ExecutionQuote.builder()
                    .quantity(qty)
                    .fillPrice(Numbers.round(referencePrice, 8))
                    .midPrice(Numbers.round(midPrice, 8))
                    .notional(Numbers.round(notional, 4))
                    .executionQualityScore(100)
                    .regime(LEGACY_REGIME_TAG)
                    .volatilityMultiplier(1)
                    .build();
        }

        Microstructure micro = request.getInstrument().getMicrostructure();
        RegimeType regime = request.getRegime() != null ? request.getRegime() : RegimeType.NORMAL;
        int direction = request.getSide().sign();

        double impactRatio = referencePrice * qty / micro.getAvgDailyDollarVolume();
        double volMultiplier = volatilityMultiplier(request.getVolatility());
        double impactBps = micro.getBaseSpreadBps()
                + micro.getImpactCoeff() * Math.pow(impactRatio, IMPACT_EXPONENT)
                * regime.getLiquidityMultiplier() * volMultiplier;
        double fillPrice = referencePrice * (1 + direction * impactBps / BPS);

        boolean capped = false;
        Double limit = request.getLimitPrice();
        if (limit != null && (direction > 0 ? fillPrice > limit : fillPrice < limit)) {
            fillPrice = limit;
            capped = true;
            impactBps = referencePrice > 0
                    ? Math.max(0, direction * (fillPrice - referencePrice) / referencePrice * BPS)
                    : 0;
        }

        double notional = qty * fillPrice;
        double slippageCost = Math.max(0, direction * (fillPrice - midPrice) * qty);
        double commission = commission(micro, notional);
        long openedShort = Math.max(0, request.getOpenedShortQuantity());
        double borrowCost = openedShort > 0
                ? openedShort * fillPrice * (micro.getBorrowAprShort() * regime.getBorrowMultiplier() / 365)
                : 0;
        double commissionBps = notional > 0 ? commission / notional * BPS : 0;
        double borrowBps = notional > 0 ? borrowCost / notional * BPS : 0;
        double quality = Numbers.clamp(100 - (impactBps * 0.6 + commissionBps * 0.3 + borrowBps * 0.1), 0, 100);

        return ExecutionQuote.builder()
                .quantity(qty)
                .fillPrice(Numbers.round(fillPrice, 8))
                .midPrice(Numbers.round(midPrice, 8))
                .slippageBps(Numbers.round(impactBps, 4))
                .slippageCost(Numbers.round(slippageCost, 4))
                .commission(Numbers.round(commission, 4))
                .borrowCost(Numbers.round(borrowCost, 4))
                .notional(Numbers.round(notional, 4))
                .totalCost(Numbers.round(slippageCost + commission + borrowCost, 4))
                .executionQualityScore(Numbers.round(quality, 4))
                .regime(regime.tag())
                .volatilityMultiplier(Numbers.round(volMultiplier, 4))
                .limitCapped(capped)
                .build();
    }

    public OrderEstimate estimateOrder(InstrumentDefinition instrument, OrderSide side, long qty,
                                       double referencePrice, double midPrice, double volatility,
                                       RegimeType regime, long openedShortQty) {
        ExecutionQuote quote = quote(ExecutionRequest.builder()
                .instrument(instrument)
                .side(side)
                .quantity(qty)
                .referencePrice(referencePrice)
                .midPrice(midPrice)
                .volatility(volatility)
                .regime(regime)
                .openedShortQuantity(openedShortQty)
                .build());
        return OrderEstimate.builder()
                .ticker(instrument.getTicker())
                .side(side.name())
                .quantity(quote.getQuantity())
                .estFillPrice(quote.getFillPrice())
                .estSlippageBps(quote.getSlippageBps())
                .estSlippageCost(quote.getSlippageCost())
                .estCommission(quote.getCommission())
                .estBorrowDay(quote.getBorrowCost())
                .estTotalCost(Numbers.round(quote.getSlippageCost() + quote.getCommission() + quote.getBorrowCost(), 4))
                .estExecutionQualityScore(Numbers.round(quote.getExecutionQualityScore(), 2))
                .regime(quote.getRegime())
                .build();
    }

    /**
     * Borrow owed on a short of {@code notional} held for {@code elapsedMs}.
     */
    public double estimateBorrowAccrual(double notional, double borrowApr, long elapsedMs, RegimeType regime) {
        if (!realismEnabled) {
            return 0;
        }
        RegimeType effective = regime != null ? regime : RegimeType.NORMAL;
        double apr = Math.max(0, borrowApr) * effective.getBorrowMultiplier();
        double accrual = Math.max(0, finiteOr(notional, 0)) * apr * (Math.max(0, elapsedMs) / YEAR_MS);
        return Numbers.round(accrual, 8);
    }

    static double volatilityMultiplier(double volatility) {
        return Numbers.clamp(1 + Math.max(0, finiteOr(volatility, 0)) * 25, 0.85, 4);
    }

    private static double commission(Microstructure micro, double notional) {
        return Math.max(micro.getCommissionMinUsd(), notional * micro.getCommissionBps() / BPS);
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }
}
