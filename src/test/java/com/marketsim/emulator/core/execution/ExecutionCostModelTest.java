package com.marketsim.emulator.core.execution;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.RegimeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionCostModelTest {

    private static final InstrumentDefinition AAPL = new InstrumentCatalog().get("AAPL");
    private static final long ONE_DAY_MS = 24L * 60 * 60 * 1000;

    private final ExecutionCostModel model = new ExecutionCostModel(new EmulatorProperties());

    private ExecutionRequest.ExecutionRequestBuilder buy(long qty) {
        return ExecutionRequest.builder()
                .instrument(AAPL)
                .side(OrderSide.BUY)
                .quantity(qty)
                .referencePrice(100)
                .midPrice(99.99)
                .volatility(0);
    }

    @Test
    void testSlippageGrowsWithQuantity() {
        ExecutionQuote small = model.quote(buy(10).build());
        ExecutionQuote medium = model.quote(buy(10_000).build());
        ExecutionQuote large = model.quote(buy(1_000_000).build());

        assertTrue(small.getFillPrice() > 100);
        assertTrue(small.getSlippageBps() < medium.getSlippageBps());
        assertTrue(medium.getSlippageBps() < large.getSlippageBps());
        assertTrue(small.getExecutionQualityScore() > large.getExecutionQualityScore());
    }

    @Test
    void testSmallOrderPaysBaseSpread() {
        ExecutionQuote quote = model.quote(buy(1).build());

        assertEquals(2.4, quote.getSlippageBps(), 0.01);
        assertEquals("normal", quote.getRegime());
    }

    @Test
    void testSellFillsBelowReference() {
        ExecutionQuote quote = model.quote(buy(500).side(OrderSide.SELL).midPrice(100.01).build());

        assertTrue(quote.getFillPrice() < 100);
        assertTrue(quote.getSlippageCost() > 0);
    }

    @Test
    void testRealismDisabledPassesReferenceThrough() {
        EmulatorProperties properties = new EmulatorProperties();
        properties.getExecution().setRealismEnabled(false);
        ExecutionCostModel legacy = new ExecutionCostModel(properties);

        ExecutionQuote quote = legacy.quote(buy(1_000_000).build());

        assertEquals(100, quote.getFillPrice(), 1e-9);
        assertEquals(100_000_000, quote.getNotional(), 1e-6);
        assertEquals(0, quote.getCommission(), 1e-9);
        assertEquals(100, quote.getExecutionQualityScore(), 1e-9);
        assertEquals(ExecutionCostModel.LEGACY_REGIME_TAG, quote.getRegime());
        assertEquals(0, legacy.estimateBorrowAccrual(10_000, 0.03, ONE_DAY_MS, RegimeType.NORMAL), 1e-12);
    }

    @Test
    void testPerRequestRealismOverride() {
        ExecutionQuote quote = model.quote(buy(1_000_000).applyRealism(false).build());

        assertEquals(100, quote.getFillPrice(), 1e-9);
    }

    @Test
    void testLimitCapsFillPrice() {
        ExecutionQuote quote = model.quote(buy(5_000_000).limitPrice(100.05).build());

        assertTrue(quote.isLimitCapped());
        assertEquals(100.05, quote.getFillPrice(), 1e-9);
        assertEquals(5, quote.getSlippageBps(), 1e-6);
    }

    @Test
    void testLimitNotReachedLeavesPriceAlone() {
        ExecutionQuote quote = model.quote(buy(10).limitPrice(101.0).build());

        assertFalse(quote.isLimitCapped());
        assertTrue(quote.getFillPrice() < 101.0);
    }

    @Test
    void testCommissionMinimum() {
        ExecutionQuote quote = model.quote(buy(1).referencePrice(10).midPrice(10).build());

        assertEquals(0.01, quote.getCommission(), 1e-9);
    }

    @Test
    void testCommissionScalesWithNotional() {
        ExecutionQuote quote = model.quote(buy(1000).build());

        assertEquals(quote.getNotional() * 1.0 / 10_000, quote.getCommission(), 1e-4);
    }

    @Test
    void testBorrowChargedOnlyOnOpenedShort() {
        ExecutionQuote closing = model.quote(buy(100).side(OrderSide.SELL).build());
        ExecutionQuote opening = model.quote(buy(100).side(OrderSide.SELL).openedShortQuantity(100).build());

        assertEquals(0, closing.getBorrowCost(), 1e-12);
        assertEquals(100 * opening.getFillPrice() * 0.03 / 365, opening.getBorrowCost(), 1e-4);
        assertTrue(opening.getTotalCost() > closing.getTotalCost());
    }

    @Test
    void testTightLiquidityWidensImpact() {
        ExecutionQuote normal = model.quote(buy(100_000).build());
        ExecutionQuote tight = model.quote(buy(100_000).regime(RegimeType.TIGHT_LIQUIDITY).build());

        assertTrue(tight.getSlippageBps() > normal.getSlippageBps());
        assertEquals("tight_liquidity", tight.getRegime());
    }

    @Test
    void testVolatilityMultiplierBounds() {
        assertEquals(1.0, ExecutionCostModel.volatilityMultiplier(0), 1e-12);
        assertEquals(1.5, ExecutionCostModel.volatilityMultiplier(0.02), 1e-12);
        assertEquals(4.0, ExecutionCostModel.volatilityMultiplier(1.0), 1e-12);
        assertEquals(1.0, ExecutionCostModel.volatilityMultiplier(Double.NaN), 1e-12);
    }

    @Test
    void testBorrowAccrualProportionalToTime() {
        double oneDay = model.estimateBorrowAccrual(10_000, 0.03, ONE_DAY_MS, RegimeType.NORMAL);
        double twoDays = model.estimateBorrowAccrual(10_000, 0.03, 2 * ONE_DAY_MS, RegimeType.NORMAL);
        double shocked = model.estimateBorrowAccrual(10_000, 0.03, ONE_DAY_MS, RegimeType.EVENT_SHOCK);

        assertEquals(10_000 * 0.03 / 365, oneDay, 1e-8);
        assertEquals(2 * oneDay, twoDays, 1e-8);
        assertEquals(oneDay * 1.5, shocked, 1e-8);
        assertEquals(0, model.estimateBorrowAccrual(10_000, 0.03, -5, RegimeType.NORMAL), 1e-12);
    }

    @Test
    void testEstimateOrderMirrorsQuote() {
        OrderEstimate estimate = model.estimateOrder(AAPL, OrderSide.SELL, 200, 100, 100.01, 0,
                RegimeType.NORMAL, 200);

        assertEquals("AAPL", estimate.getTicker());
        assertEquals("SELL", estimate.getSide());
        assertEquals(200, estimate.getQuantity());
        assertTrue(estimate.getEstBorrowDay() > 0);
        assertEquals(estimate.getEstSlippageCost() + estimate.getEstCommission() + estimate.getEstBorrowDay(),
                estimate.getEstTotalCost(), 1e-3);
    }
}
