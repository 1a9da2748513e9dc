package com.marketsim.emulator.core.matching;

import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.OrderStatus;
import com.marketsim.emulator.core.model.OrderType;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.Trade;
import com.marketsim.emulator.core.support.Numbers;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static com.marketsim.emulator.core.matching.MatchingFixture.USER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FillExecutorTest {

    @Test
    void testSameDirectionFillsUseWeightedAverageCost() {
        MatchingFixture fx = new MatchingFixture();
        fx.createAccount(USER, "100000");

        fx.setPrice(100);
        fx.place(OrderType.MARKET, OrderSide.BUY, 10);
        fx.tick();
        fx.setPrice(110);
        fx.place(OrderType.MARKET, OrderSide.BUY, 10);
        fx.tick();

        List<Trade> trades = fx.store.findTrades(USER, 10);
        assertEquals(2, trades.size());
        BigDecimal expected = trades.get(0).getPrice().add(trades.get(1).getPrice())
                .divide(BigDecimal.valueOf(2), Numbers.PRICE_SCALE, RoundingMode.HALF_UP);
        Position position = fx.position(USER);
        assertEquals(20, position.getQuantity());
        assertEquals(0, expected.compareTo(position.getAverageCost()));
    }

    @Test
    void testShortThenCoverRealizesPnlNetOfCommission() {
        MatchingFixture fx = new MatchingFixture();
        fx.createAccount(USER, "100000");

        fx.setPrice(100);
        fx.place(OrderType.MARKET, OrderSide.SELL, 5);
        fx.tick();
        Position shortPosition = fx.position(USER);
        assertEquals(-5, shortPosition.getQuantity());
        Trade open = fx.store.findTrades(USER, 1).get(0);
        assertEquals(0, open.getPrice().compareTo(shortPosition.getAverageCost()));
        assertTrue(open.getPrice().compareTo(new BigDecimal("99.95")) <= 0);

        fx.setPrice(90);
        fx.place(OrderType.MARKET, OrderSide.BUY, 5);
        fx.tick();

        assertNull(fx.position(USER));
        Trade cover = fx.store.findTrades(USER, 1).get(0);
        BigDecimal gross = Numbers.money(shortPosition.getAverageCost().subtract(cover.getPrice())
                .multiply(BigDecimal.valueOf(5)));
        BigDecimal expected = Numbers.money(gross.subtract(cover.getCommission()).subtract(cover.getBorrowCost()));
        assertEquals(0, expected.compareTo(cover.getPnl()));
        assertTrue(cover.getPnl().signum() > 0);
    }

    @Test
    void testBuyReducedToAffordableQuantity() {
        MatchingFixture fx = new MatchingFixture();
        fx.createAccount(USER, "1000");
        fx.setPrice(100.00, 99.95, 100.05);

        Order order = fx.place(OrderType.MARKET, OrderSide.BUY, 20);
        assertEquals(1, fx.tick());

        Order partial = fx.reload(order);
        assertEquals(OrderStatus.PARTIAL, partial.getStatus());
        assertEquals(9, partial.getFilledQuantity());
        assertTrue(fx.cash(USER).signum() >= 0);

        // Remaining cash covers nothing: the rest of the order is cancelled
        assertEquals(0, fx.tick());
        assertEquals(OrderStatus.CANCELLED, fx.reload(order).getStatus());
        assertEquals(9, fx.position(USER).getQuantity());
    }

    @Test
    void testUnaffordableSingleUnitCancels() {
        MatchingFixture fx = new MatchingFixture();
        fx.createAccount(USER, "50");
        fx.setPrice(100);

        Order order = fx.place(OrderType.MARKET, OrderSide.BUY, 1);
        assertEquals(0, fx.tick());

        assertEquals(OrderStatus.CANCELLED, fx.reload(order).getStatus());
        assertTrue(fx.store.findTrades(USER, 10).isEmpty());
        assertEquals(0, new BigDecimal("50").compareTo(fx.cash(USER)));
    }

    @Test
    void testSellCreditsNotionalLessCommission() {
        MatchingFixture fx = new MatchingFixture();
        fx.createAccount(USER, "1000");
        fx.seedPosition(USER, 10, "90", MatchingFixture.START);
        fx.setPrice(100);

        fx.place(OrderType.MARKET, OrderSide.SELL, 10);
        fx.tick();

        Trade trade = fx.store.findTrades(USER, 1).get(0);
        BigDecimal expectedCash = new BigDecimal("1000").add(trade.getNotional()).subtract(trade.getCommission());
        assertEquals(0, expectedCash.compareTo(fx.cash(USER)));
        assertNull(fx.position(USER));
    }

    @Test
    void testRealismDisabledFillsAtReference() {
        MatchingFixture fx = new MatchingFixture(false);
        fx.createAccount(USER, "100000");
        fx.setPrice(100.00, 99.95, 100.05);

        fx.place(OrderType.MARKET, OrderSide.BUY, 10);
        fx.tick();

        Trade trade = fx.store.findTrades(USER, 1).get(0);
        assertEquals(0, new BigDecimal("100.05").compareTo(trade.getPrice()));
        assertEquals(0, BigDecimal.ZERO.compareTo(trade.getCommission()));
        assertEquals("legacy", trade.getRegime());
        assertEquals(0, new BigDecimal("100").compareTo(trade.getExecutionQualityScore()));
    }

    @Test
    void testFillsFeedMetricsAndOrderFlow() {
        MatchingFixture fx = new MatchingFixture();
        fx.createAccount(USER, "100000");
        fx.setPrice(100);

        fx.place(OrderType.MARKET, OrderSide.BUY, 100);
        fx.tick();

        assertEquals(1, fx.fillMetrics.recentMetrics(60_000).getCount());
        assertTrue(fx.fillMetrics.recentMetrics(60_000).getAvgSlippageBps() > 0);
        assertTrue(fx.priceStates.pendingOrderFlow(MatchingFixture.TICKER) > 0);
    }
}
