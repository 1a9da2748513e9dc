package com.marketsim.emulator.core.orderbook;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderBook;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.OrderType;
import com.marketsim.emulator.core.model.PriceLevel;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.store.InMemoryExchangeStore;
import com.marketsim.emulator.core.support.MutableClock;
import com.marketsim.emulator.core.support.ScriptedRandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderBookSimulatorTest {

    private final InstrumentCatalog catalog = new InstrumentCatalog();
    private PriceStateStore priceStates;
    private InMemoryExchangeStore store;
    private OrderBookSimulator simulator;

    @BeforeEach
    void setUp() {
        priceStates = new PriceStateStore();
        store = new InMemoryExchangeStore(new EmulatorProperties());
        simulator = new OrderBookSimulator(catalog, priceStates, store, new ScriptedRandomSource(),
                new MutableClock(Instant.parse("2024-03-05T10:00:00Z")));
    }

    private static PriceState state(double price, double volatility) {
        return PriceState.builder().ticker("AAPL").price(price).bid(price - 0.01).ask(price + 0.01)
                .volatility(volatility).build();
    }

    private static Order limit(OrderSide side, String price, long qty) {
        return Order.builder()
                .id(UUID.randomUUID())
                .userId("alice")
                .ticker("AAPL")
                .type(OrderType.LIMIT)
                .side(side)
                .quantity(qty)
                .limitPrice(new BigDecimal(price))
                .build();
    }

    @Test
    void testSyntheticLevelsAroundPrice() {
        OrderBook book = simulator.generate(catalog.get("AAPL"), state(100, 0.02), List.of());

        assertEquals(OrderBookSimulator.LEVELS, book.getBids().size());
        assertEquals(OrderBookSimulator.LEVELS, book.getAsks().size());
        assertEquals(new BigDecimal("99.97"), book.getBids().firstKey());
        assertEquals(new BigDecimal("100.03"), book.getAsks().firstKey());
        assertEquals(new BigDecimal("0.06"), book.getSpread());
        assertEquals(800, book.getBids().firstEntry().getValue().getSyntheticQuantity());
        assertEquals(350, book.getAsks().lastEntry().getValue().getSyntheticQuantity());
        assertEquals(new BigDecimal("100.00"), book.getMid());
    }

    @Test
    void testNearbyUserOrderMergesIntoLevel() {
        Order buy = limit(OrderSide.BUY, "99.95", 40);

        OrderBook book = simulator.generate(catalog.get("AAPL"), state(100, 0.02), List.of(buy));

        PriceLevel level = book.getBids().get(new BigDecimal("99.94"));
        assertEquals(40, level.getUserQuantity());
        assertEquals(level.getSyntheticQuantity() + 40, level.getTotalQuantity());
        assertEquals(OrderBookSimulator.LEVELS, book.getBids().size());
    }

    @Test
    void testUserOrderInsideSpreadBecomesBestLevel() {
        Order buy = limit(OrderSide.BUY, "100.00", 25);
        buy.fill(5, new BigDecimal("100.00"), Instant.EPOCH);

        OrderBook book = simulator.generate(catalog.get("AAPL"), state(100, 0.2), List.of(buy));

        assertEquals(new BigDecimal("100.00"), book.getBids().firstKey());
        PriceLevel best = book.getBids().firstEntry().getValue();
        assertEquals(0, best.getSyntheticQuantity());
        assertEquals(20, best.getUserQuantity());
        assertEquals(OrderBookSimulator.LEVELS, book.getBids().size());
    }

    @Test
    void testStepHasTickFloor() {
        InstrumentDefinition eur = catalog.get("EURUSD");

        OrderBook book = simulator.generate(eur, state(1.0850, 0.0001), List.of());

        assertEquals(new BigDecimal("1.0849"), book.getBids().firstKey());
        assertEquals(new BigDecimal("1.0851"), book.getAsks().firstKey());
    }

    @Test
    void testGenerateUsesRestingLimitsOnly() {
        priceStates.put(state(100, 0.02));
        store.insertOrder(limit(OrderSide.SELL, "100.04", 15));
        Order cancelled = limit(OrderSide.SELL, "100.07", 99);
        cancelled.cancel(Instant.EPOCH);
        store.insertOrder(cancelled);

        OrderBook book = simulator.generate("AAPL").orElseThrow();

        long userQty = book.getAsks().values().stream().mapToLong(PriceLevel::getUserQuantity).sum();
        assertEquals(15, userQty);
        assertTrue(simulator.generate("NOPE").isEmpty());
    }
}
