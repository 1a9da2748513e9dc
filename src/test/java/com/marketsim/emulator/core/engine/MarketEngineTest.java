package com.marketsim.emulator.core.engine;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.event.TickEvent;
import com.marketsim.emulator.core.execution.ExecutionCostModel;
import com.marketsim.emulator.core.execution.FillMetricsTracker;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.matching.BorrowAccrualService;
import com.marketsim.emulator.core.matching.FillExecutor;
import com.marketsim.emulator.core.matching.MarginCallMonitor;
import com.marketsim.emulator.core.matching.OrderMatchingLoop;
import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.CandleInterval;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.OrderStatus;
import com.marketsim.emulator.core.model.OrderType;
import com.marketsim.emulator.core.price.CandleAggregator;
import com.marketsim.emulator.core.price.MacroFactorProcess;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.price.SessionClock;
import com.marketsim.emulator.core.price.StochasticPriceProcess;
import com.marketsim.emulator.core.regime.RegimeController;
import com.marketsim.emulator.core.store.InMemoryExchangeStore;
import com.marketsim.emulator.core.support.DefaultRandomSource;
import com.marketsim.emulator.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class MarketEngineTest {

    private static final Instant START = Instant.parse("2024-03-05T15:00:30Z");

    private MutableClock clock;
    private InMemoryExchangeStore store;
    private PriceStateStore priceStates;
    private ApplicationEventPublisher publisher;
    private MarketEngine engine;

    @BeforeEach
    void setUp() {
        EmulatorProperties properties = new EmulatorProperties();
        properties.getEngine().setFlushEveryTicks(1);
        clock = new MutableClock(START);
        DefaultRandomSource random = new DefaultRandomSource(11);
        InstrumentCatalog catalog = new InstrumentCatalog();
        SessionClock sessionClock = new SessionClock();
        store = new InMemoryExchangeStore(properties);
        priceStates = new PriceStateStore();
        publisher = mock(ApplicationEventPublisher.class);

        StochasticPriceProcess priceProcess = new StochasticPriceProcess(catalog, priceStates, new CandleAggregator(),
                sessionClock, random, properties);
        ExecutionCostModel costModel = new ExecutionCostModel(properties);
        FillExecutor fillExecutor = new FillExecutor(store, costModel, priceProcess,
                new FillMetricsTracker(clock, properties), publisher, clock, properties);
        engine = new MarketEngine(store, priceStates,
                new MacroFactorProcess(random, sessionClock),
                new RegimeController(store, random, clock, publisher, properties),
                priceProcess,
                new BorrowAccrualService(store, catalog, priceStates, costModel, clock, properties),
                new OrderMatchingLoop(store, catalog, priceStates, priceProcess, fillExecutor, clock, properties),
                new MarginCallMonitor(store, catalog, priceStates, priceProcess, costModel, publisher, clock,
                        properties),
                publisher, clock, properties);
        engine.initialize();
    }

    private List<TickEvent> tickEvents() {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(publisher, atLeastOnce()).publishEvent(captor.capture());
        return captor.getAllValues().stream()
                .filter(TickEvent.class::isInstance)
                .map(TickEvent.class::cast)
                .collect(Collectors.toList());
    }

    @Test
    void testInitializeSeedsMarketAndRegime() {
        assertEquals(30, priceStates.snapshot().size());
        assertTrue(store.findActiveRegime().isPresent());
    }

    @Test
    void testTickPublishesEverySnapshot() {
        clock.advance(Duration.ofSeconds(1));

        assertTrue(engine.runTick());

        List<TickEvent> events = tickEvents();
        assertEquals(1, events.size());
        assertEquals(1, events.get(0).getTickNumber());
        assertEquals(30, events.get(0).getTicks().size());
        assertEquals(1, engine.getTickCount());
        assertEquals(30, store.loadPriceStates().size());
    }

    @Test
    void testPausedEngineSkipsTicks() {
        engine.pause("maintenance");

        assertFalse(engine.runTick());
        assertTrue(engine.isPaused());
        assertEquals("maintenance", engine.getPauseReason());
        assertEquals(0, engine.getTickCount());

        engine.resume();
        assertTrue(engine.runTick());
        assertFalse(engine.isPaused());
        assertEquals(1, engine.getTickCount());
    }

    @Test
    void testMarketOrderFillsWithinTick() {
        store.createAccount(Account.builder()
                .userId("alice")
                .cash(new BigDecimal("100000"))
                .startingCash(new BigDecimal("100000"))
                .build());
        Order order = Order.builder()
                .id(UUID.randomUUID())
                .userId("alice")
                .ticker("AAPL")
                .type(OrderType.MARKET)
                .side(OrderSide.BUY)
                .quantity(10)
                .build();
        store.insertOrder(order);
        clock.advance(Duration.ofSeconds(1));

        engine.runTick();

        assertEquals(OrderStatus.FILLED, store.findOrder(order.getId()).orElseThrow().getStatus());
        assertEquals(1, store.findTrades("alice", 10).size());
    }

    @Test
    void testStorageOutageKeepsPricesMovingAndCandlesBuffered() {
        store.setAvailable(false);
        clock.advance(Duration.ofSeconds(31));

        assertTrue(engine.runTick());

        assertEquals(1, tickEvents().size());
        assertEquals(30, engine.pendingCandleCount());

        store.setAvailable(true);
        clock.advance(Duration.ofSeconds(1));
        engine.runTick();

        assertEquals(0, engine.pendingCandleCount());
        assertEquals(1, store.findCandles("AAPL", CandleInterval.ONE_MINUTE, 10).size());
    }

    @Test
    void testShutdownFlushesPriceTable() {
        clock.advance(Duration.ofSeconds(1));
        engine.runTick();
        engine.pause("test");
        clock.advance(Duration.ofSeconds(1));

        engine.shutdown();

        assertEquals(priceStates.get("AAPL").orElseThrow().getPrice(),
                store.loadPriceStates().get("AAPL").getPrice(), 1e-12);
    }
}
