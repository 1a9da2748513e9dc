package com.marketsim.emulator.core.engine;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.price.CandleAggregator;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.price.SessionClock;
import com.marketsim.emulator.core.price.StochasticPriceProcess;
import com.marketsim.emulator.core.regime.RegimeController;
import com.marketsim.emulator.core.store.InMemoryExchangeStore;
import com.marketsim.emulator.core.support.MutableClock;
import com.marketsim.emulator.core.support.ScriptedRandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class NewsShockServiceTest {

    private static final Instant START = Instant.parse("2024-03-05T10:00:00Z");

    private PriceStateStore priceStates;
    private RegimeController regimeController;
    private NewsShockService service;

    @BeforeEach
    void setUp() {
        EmulatorProperties properties = new EmulatorProperties();
        MutableClock clock = new MutableClock(START);
        ScriptedRandomSource random = new ScriptedRandomSource();
        InstrumentCatalog catalog = new InstrumentCatalog();
        priceStates = new PriceStateStore();
        StochasticPriceProcess priceProcess = new StochasticPriceProcess(catalog, priceStates,
                new CandleAggregator(), new SessionClock(), random, properties);
        priceProcess.initialize(Map.of(), START);
        regimeController = new RegimeController(new InMemoryExchangeStore(properties), random, clock,
                mock(ApplicationEventPublisher.class), properties);
        regimeController.restore(START);
        service = new NewsShockService(catalog, priceStates, priceProcess, regimeController, clock, properties);
    }

    @Test
    void testSmallShockMovesPriceOnly() {
        double applied = service.applyNewsShock("AAPL", 0.01);

        PriceState aapl = priceStates.get("AAPL").orElseThrow();
        assertEquals(0.01, applied, 1e-9);
        assertEquals(186.85, aapl.getPrice(), 1e-9);
        assertTrue(aapl.getBid() < aapl.getPrice() && aapl.getPrice() < aapl.getAsk());
        assertEquals(0.018 * 2.5, aapl.getVolatility(), 1e-12);
        assertEquals(186.85, aapl.getHigh(), 1e-9);
        assertEquals(RegimeType.NORMAL, regimeController.current());
    }

    @Test
    void testLargeShockForcesEventShock() {
        double applied = service.applyNewsShock("AAPL", -0.02);

        assertEquals(-0.02, applied, 1e-9);
        assertEquals(RegimeType.EVENT_SHOCK, regimeController.current());
        assertEquals(START.plusSeconds(120).toEpochMilli(), regimeController.getShockHoldUntil());
    }

    @Test
    void testImpactBoundedByAssetClass() {
        assertEquals(0.25, service.applyNewsShock("AAPL", 0.9), 1e-9);
        assertEquals(0.04, service.applyNewsShock("EURUSD", 0.9), 1e-9);
    }

    @Test
    void testRegimeScalesImpact() {
        regimeController.forceEventShock(START);

        assertEquals(0.018, service.applyNewsShock("MSFT", 0.01), 1e-9);
    }

    @Test
    void testVolatilitySpikeCappedAtCeiling() {
        for (int i = 0; i < 5; i++) {
            service.applyNewsShock("AAPL", 0.001);
        }

        assertEquals(0.018 * 5.0, priceStates.get("AAPL").orElseThrow().getVolatility(), 1e-12);
    }

    @Test
    void testInvalidInputRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.applyNewsShock("NOPE", 0.01));
        assertThrows(IllegalArgumentException.class, () -> service.applyNewsShock("AAPL", Double.NaN));
    }
}
