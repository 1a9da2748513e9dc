package com.marketsim.emulator.core.price;

import com.marketsim.emulator.core.model.AssetClass;
import com.marketsim.emulator.core.model.MacroFactor;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionClockTest {

    private final SessionClock clock = new SessionClock();

    private static Instant at(String time) {
        return Instant.parse("2024-03-05T" + time + "Z");
    }

    @Test
    void testUsSessionBoundaries() {
        assertFalse(clock.isUsSession(at("13:29:59")));
        assertTrue(clock.isUsSession(at("13:30:00")));
        assertTrue(clock.isUsSession(at("19:59:59")));
        assertFalse(clock.isUsSession(at("20:00:00")));
    }

    @Test
    void testEquityVolatilityMultipliers() {
        assertEquals(0.6, clock.volatilityMultiplier(AssetClass.STOCK, at("03:00:00")), 1e-12);
        assertEquals(1.3, clock.volatilityMultiplier(AssetClass.STOCK, at("13:45:00")), 1e-12);
        assertEquals(1.0, clock.volatilityMultiplier(AssetClass.ETF, at("16:00:00")), 1e-12);
        assertEquals(1.3, clock.volatilityMultiplier(AssetClass.FUTURE, at("19:30:00")), 1e-12);
        assertEquals(1.0, clock.volatilityMultiplier(AssetClass.CRYPTO, at("03:00:00")), 1e-12);
    }

    @Test
    void testVolumeMultipliers() {
        assertEquals(0.35, clock.volumeMultiplier(AssetClass.STOCK, at("03:00:00")), 1e-12);
        assertEquals(1.6, clock.volumeMultiplier(AssetClass.STOCK, at("14:00:00")), 1e-12);
        assertEquals(1.3, clock.volumeMultiplier(AssetClass.FOREX, at("12:30:00")), 1e-12);
        assertEquals(1.0, clock.volumeMultiplier(AssetClass.FOREX, at("17:00:00")), 1e-12);
        assertEquals(1.0, clock.volumeMultiplier(AssetClass.COMMODITY, at("03:00:00")), 1e-12);
    }

    @Test
    void testFactorNoiseMultipliers() {
        assertEquals(1.25, clock.factorNoiseMultiplier(MacroFactor.VOL, at("15:00:00")), 1e-12);
        assertEquals(1.2, clock.factorNoiseMultiplier(MacroFactor.RATES, at("12:00:00")), 1e-12);
        assertEquals(1.0, clock.factorNoiseMultiplier(MacroFactor.CRYPTO, at("15:00:00")), 1e-12);
    }
}
