package com.marketsim.emulator.core.price;

import com.marketsim.emulator.core.model.PriceState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PriceStateStoreTest {

    @Test
    void testDrainCapsAndDecaysOrderFlow() {
        PriceStateStore store = new PriceStateStore();
        store.put(PriceState.builder().ticker("AAPL").price(100).build());
        store.addOrderFlow("AAPL", 4.0);

        assertEquals(1.0, store.drainOrderFlow("AAPL", 1.0, 0.25, 0.0001), 1e-12);
        assertEquals(1.0, store.pendingOrderFlow("AAPL"), 1e-12);
        assertEquals(1.0, store.drainOrderFlow("AAPL", 1.0, 0.25, 0.0001), 1e-12);
        assertEquals(0.25, store.pendingOrderFlow("AAPL"), 1e-12);
    }

    @Test
    void testResidualBelowNoiseFloorIsZeroed() {
        PriceStateStore store = new PriceStateStore();
        store.addOrderFlow("AAPL", -0.001);

        assertEquals(-0.001, store.drainOrderFlow("AAPL", 1.0, 0.25, 0.01), 1e-12);
        assertEquals(0, store.pendingOrderFlow("AAPL"), 1e-12);
    }

    @Test
    void testNonFiniteFlowIgnored() {
        PriceStateStore store = new PriceStateStore();
        store.addOrderFlow("AAPL", Double.NaN);

        assertEquals(0, store.pendingOrderFlow("AAPL"), 1e-12);
    }

    @Test
    void testMutateUnknownTickerRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new PriceStateStore().mutate("NOPE", s -> s.setPrice(1)));
    }
}
