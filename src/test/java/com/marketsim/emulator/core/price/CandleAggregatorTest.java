package com.marketsim.emulator.core.price;

import com.marketsim.emulator.core.model.Candle;
import com.marketsim.emulator.core.model.CandleInterval;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CandleAggregatorTest {

    private static final long T0 = Instant.parse("2024-03-05T10:00:05Z").toEpochMilli();

    @Test
    void testTicksExtendOpenBar() {
        CandleAggregator aggregator = new CandleAggregator();
        aggregator.initialize("AAPL", 100, T0);

        assertTrue(aggregator.onTick("AAPL", 102, 10, T0 + 1000).isEmpty());
        assertTrue(aggregator.onTick("AAPL", 99, 5, T0 + 2000).isEmpty());

        Candle bar = aggregator.current("AAPL", CandleInterval.ONE_MINUTE).orElseThrow();
        assertEquals(CandleInterval.ONE_MINUTE.bucketStart(T0), bar.getOpenTime());
        assertEquals(100, bar.getOpen(), 1e-12);
        assertEquals(102, bar.getHigh(), 1e-12);
        assertEquals(99, bar.getLow(), 1e-12);
        assertEquals(99, bar.getClose(), 1e-12);
        assertEquals(15, bar.getVolume(), 1e-12);
    }

    @Test
    void testLaterBucketCompletesBar() {
        CandleAggregator aggregator = new CandleAggregator();
        aggregator.initialize("AAPL", 100, T0);
        aggregator.onTick("AAPL", 101, 10, T0 + 1000);

        List<Candle> completed = aggregator.onTick("AAPL", 103, 7, T0 + 60_000);

        assertEquals(1, completed.size());
        assertEquals(CandleInterval.ONE_MINUTE, completed.get(0).getInterval());
        assertEquals(101, completed.get(0).getClose(), 1e-12);
        Candle fresh = aggregator.current("AAPL", CandleInterval.ONE_MINUTE).orElseThrow();
        assertEquals(103, fresh.getOpen(), 1e-12);
        assertEquals(7, fresh.getVolume(), 1e-12);
    }

    @Test
    void testFirstTickOfUnknownTickerSeedsBars() {
        CandleAggregator aggregator = new CandleAggregator();

        assertTrue(aggregator.current("NEW", CandleInterval.ONE_HOUR).isEmpty());
        aggregator.onTick("NEW", 50, 1, T0);

        assertEquals(50, aggregator.current("NEW", CandleInterval.ONE_DAY).orElseThrow().getClose(), 1e-12);
    }

    @Test
    void testCurrentReturnsCopy() {
        CandleAggregator aggregator = new CandleAggregator();
        aggregator.initialize("AAPL", 100, T0);

        aggregator.current("AAPL", CandleInterval.ONE_MINUTE).orElseThrow().setClose(1);

        assertEquals(100, aggregator.current("AAPL", CandleInterval.ONE_MINUTE).orElseThrow().getClose(), 1e-12);
    }
}
