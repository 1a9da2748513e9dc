package com.marketsim.emulator.core.price;

import com.marketsim.emulator.core.model.Candle;
import com.marketsim.emulator.core.model.CandleInterval;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps one open bar per instrument and interval. A bar is emitted as completed the first
 * time a tick falls into a later bucket.
 */
@Component
public class CandleAggregator {

    private final Map<String, Map<CandleInterval, Candle>> open = new HashMap<>();

    public synchronized void initialize(String ticker, double price, long now) {
        Map<CandleInterval, Candle> bars = new EnumMap<>(CandleInterval.class);
        for (CandleInterval interval : CandleInterval.values()) {
            bars.put(interval, Candle.seed(ticker, interval, interval.bucketStart(now), price, 0));
        }
        open.put(ticker, bars);
    }

    /**
     * Folds one tick into every interval.
     *
     * @return bars completed by this tick
     */
    public synchronized List<Candle> onTick(String ticker, double price, double tickVolume, long now) {
        Map<CandleInterval, Candle> bars = open.get(ticker);
        if (bars == null) {
            initialize(ticker, price, now);
            bars = open.get(ticker);
        }
        List<Candle> completed = new ArrayList<>();
        for (CandleInterval interval : CandleInterval.values()) {
            Candle bar = bars.get(interval);
            long bucket = interval.bucketStart(now);
            if (bucket > bar.getOpenTime()) {
                completed.add(bar.copy());
                bars.put(interval, Candle.seed(ticker, interval, bucket, price, tickVolume));
            } else {
                bar.extend(price, tickVolume);
            }
        }
        return completed;
    }

    public synchronized Optional<Candle> current(String ticker, CandleInterval interval) {
        Map<CandleInterval, Candle> bars = open.get(ticker);
        if (bars == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bars.get(interval)).map(Candle::copy);
    }
}
