package com.marketsim.emulator.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OHLCV bar keyed by ticker, interval and bucket open time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Candle {
    private String ticker;
    private CandleInterval interval;
    private long openTime;
    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;

    public static Candle seed(String ticker, CandleInterval interval, long openTime, double price, double volume) {
        return Candle.builder()
                .ticker(ticker)
                .interval(interval)
                .openTime(openTime)
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(Math.max(0, volume))
                .build();
    }

    public void extend(double price, double tickVolume) {
        high = Math.max(high, price);
        low = Math.min(low, price);
        close = price;
        volume += Math.max(0, tickVolume);
    }

    /**
     * Idempotent upsert semantics: high/low widen, close overwrites, volume accumulates.
     */
    public void absorb(Candle other) {
        high = Math.max(high, other.high);
        low = Math.min(low, other.low);
        close = other.close;
        volume += other.volume;
    }

    public String key() {
        return ticker + ":" + interval.getSuffix() + ":" + openTime;
    }

    public Candle copy() {
        return toBuilder().build();
    }
}
