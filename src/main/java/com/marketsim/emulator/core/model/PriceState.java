package com.marketsim.emulator.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Mutable per-instrument market state. Only the tick loop (through
 * {@link com.marketsim.emulator.core.price.PriceStateStore}) writes it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PriceState {
    private String ticker;
    private double price;
    private double bid;
    private double ask;
    private double open;
    private double high;
    private double low;
    private double prevClose;
    private double volume;
    private double volatility;
    private double anchor;
    private double lastReturn;
    private LocalDate sessionDay;
    private long updatedAt;

    public double getMid() {
        return (bid + ask) / 2.0;
    }

    public PriceState copy() {
        return toBuilder().build();
    }
}
