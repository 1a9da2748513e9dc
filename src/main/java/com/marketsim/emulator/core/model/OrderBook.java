package com.marketsim.emulator.core.model;

import lombok.Data;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

@Data
public class OrderBook {
    private final String ticker;
    private final BigDecimal mid;
    private final long timestamp;
    // Bids best (highest) first, asks best (lowest) first
    private final NavigableMap<BigDecimal, PriceLevel> bids = new TreeMap<>(Collections.reverseOrder());
    private final NavigableMap<BigDecimal, PriceLevel> asks = new TreeMap<>();

    public OrderBook(String ticker, BigDecimal mid, long timestamp) {
        this.ticker = ticker;
        this.mid = mid;
        this.timestamp = timestamp;
    }

    public BigDecimal getSpread() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return asks.firstKey().subtract(bids.firstKey());
    }
}
