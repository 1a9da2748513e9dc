package com.marketsim.emulator.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TickSnapshot {
    String ticker;
    double price;
    double bid;
    double ask;
    double open;
    double high;
    double low;
    double prevClose;
    double volume;
    double change;
    double changePct;
    double volatility;
    RegimeType regime;
    long timestamp;
}
