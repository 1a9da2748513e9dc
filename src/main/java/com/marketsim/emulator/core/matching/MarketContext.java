package com.marketsim.emulator.core.matching;

import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.RegimeType;
import lombok.Builder;
import lombok.Value;

/**
 * Market observed for one instrument at the current tick.
 */
@Value
@Builder
public class MarketContext {
    InstrumentDefinition instrument;
    double price;
    double bid;
    double ask;
    double volatility;
    RegimeType regime;

    public double getMid() {
        return (bid + ask) / 2.0;
    }

    /**
     * Price an aggressive order of this side would take: the ask for buys, the bid for sells.
     */
    public double touch(OrderSide side) {
        return side == OrderSide.BUY ? ask : bid;
    }
}
