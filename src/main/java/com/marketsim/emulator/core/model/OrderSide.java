package com.marketsim.emulator.core.model;

public enum OrderSide {
    BUY,
    SELL;

    /**
     * +1 for buys, -1 for sells.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
