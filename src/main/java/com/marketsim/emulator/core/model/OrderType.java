package com.marketsim.emulator.core.model;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LOSS,
    STOP_LIMIT,
    TAKE_PROFIT,
    TRAILING_STOP
}
