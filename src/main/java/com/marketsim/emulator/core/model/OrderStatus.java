package com.marketsim.emulator.core.model;

public enum OrderStatus {
    OPEN,
    PARTIAL,
    FILLED,
    CANCELLED;

    public boolean isWorking() {
        return this == OPEN || this == PARTIAL;
    }
}
