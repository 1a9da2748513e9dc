package com.marketsim.emulator.core.execution;

import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.RegimeType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ExecutionRequest {
    InstrumentDefinition instrument;
    OrderSide side;
    long quantity;
    double referencePrice;
    double midPrice;
    double volatility;
    @Builder.Default
    RegimeType regime = RegimeType.NORMAL;
    long openedShortQuantity;
    // Fills are capped at this price when present
    Double limitPrice;
    // Null means "use the configured default"
    Boolean applyRealism;
}
