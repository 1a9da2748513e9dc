package com.marketsim.emulator.core.execution;

import lombok.Builder;
import lombok.Value;

/**
 * Priced fill with its full cost breakdown.
 */
@Value
@Builder
public class ExecutionQuote {
    long quantity;
    double fillPrice;
    double midPrice;
    double slippageBps;
    double slippageCost;
    double commission;
    double borrowCost;
    double notional;
    double totalCost;
    double executionQualityScore;
    String regime;
    double volatilityMultiplier;
    boolean limitCapped;
}
