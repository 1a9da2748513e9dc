package com.marketsim.emulator.core.execution;

import lombok.Builder;
import lombok.Value;

/**
 * Pre-trade cost estimate shown before an order is placed.
 */
@Value
@Builder
public class OrderEstimate {
    String ticker;
    String side;
    long quantity;
    double estFillPrice;
    double estSlippageBps;
    double estSlippageCost;
    double estCommission;
    double estBorrowDay;
    double estTotalCost;
    double estExecutionQualityScore;
    String regime;
}
