package com.marketsim.emulator.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable execution record.
 */
@Value
@Builder
public class Trade {
    public static final String MARGIN_CALL_ORDER_ID = "margin-call";

    UUID id;
    String orderId;
    String userId;
    String ticker;
    OrderSide side;
    long quantity;
    BigDecimal price;
    BigDecimal notional;
    BigDecimal pnl;
    BigDecimal midPrice;
    BigDecimal slippageBps;
    BigDecimal slippageCost;
    BigDecimal commission;
    BigDecimal borrowCost;
    BigDecimal executionQualityScore;
    String regime;
    @Builder.Default
    Instant executedAt = Instant.now();

    public boolean isMarginCall() {
        return MARGIN_CALL_ORDER_ID.equals(orderId);
    }
}
