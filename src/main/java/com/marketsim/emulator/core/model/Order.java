package com.marketsim.emulator.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    private UUID id;
    private String userId;
    private String ticker;
    private OrderType type;
    private OrderSide side;
    private long quantity;
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private long filledQuantity = 0;
    private BigDecimal limitPrice;
    private BigDecimal stopPrice;
    private Double trailPct;
    // Running extreme for trailing stops: highest price for sells, lowest for buys
    private Double trailExtreme;
    private boolean stopTriggered;
    private String ocoId;
    // Status and fill fields move only through fill() and cancel()
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private OrderStatus status = OrderStatus.OPEN;
    @Setter(AccessLevel.NONE)
    private BigDecimal avgFillPrice;
    @Builder.Default
    private Instant createdAt = Instant.now();
    @Setter(AccessLevel.NONE)
    private Instant filledAt;
    @Setter(AccessLevel.NONE)
    private Instant cancelledAt;

    public long getRemainingQuantity() {
        return quantity - filledQuantity;
    }

    public boolean isWorking() {
        return status.isWorking();
    }

    /**
     * Records a fill and advances the status. Never moves a terminal order.
     */
    public void fill(long amount, BigDecimal price, Instant at) {
        if (amount <= 0 || !isWorking()) {
            return;
        }
        long applied = Math.min(amount, getRemainingQuantity());
        BigDecimal previousNotional = avgFillPrice == null
                ? BigDecimal.ZERO
                : avgFillPrice.multiply(BigDecimal.valueOf(filledQuantity));
        this.filledQuantity += applied;
        this.avgFillPrice = previousNotional.add(price.multiply(BigDecimal.valueOf(applied)))
                .divide(BigDecimal.valueOf(filledQuantity), 8, RoundingMode.HALF_UP);
        this.filledAt = at;
        this.status = filledQuantity >= quantity ? OrderStatus.FILLED : OrderStatus.PARTIAL;
    }

    /**
     * @return false if the order was already terminal
     */
    public boolean cancel(Instant at) {
        if (!isWorking()) {
            return false;
        }
        this.status = OrderStatus.CANCELLED;
        this.cancelledAt = at;
        return true;
    }

    public Order copy() {
        return toBuilder().build();
    }
}
