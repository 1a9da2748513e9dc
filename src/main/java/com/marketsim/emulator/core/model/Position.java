package com.marketsim.emulator.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Signed holding of one user in one instrument: positive is long, negative is short.
 * A position with zero quantity is deleted rather than stored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {
    private UUID id;
    private String userId;
    private String ticker;
    private long quantity;
    private BigDecimal averageCost;
    // Borrow already debited from cash but not yet attributed to a closing trade
    @Builder.Default
    private BigDecimal accruedBorrow = BigDecimal.ZERO;
    private Instant openedAt;
    private Instant lastBorrowAccrualAt;

    public boolean isShort() {
        return quantity < 0;
    }

    public boolean isLong() {
        return quantity > 0;
    }

    public Position copy() {
        return toBuilder().build();
    }
}
