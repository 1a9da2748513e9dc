package com.marketsim.emulator.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Cash balance row of one user.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Account {
    private String userId;
    private BigDecimal cash;
    private BigDecimal startingCash;
    @Builder.Default
    private Instant createdAt = Instant.now();

    public void credit(BigDecimal amount) {
        cash = cash.add(amount);
    }

    public void debit(BigDecimal amount) {
        cash = cash.subtract(amount);
    }

    public Account copy() {
        return toBuilder().build();
    }
}
