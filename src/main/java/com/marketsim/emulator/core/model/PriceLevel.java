package com.marketsim.emulator.core.model;

import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * One price of the synthetic book: simulated liquidity plus any resting user limit orders.
 */
@Data
public class PriceLevel {
    private BigDecimal price;
    private long syntheticQuantity;
    private final List<Order> userOrders = new ArrayList<>();

    public PriceLevel(BigDecimal price, long syntheticQuantity) {
        this.price = price;
        this.syntheticQuantity = syntheticQuantity;
    }

    public void addUserOrder(Order order) {
        userOrders.add(order);
    }

    public long getUserQuantity() {
        return userOrders.stream()
                .mapToLong(Order::getRemainingQuantity)
                .sum();
    }

    public long getTotalQuantity() {
        return syntheticQuantity + getUserQuantity();
    }
}
