package com.marketsim.emulator.core.order;

import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderStatus;
import com.marketsim.emulator.core.model.OrderType;
import com.marketsim.emulator.core.store.ExchangeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Order placement and cancellation. Placed orders are only stored; the matching loop picks
 * them up on the next tick.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private final ExchangeStore store;
    private final InstrumentCatalog catalog;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException if the ticker or account is unknown, or the prices
     *                                  required by the order type are missing
     */
    public Order placeOrder(PlaceOrderCommand command) {
        validate(command);
        Order order = Order.builder()
                .id(UUID.randomUUID())
                .userId(command.getUserId())
                .ticker(command.getTicker())
                .type(command.getType())
                .side(command.getSide())
                .quantity(command.getQuantity())
                .limitPrice(command.getLimitPrice())
                .stopPrice(command.getStopPrice())
                .trailPct(command.getTrailPct())
                .ocoId(command.getOcoId())
                .status(OrderStatus.OPEN)
                .createdAt(clock.instant())
                .build();
        store.insertOrder(order);
        log.info("Order placed: id={} user={} {} {} {} x{} limit={} stop={} trail={} oco={}",
                order.getId(), order.getUserId(), order.getType(), order.getSide(), order.getTicker(),
                order.getQuantity(), order.getLimitPrice(), order.getStopPrice(), order.getTrailPct(),
                order.getOcoId());
        return order;
    }

    /**
     * Cancels a working order. A terminal order is returned unchanged.
     *
     * @return empty if no such order exists
     */
    public Optional<Order> cancelOrder(UUID orderId) {
        Instant now = clock.instant();
        Optional<Order> result = store.inTransaction(tx -> {
            Optional<Order> locked = tx.lockOrder(orderId);
            locked.ifPresent(order -> {
                if (order.cancel(now)) {
                    tx.saveOrder(order);
                }
            });
            return locked;
        });
        result.ifPresent(order -> log.info("Cancel order {}: status={}", orderId, order.getStatus()));
        return result;
    }

    public Optional<Order> findOrder(UUID orderId) {
        return store.findOrder(orderId);
    }

    /**
     * Orders of one user, newest first.
     */
    public List<Order> ordersOf(String userId) {
        List<Order> orders = new ArrayList<>(store.findOrdersByUser(userId));
        orders.sort(Comparator.comparing(Order::getCreatedAt).reversed());
        return orders;
    }

    private void validate(PlaceOrderCommand command) {
        if (command.getUserId() == null || command.getUserId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (command.getTicker() == null || !catalog.contains(command.getTicker())) {
            throw new IllegalArgumentException("Unknown ticker: " + command.getTicker());
        }
        if (command.getType() == null || command.getSide() == null) {
            throw new IllegalArgumentException("Order type and side are required");
        }
        if (command.getQuantity() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (store.findAccount(command.getUserId()).isEmpty()) {
            throw new IllegalArgumentException("Unknown account: " + command.getUserId());
        }
        OrderType type = command.getType();
        switch (type) {
            case LIMIT:
                requirePositive(command.getLimitPrice(), "limitPrice", type);
                break;
            case STOP:
            case STOP_LOSS:
            case TAKE_PROFIT:
                requirePositive(command.getStopPrice(), "stopPrice", type);
                break;
            case STOP_LIMIT:
                requirePositive(command.getStopPrice(), "stopPrice", type);
                requirePositive(command.getLimitPrice(), "limitPrice", type);
                break;
            case TRAILING_STOP:
                Double trail = command.getTrailPct();
                if (trail == null || !(trail > 0) || trail >= 100) {
                    throw new IllegalArgumentException("TRAILING_STOP requires trailPct in (0, 100)");
                }
                break;
            default:
                break;
        }
    }

    private static void requirePositive(BigDecimal value, String field, OrderType type) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(type + " requires a positive " + field);
        }
    }
}
