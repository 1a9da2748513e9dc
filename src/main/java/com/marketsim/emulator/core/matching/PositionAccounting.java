package com.marketsim.emulator.core.matching;

import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.support.Numbers;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Weighted-average-cost position arithmetic shared by order fills and margin liquidations.
 */
final class PositionAccounting {

    private PositionAccounting() {
    }

    /**
     * Applies a fill of {@code qty} at {@code price} to {@code existing} (null when flat).
     */
    static Leg apply(Position existing, String userId, String ticker, OrderSide side, long qty,
                     BigDecimal price, Instant now) {
        long previousQty = existing == null ? 0 : existing.getQuantity();
        long signedQty = side.sign() * qty;

        if (previousQty == 0) {
            return new Leg(open(userId, ticker, signedQty, price, now), BigDecimal.ZERO, BigDecimal.ZERO, 0);
        }

        Position position = existing.copy();
        if (Long.signum(previousQty) == Long.signum(signedQty)) {
            long newQty = previousQty + signedQty;
            BigDecimal totalCost = position.getAverageCost().multiply(BigDecimal.valueOf(Math.abs(previousQty)))
                    .add(price.multiply(BigDecimal.valueOf(qty)));
            position.setQuantity(newQty);
            position.setAverageCost(totalCost.divide(BigDecimal.valueOf(Math.abs(newQty)),
                    Numbers.PRICE_SCALE, RoundingMode.HALF_UP));
            return new Leg(position, BigDecimal.ZERO, BigDecimal.ZERO, 0);
        }

        long closedQty = Math.min(qty, Math.abs(previousQty));
        BigDecimal closed = BigDecimal.valueOf(closedQty);
        BigDecimal pnl = previousQty > 0
                ? price.subtract(position.getAverageCost()).multiply(closed)
                : position.getAverageCost().subtract(price).multiply(closed);

        BigDecimal realizedBorrow = BigDecimal.ZERO;
        if (previousQty < 0 && position.getAccruedBorrow() != null && position.getAccruedBorrow().signum() > 0) {
            realizedBorrow = position.getAccruedBorrow().multiply(closed)
                    .divide(BigDecimal.valueOf(Math.abs(previousQty)), Numbers.PRICE_SCALE, RoundingMode.HALF_UP);
            position.setAccruedBorrow(position.getAccruedBorrow().subtract(realizedBorrow));
        }

        long newQty = previousQty + signedQty;
        long shortClosed = previousQty < 0 ? closedQty : 0;
        if (newQty == 0) {
            return new Leg(null, Numbers.money(pnl), realizedBorrow, shortClosed);
        }
        if (qty > closedQty) {
            return new Leg(open(userId, ticker, newQty, price, now), Numbers.money(pnl), realizedBorrow, shortClosed);
        }
        position.setQuantity(newQty);
        return new Leg(position, Numbers.money(pnl), realizedBorrow, shortClosed);
    }

    private static Position open(String userId, String ticker, long signedQty, BigDecimal price, Instant now) {
        return Position.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .ticker(ticker)
                .quantity(signedQty)
                .averageCost(price)
                .accruedBorrow(BigDecimal.ZERO)
                .openedAt(now)
                .lastBorrowAccrualAt(signedQty < 0 ? now : null)
                .build();
    }

    /**
     * Result of one fill against a position. {@code position} is null when the fill
     * leaves the user flat.
     */
    @Value
    static class Leg {
        Position position;
        BigDecimal realizedPnl;
        BigDecimal realizedBorrow;
        long closedShortQuantity;
    }
}
