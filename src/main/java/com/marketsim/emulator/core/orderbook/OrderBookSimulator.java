package com.marketsim.emulator.core.orderbook;

import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderBook;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.OrderType;
import com.marketsim.emulator.core.model.PriceLevel;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.store.ExchangeStore;
import com.marketsim.emulator.core.support.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

/**
 * Builds a display order book around the live price. The depth is simulated; only the
 * resting user limit orders merged into it are real. Fills never consult this book.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderBookSimulator {

    static final int LEVELS = 10;
    private static final double STEP_VOL_FRACTION = 0.015;
    private static final long TOP_LEVEL_QTY = 800;
    private static final long QTY_DECAY_PER_LEVEL = 50;

    private final InstrumentCatalog catalog;
    private final PriceStateStore priceStates;
    private final ExchangeStore store;
    private final RandomSource random;
    private final Clock clock;

    public Optional<OrderBook> generate(String ticker) {
        Optional<InstrumentDefinition> def = catalog.find(ticker);
        Optional<PriceState> state = priceStates.get(ticker);
        if (def.isEmpty() || state.isEmpty()) {
            return Optional.empty();
        }
        List<Order> userLimits = store.findOpenOrders().stream()
                .filter(o -> o.getTicker().equals(ticker) && o.getType() == OrderType.LIMIT && o.getLimitPrice() != null)
                .toList();
        return Optional.of(generate(def.get(), state.get(), userLimits));
    }

    OrderBook generate(InstrumentDefinition def, PriceState state, List<Order> userLimits) {
        int decimals = def.getDecimals();
        double price = state.getPrice();
        double vol = state.getVolatility() > 0 ? state.getVolatility() : def.getBaseVolatility();
        double step = Math.max(price * vol * STEP_VOL_FRACTION, Math.pow(10, -decimals));

        OrderBook book = new OrderBook(def.getTicker(), scaled(price, decimals), clock.millis());
        for (int i = 0; i < LEVELS; i++) {
            long depth = TOP_LEVEL_QTY - QTY_DECAY_PER_LEVEL * i;
            addLevel(book.getBids(), scaled(price - step * (i + 1), decimals), syntheticQty(depth));
            addLevel(book.getAsks(), scaled(price + step * (i + 1), decimals), syntheticQty(depth));
        }

        for (Order order : userLimits) {
            if (!order.isWorking()) {
                continue;
            }
            NavigableMap<BigDecimal, PriceLevel> side = order.getSide() == OrderSide.BUY ? book.getBids() : book.getAsks();
            BigDecimal limit = order.getLimitPrice().setScale(decimals, RoundingMode.HALF_UP);
            PriceLevel nearest = nearestLevel(side, limit, step * 0.5);
            if (nearest != null) {
                nearest.addUserOrder(order);
            } else {
                PriceLevel level = new PriceLevel(limit, 0);
                level.addUserOrder(order);
                side.put(limit, level);
                while (side.size() > LEVELS) {
                    side.pollLastEntry();
                }
            }
        }
        log.trace("Generated book for {}: {} bids, {} asks", def.getTicker(), book.getBids().size(),
                book.getAsks().size());
        return book;
    }

    private long syntheticQty(long depth) {
        return (long) Math.floor(depth * random.uniform(0.5, 1.5));
    }

    private static void addLevel(NavigableMap<BigDecimal, PriceLevel> side, BigDecimal price, long qty) {
        PriceLevel existing = side.get(price);
        if (existing != null) {
            existing.setSyntheticQuantity(existing.getSyntheticQuantity() + qty);
        } else {
            side.put(price, new PriceLevel(price, qty));
        }
    }

    private static PriceLevel nearestLevel(NavigableMap<BigDecimal, PriceLevel> side, BigDecimal price,
                                           double tolerance) {
        PriceLevel best = null;
        double bestDistance = Double.MAX_VALUE;
        for (Map.Entry<BigDecimal, PriceLevel> entry : side.entrySet()) {
            double distance = Math.abs(entry.getKey().doubleValue() - price.doubleValue());
            if (distance < tolerance && distance < bestDistance) {
                best = entry.getValue();
                bestDistance = distance;
            }
        }
        return best;
    }

    private static BigDecimal scaled(double value, int decimals) {
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP);
    }
}
