package com.marketsim.emulator.core.price;

import com.marketsim.emulator.core.model.PriceState;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Owner of the live price table and the order-flow accumulators. {@link #mutate} is the only
 * way to change a state; every read returns a copy.
 */
@Component
public class PriceStateStore {

    private final Map<String, PriceState> states = new LinkedHashMap<>();
    private final Map<String, Double> orderFlow = new HashMap<>();

    public synchronized void put(PriceState state) {
        states.put(state.getTicker(), state.copy());
        orderFlow.putIfAbsent(state.getTicker(), 0.0);
    }

    /**
     * Applies {@code mutation} to the live state and returns a copy of the result.
     *
     * @throws IllegalArgumentException if the ticker has no state
     */
    public synchronized PriceState mutate(String ticker, Consumer<PriceState> mutation) {
        PriceState state = states.get(ticker);
        if (state == null) {
            throw new IllegalArgumentException("No price state for " + ticker);
        }
        mutation.accept(state);
        return state.copy();
    }

    public synchronized Optional<PriceState> get(String ticker) {
        return Optional.ofNullable(states.get(ticker)).map(PriceState::copy);
    }

    public synchronized Map<String, PriceState> snapshot() {
        Map<String, PriceState> copy = new LinkedHashMap<>();
        states.forEach((ticker, state) -> copy.put(ticker, state.copy()));
        return copy;
    }

    public synchronized boolean contains(String ticker) {
        return states.containsKey(ticker);
    }

    public synchronized void addOrderFlow(String ticker, double signedImpact) {
        if (!Double.isFinite(signedImpact)) {
            return;
        }
        orderFlow.merge(ticker, signedImpact, Double::sum);
    }

    public synchronized double pendingOrderFlow(String ticker) {
        return orderFlow.getOrDefault(ticker, 0.0);
    }

    /**
     * Returns the accumulated impact bounded to {@code ±maxAbs}, then multiplies the
     * accumulator by {@code retain} and zeroes it once it falls below {@code noiseFloor}.
     */
    public synchronized double drainOrderFlow(String ticker, double maxAbs, double retain, double noiseFloor) {
        double accumulated = orderFlow.getOrDefault(ticker, 0.0);
        if (accumulated == 0.0) {
            return 0.0;
        }
        double applied = Math.max(-maxAbs, Math.min(maxAbs, accumulated));
        double remaining = accumulated * retain;
        orderFlow.put(ticker, Math.abs(remaining) < noiseFloor ? 0.0 : remaining);
        return applied;
    }
}
