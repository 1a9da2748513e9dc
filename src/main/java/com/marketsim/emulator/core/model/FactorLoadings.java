package com.marketsim.emulator.core.model;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Sensitivity of one instrument to each {@link MacroFactor}.
 */
public final class FactorLoadings {

    private final double[] weights;

    private FactorLoadings(double[] weights) {
        this.weights = weights;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double get(MacroFactor factor) {
        return weights[factor.ordinal()];
    }

    public double dot(MacroFactorSnapshot factors) {
        double sum = 0.0;
        for (MacroFactor factor : MacroFactor.values()) {
            sum += weights[factor.ordinal()] * factors.get(factor);
        }
        return sum;
    }

    public FactorLoadings scaled(double multiplier) {
        double[] scaled = weights.clone();
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] *= multiplier;
        }
        return new FactorLoadings(scaled);
    }

    public Map<MacroFactor, Double> asMap() {
        Map<MacroFactor, Double> map = new EnumMap<>(MacroFactor.class);
        for (MacroFactor factor : MacroFactor.values()) {
            map.put(factor, weights[factor.ordinal()]);
        }
        return map;
    }

    @Override
    public String toString() {
        return "FactorLoadings" + Arrays.toString(weights);
    }

    public static final class Builder {
        private final double[] weights = new double[MacroFactor.values().length];

        public Builder with(MacroFactor factor, double weight) {
            if (!Double.isFinite(weight)) {
                throw new IllegalArgumentException("Loading for " + factor + " must be finite");
            }
            weights[factor.ordinal()] = weight;
            return this;
        }

        public FactorLoadings build() {
            return new FactorLoadings(weights.clone());
        }
    }
}
