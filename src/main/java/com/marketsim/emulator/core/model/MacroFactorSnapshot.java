package com.marketsim.emulator.core.model;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable view of the macro factor vector for one tick.
 */
public final class MacroFactorSnapshot {

    public static final MacroFactorSnapshot ZERO = new MacroFactorSnapshot(new double[MacroFactor.values().length]);

    private final double[] values;

    private MacroFactorSnapshot(double[] values) {
        this.values = values;
    }

    public static MacroFactorSnapshot of(double[] values) {
        if (values.length != MacroFactor.values().length) {
            throw new IllegalArgumentException("Expected " + MacroFactor.values().length + " factor values, got " + values.length);
        }
        return new MacroFactorSnapshot(values.clone());
    }

    public double get(MacroFactor factor) {
        return values[factor.ordinal()];
    }

    public Map<MacroFactor, Double> asMap() {
        Map<MacroFactor, Double> map = new EnumMap<>(MacroFactor.class);
        for (MacroFactor factor : MacroFactor.values()) {
            map.put(factor, values[factor.ordinal()]);
        }
        return map;
    }

    @Override
    public String toString() {
        return "MacroFactorSnapshot" + Arrays.toString(values);
    }
}
