package com.marketsim.emulator.core.model;

import lombok.Getter;

/**
 * Global market regimes and the multipliers they apply to liquidity, volatility, news impact
 * and short borrow cost.
 */
@Getter
public enum RegimeType {
    NORMAL(1.00, 1.00, 1.00, 1.00, 62),
    TIGHT_LIQUIDITY(1.45, 1.15, 1.10, 1.20, 18),
    HIGH_VOLATILITY(1.25, 1.60, 1.30, 1.10, 16),
    EVENT_SHOCK(1.80, 2.00, 1.80, 1.50, 4);

    private final double liquidityMultiplier;
    private final double volatilityMultiplier;
    private final double newsMultiplier;
    private final double borrowMultiplier;
    private final int scheduleWeight;

    RegimeType(double liquidityMultiplier, double volatilityMultiplier, double newsMultiplier,
               double borrowMultiplier, int scheduleWeight) {
        this.liquidityMultiplier = liquidityMultiplier;
        this.volatilityMultiplier = volatilityMultiplier;
        this.newsMultiplier = newsMultiplier;
        this.borrowMultiplier = borrowMultiplier;
        this.scheduleWeight = scheduleWeight;
    }

    public String tag() {
        return name().toLowerCase();
    }
}
