package com.marketsim.emulator.core.model;

import lombok.Getter;

/**
 * Asset classes traded on the emulator. Each class carries the microstructure defaults used by
 * the execution cost model and the risk limits used by the price process.
 */
@Getter
public enum AssetClass {
    STOCK(0.020, 1.00, 0.25, 2_500_000_000d, 2.4, 65, 1.0, 0.03),
    ETF(0.015, 0.90, 0.12, 1_200_000_000d, 1.6, 52, 1.0, 0.02),
    FUTURE(0.015, 0.90, 0.10, 4_000_000_000d, 1.8, 58, 0.8, 0.01),
    COMMODITY(0.020, 1.10, 0.15, 900_000_000d, 4.5, 78, 1.2, 0.025),
    FOREX(0.006, 0.80, 0.04, 5_000_000_000d, 0.8, 42, 0.6, 0.015),
    CRYPTO(0.035, 1.40, 0.30, 800_000_000d, 6.0, 110, 1.4, 0.08);

    private static final double DEFAULT_COMMISSION_MIN_USD = 0.01;

    private final double maxTickMovePct;
    private final double riskMultiplier;
    private final double maxNewsImpactPct;
    private final double avgDailyDollarVolume;
    private final double baseSpreadBps;
    private final double impactCoeff;
    private final double commissionBps;
    private final double borrowAprShort;

    AssetClass(double maxTickMovePct, double riskMultiplier, double maxNewsImpactPct,
               double avgDailyDollarVolume, double baseSpreadBps, double impactCoeff,
               double commissionBps, double borrowAprShort) {
        this.maxTickMovePct = maxTickMovePct;
        this.riskMultiplier = riskMultiplier;
        this.maxNewsImpactPct = maxNewsImpactPct;
        this.avgDailyDollarVolume = avgDailyDollarVolume;
        this.baseSpreadBps = baseSpreadBps;
        this.impactCoeff = impactCoeff;
        this.commissionBps = commissionBps;
        this.borrowAprShort = borrowAprShort;
    }

    public Microstructure defaultMicrostructure() {
        return Microstructure.builder()
                .avgDailyDollarVolume(avgDailyDollarVolume)
                .baseSpreadBps(baseSpreadBps)
                .impactCoeff(impactCoeff)
                .commissionBps(commissionBps)
                .commissionMinUsd(DEFAULT_COMMISSION_MIN_USD)
                .borrowAprShort(borrowAprShort)
                .build();
    }

    /**
     * Equity-like classes follow exchange session hours; FX and crypto trade around the clock.
     */
    public boolean followsEquitySession() {
        return this == STOCK || this == ETF || this == FUTURE;
    }
}
