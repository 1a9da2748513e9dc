package com.marketsim.emulator.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-instrument behaviour knobs layered on top of the asset class defaults.
 */
@Value
@Builder(toBuilder = true)
public class InstrumentStyle {
    FactorLoadings factorLoadings;
    @Builder.Default
    double trendPersistence = 0.05;
    @Builder.Default
    double jumpProbability = 0.001;
    @Builder.Default
    double jumpScale = 3.0;
    @Builder.Default
    double meanReversionMultiplier = 1.0;
    @Builder.Default
    double anchorFollowRate = 0.01;
    @Builder.Default
    double spreadMultiplier = 1.0;
    @Builder.Default
    double volumeMultiplier = 1.0;
    @Builder.Default
    double idiosyncraticMultiplier = 1.0;

    public void validate(String ticker) {
        if (factorLoadings == null) {
            throw new IllegalArgumentException(ticker + ": factor loadings are required");
        }
        if (trendPersistence < 0 || trendPersistence >= 1) {
            throw new IllegalArgumentException(ticker + ": trendPersistence must be in [0, 1)");
        }
        if (jumpProbability < 0 || jumpProbability > 1) {
            throw new IllegalArgumentException(ticker + ": jumpProbability must be in [0, 1]");
        }
        if (anchorFollowRate < 0 || anchorFollowRate > 1) {
            throw new IllegalArgumentException(ticker + ": anchorFollowRate must be in [0, 1]");
        }
        if (jumpScale < 0 || meanReversionMultiplier < 0 || spreadMultiplier <= 0
                || volumeMultiplier <= 0 || idiosyncraticMultiplier < 0) {
            throw new IllegalArgumentException(ticker + ": style multipliers out of range");
        }
    }
}
