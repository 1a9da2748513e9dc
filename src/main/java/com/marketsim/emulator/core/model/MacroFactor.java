package com.marketsim.emulator.core.model;

import lombok.Getter;

/**
 * Shared latent factors evolved once per tick as clamped AR(1) processes.
 */
@Getter
public enum MacroFactor {
    RISK_ON(0.970, 0.0009, 0.004, 0.004, 0.020),
    USD(0.980, 0.0004, 0.002, 0.002, 0.010),
    RATES(0.985, 0.0003, 0.002, 0.002, 0.010),
    ENERGY(0.960, 0.0010, 0.005, 0.005, 0.025),
    METALS(0.970, 0.0007, 0.003, 0.003, 0.020),
    CRYPTO(0.950, 0.0016, 0.006, 0.008, 0.040),
    VOL(0.940, 0.0012, 0.005, 0.006, 0.030);

    private final double persistence;
    private final double noiseScale;
    private final double jumpProbability;
    private final double jumpScale;
    private final double clampAbs;

    MacroFactor(double persistence, double noiseScale, double jumpProbability, double jumpScale, double clampAbs) {
        this.persistence = persistence;
        this.noiseScale = noiseScale;
        this.jumpProbability = jumpProbability;
        this.jumpScale = jumpScale;
        this.clampAbs = clampAbs;
    }
}
