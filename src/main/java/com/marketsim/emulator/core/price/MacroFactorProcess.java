package com.marketsim.emulator.core.price;

import com.marketsim.emulator.core.model.MacroFactor;
import com.marketsim.emulator.core.model.MacroFactorSnapshot;
import com.marketsim.emulator.core.support.Numbers;
import com.marketsim.emulator.core.support.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

import static com.marketsim.emulator.core.model.MacroFactor.CRYPTO;
import static com.marketsim.emulator.core.model.MacroFactor.ENERGY;
import static com.marketsim.emulator.core.model.MacroFactor.METALS;
import static com.marketsim.emulator.core.model.MacroFactor.RISK_ON;
import static com.marketsim.emulator.core.model.MacroFactor.USD;
import static com.marketsim.emulator.core.model.MacroFactor.VOL;

/**
 * Evolves the shared macro factors once per tick. Each factor is a clamped AR(1) with an
 * occasional jump; cross-factor spillovers are applied after the independent step.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MacroFactorProcess {

    private static final double CRYPTO_FROM_RISK_ON = 0.035;
    private static final double ENERGY_FROM_USD = -0.02;
    private static final double METALS_FROM_USD = -0.02;
    private static final double VOL_FROM_RISK_ON = -0.04;

    private final RandomSource random;
    private final SessionClock sessionClock;
    private final double[] values = new double[MacroFactor.values().length];

    public synchronized MacroFactorSnapshot evolve(Instant now) {
        for (MacroFactor factor : MacroFactor.values()) {
            double previous = values[factor.ordinal()];
            double noise = random.nextGaussian() * factor.getNoiseScale()
                    * sessionClock.factorNoiseMultiplier(factor, now);
            double jump = random.chance(factor.getJumpProbability())
                    ? random.nextGaussian() * factor.getJumpScale()
                    : 0.0;
            set(factor, previous * factor.getPersistence() + noise + jump);
        }

        double riskOn = get(RISK_ON);
        double usd = get(USD);
        set(CRYPTO, get(CRYPTO) + riskOn * CRYPTO_FROM_RISK_ON);
        set(ENERGY, get(ENERGY) + usd * ENERGY_FROM_USD);
        set(METALS, get(METALS) + usd * METALS_FROM_USD);
        set(VOL, get(VOL) + riskOn * VOL_FROM_RISK_ON);

        return MacroFactorSnapshot.of(values);
    }

    public synchronized MacroFactorSnapshot current() {
        return MacroFactorSnapshot.of(values);
    }

    private double get(MacroFactor factor) {
        return values[factor.ordinal()];
    }

    private void set(MacroFactor factor, double value) {
        double bounded = Double.isFinite(value) ? value : 0.0;
        values[factor.ordinal()] = Numbers.clamp(bounded, -factor.getClampAbs(), factor.getClampAbs());
    }
}
