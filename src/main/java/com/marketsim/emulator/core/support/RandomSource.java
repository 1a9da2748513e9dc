package com.marketsim.emulator.core.support;

/**
 * Source of randomness for the price process, regime schedule and synthetic book.
 * Injected so that tests can run the stochastic components deterministically.
 */
public interface RandomSource {

    /**
     * Standard normal draw N(0, 1).
     */
    double nextGaussian();

    /**
     * Uniform draw in [0, 1).
     */
    double nextDouble();

    default boolean chance(double probability) {
        return probability > 0 && nextDouble() < probability;
    }

    default double uniform(double min, double max) {
        return min + nextDouble() * (max - min);
    }
}
