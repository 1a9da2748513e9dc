package com.marketsim.emulator.core.support;

import java.util.Random;

public class DefaultRandomSource implements RandomSource {

    private final Random random;

    public DefaultRandomSource() {
        this.random = new Random();
    }

    public DefaultRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public double nextGaussian() {
        return random.nextGaussian();
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
