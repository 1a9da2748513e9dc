package com.marketsim.emulator.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Static description of a tradable instrument. Loaded once at start and never mutated.
 */
@Value
@Builder
public class InstrumentDefinition {
    String ticker;
    String name;
    AssetClass assetClass;
    String sector;
    double basePrice;
    double baseVolatility;
    double drift;
    double meanReversionRate;
    Microstructure microstructure;
    InstrumentStyle style;
    int decimals;
    double minPrice;
    double maxPrice;

    public double getMaxTickMovePct() {
        return assetClass.getMaxTickMovePct();
    }

    public InstrumentDefinition validate() {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Instrument ticker is required");
        }
        if (assetClass == null) {
            throw new IllegalArgumentException(ticker + ": asset class is required");
        }
        if (!(basePrice > 0) || !(baseVolatility > 0)) {
            throw new IllegalArgumentException(ticker + ": base price and volatility must be positive");
        }
        if (meanReversionRate < 0 || meanReversionRate >= 1) {
            throw new IllegalArgumentException(ticker + ": mean reversion rate must be in [0, 1)");
        }
        if (!(minPrice > 0) || !(maxPrice > minPrice) || basePrice < minPrice || basePrice > maxPrice) {
            throw new IllegalArgumentException(ticker + ": price bounds must bracket the base price");
        }
        if (decimals < 0 || decimals > 8) {
            throw new IllegalArgumentException(ticker + ": decimals must be in [0, 8]");
        }
        if (microstructure == null || style == null) {
            throw new IllegalArgumentException(ticker + ": microstructure and style are required");
        }
        microstructure.validate(ticker);
        style.validate(ticker);
        return this;
    }
}
