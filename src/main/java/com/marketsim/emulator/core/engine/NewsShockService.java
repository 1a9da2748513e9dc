package com.marketsim.emulator.core.engine;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.price.StochasticPriceProcess;
import com.marketsim.emulator.core.regime.RegimeController;
import com.marketsim.emulator.core.support.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies the price effect of a news event. Headline generation lives elsewhere; this only
 * moves the market.
 */
@Slf4j
@Service
public class NewsShockService {

    private final InstrumentCatalog catalog;
    private final PriceStateStore priceStates;
    private final StochasticPriceProcess priceProcess;
    private final RegimeController regimeController;
    private final Clock clock;
    private final double volatilitySpike;
    private final double eventShockThreshold;

    public NewsShockService(InstrumentCatalog catalog, PriceStateStore priceStates,
                            StochasticPriceProcess priceProcess, RegimeController regimeController,
                            Clock clock, EmulatorProperties properties) {
        this.catalog = catalog;
        this.priceStates = priceStates;
        this.priceProcess = priceProcess;
        this.regimeController = regimeController;
        this.clock = clock;
        this.volatilitySpike = properties.getPrice().getNewsVolatilitySpike();
        this.eventShockThreshold = properties.getRegime().getEventShockThresholdPct();
    }

    /**
     * Moves {@code ticker} by {@code impactPct} (a fraction, 0.02 is +2%) after scaling by the
     * regime news multiplier and bounding to the asset class maximum.
     *
     * @return the relative price move actually applied
     * @throws IllegalArgumentException for an unknown ticker
     */
    public double applyNewsShock(String ticker, double impactPct) {
        InstrumentDefinition def = catalog.get(ticker);
        if (!Double.isFinite(impactPct)) {
            throw new IllegalArgumentException("Impact must be a finite number");
        }
        RegimeType regime = regimeController.current();
        double maxImpact = def.getAssetClass().getMaxNewsImpactPct();
        double bounded = Numbers.clamp(impactPct * regime.getNewsMultiplier(), -maxImpact, maxImpact);
        double ceiling = priceProcess.volatilityCeiling(def);

        double[] applied = new double[1];
        PriceState after = priceStates.mutate(ticker, state -> {
            double oldPrice = state.getPrice();
            double newPrice = Numbers.clamp(oldPrice * (1 + bounded), def.getMinPrice(), def.getMaxPrice());
            double halfSpread = Math.max(state.getAsk() - state.getBid(), newPrice * 0.000001) / 2.0;
            state.setPrice(newPrice);
            state.setBid(newPrice - halfSpread);
            state.setAsk(newPrice + halfSpread);
            state.setHigh(Math.max(state.getHigh(), newPrice));
            state.setLow(Math.min(state.getLow(), newPrice));
            state.setVolatility(Math.min(state.getVolatility() * volatilitySpike, ceiling));
            applied[0] = newPrice / oldPrice - 1;
        });

        log.info("News shock {}: requested={} applied={} price={} volatility={}",
                ticker, impactPct, applied[0], after.getPrice(), after.getVolatility());
        if (Math.abs(applied[0]) >= eventShockThreshold) {
            Instant now = clock.instant();
            regimeController.forceEventShock(now);
        }
        return applied[0];
    }
}
