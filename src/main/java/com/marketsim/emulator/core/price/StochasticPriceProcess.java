package com.marketsim.emulator.core.price;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.Candle;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.InstrumentStyle;
import com.marketsim.emulator.core.model.MacroFactorSnapshot;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.model.TickSnapshot;
import com.marketsim.emulator.core.support.Numbers;
import com.marketsim.emulator.core.support.RandomSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-tick price formation for every listed instrument: GARCH(1,1) volatility, macro factor
 * exposure, momentum, jumps, anchored mean reversion and user order-flow impact, bounded by
 * the class max tick move and the instrument price band.
 */
@Slf4j
@Service
public class StochasticPriceProcess {

    private static final double OMEGA_FRACTION = 0.03;
    private static final double FACTOR_VOL_COUPLING = 0.05;
    private static final double SPREAD_VOL_FRACTION = 0.05;
    private static final double MIN_SPREAD_FRACTION = 0.000001;

    private final InstrumentCatalog catalog;
    private final PriceStateStore stateStore;
    private final CandleAggregator candleAggregator;
    private final SessionClock sessionClock;
    private final RandomSource random;
    private final EmulatorProperties.Price config;

    public StochasticPriceProcess(InstrumentCatalog catalog, PriceStateStore stateStore,
                                  CandleAggregator candleAggregator, SessionClock sessionClock,
                                  RandomSource random, EmulatorProperties properties) {
        this.catalog = catalog;
        this.stateStore = stateStore;
        this.candleAggregator = candleAggregator;
        this.sessionClock = sessionClock;
        this.random = random;
        this.config = properties.getPrice();
    }

    /**
     * Loads the live table: persisted states where available, otherwise a fresh start a small
     * random offset away from the base price.
     */
    public void initialize(Map<String, PriceState> persisted, Instant now) {
        LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);
        int restored = 0;
        for (InstrumentDefinition def : catalog.all()) {
            PriceState saved = persisted.get(def.getTicker());
            PriceState state = saved != null ? restore(def, saved, day) : seed(def, day);
            if (saved != null) {
                restored++;
            }
            state.setUpdatedAt(now.toEpochMilli());
            stateStore.put(state);
            candleAggregator.initialize(def.getTicker(), state.getPrice(), now.toEpochMilli());
        }
        log.info("Price process initialized: {} instruments ({} restored, {} seeded)",
                catalog.all().size(), restored, catalog.all().size() - restored);
    }

    public TickResult tick(Instant now, MacroFactorSnapshot factors, RegimeType regime) {
        List<TickSnapshot> ticks = new ArrayList<>();
        List<Candle> completed = new ArrayList<>();
        for (InstrumentDefinition def : catalog.all()) {
            if (!stateStore.contains(def.getTicker())) {
                continue;
            }
            double[] tickVolume = new double[1];
            PriceState state = stateStore.mutate(def.getTicker(),
                    s -> tickVolume[0] = step(def, s, factors, regime, now));
            completed.addAll(candleAggregator.onTick(def.getTicker(), state.getPrice(), tickVolume[0],
                    now.toEpochMilli()));
            ticks.add(toSnapshot(def, state, effectiveVolatility(def, state.getVolatility(), regime, now),
                    regime, now.toEpochMilli()));
        }
        return new TickResult(ticks, completed);
    }

    public Optional<TickSnapshot> snapshot(String ticker, RegimeType regime, Instant now) {
        Optional<InstrumentDefinition> def = catalog.find(ticker);
        Optional<PriceState> state = stateStore.get(ticker);
        if (def.isEmpty() || state.isEmpty()) {
            return Optional.empty();
        }
        double effVol = effectiveVolatility(def.get(), state.get().getVolatility(), regime, now);
        return Optional.of(toSnapshot(def.get(), state.get(), effVol, regime, state.get().getUpdatedAt()));
    }

    /**
     * Feeds a user fill back into the price: buys push up, sells push down, in proportion to
     * the notional's share of average daily dollar volume.
     */
    public void addOrderFlowImpact(String ticker, OrderSide side, double notional) {
        InstrumentDefinition def = catalog.find(ticker).orElse(null);
        if (def == null || !(notional > 0)) {
            return;
        }
        double price = stateStore.get(ticker).map(PriceState::getPrice).orElse(def.getBasePrice());
        double impact = price * (notional / def.getMicrostructure().getAvgDailyDollarVolume())
                * config.getOrderFlowSensitivity();
        stateStore.addOrderFlow(ticker, side.sign() * impact);
        log.debug("Order flow {} {} notional={} impact={}", side, ticker, notional, impact);
    }

    public double volatilityCeiling(InstrumentDefinition def) {
        return def.getBaseVolatility() * config.getMaxVolFactor() * def.getAssetClass().getRiskMultiplier();
    }

    public double volatilityFloor(InstrumentDefinition def) {
        return def.getBaseVolatility() * config.getMinVolFactor();
    }

    /**
     * GARCH level scaled by the session and regime multipliers.
     */
    public double effectiveVolatility(InstrumentDefinition def, double garchVolatility, RegimeType regime, Instant now) {
        return garchVolatility
                * sessionClock.volatilityMultiplier(def.getAssetClass(), now)
                * regime.getVolatilityMultiplier();
    }

    /**
     * Spread for a given price and effective volatility, never narrower than a tiny fraction
     * of the price.
     */
    public double spread(InstrumentDefinition def, double price, double effectiveVolatility, RegimeType regime) {
        double spread = price * effectiveVolatility * SPREAD_VOL_FRACTION
                * config.getSpreadMultiplier()
                * regime.getLiquidityMultiplier()
                * def.getStyle().getSpreadMultiplier();
        return Math.max(spread, price * MIN_SPREAD_FRACTION);
    }

    /**
     * Advances one instrument by one tick.
     *
     * @return the volume traded this tick
     */
    private double step(InstrumentDefinition def, PriceState state, MacroFactorSnapshot factors,
                        RegimeType regime, Instant now) {
        rollSession(state, now);
        InstrumentStyle style = def.getStyle();
        double oldPrice = state.getPrice();
        double maxMove = def.getMaxTickMovePct();

        double factorShock = style.getFactorLoadings().dot(factors);
        double priorReturn = state.getLastReturn();
        double vol = state.getVolatility();
        double baseVol = def.getBaseVolatility();
        double variance = baseVol * baseVol * OMEGA_FRACTION
                + config.getGarchAlpha() * priorReturn * priorReturn
                + config.getGarchBeta() * vol * vol
                + Math.abs(factorShock) * vol * config.getVolOfVol() * FACTOR_VOL_COUPLING;
        double garchVol = Math.sqrt(Math.max(0, variance));
        if (!Double.isFinite(garchVol)) {
            garchVol = baseVol;
        }
        garchVol = Numbers.clamp(garchVol, volatilityFloor(def), volatilityCeiling(def));
        state.setVolatility(garchVol);
        double effVol = effectiveVolatility(def, garchVol, regime, now);

        double logReturn = def.getDrift()
                + factorShock
                + priorReturn * style.getTrendPersistence()
                + random.nextGaussian() * effVol * config.getShockMultiplier() * style.getIdiosyncraticMultiplier();
        if (random.chance(style.getJumpProbability())) {
            logReturn += random.nextGaussian() * style.getJumpScale() * effVol;
        }
        logReturn = Numbers.clamp(logReturn, -maxMove, maxMove);
        double candidate = oldPrice * Math.exp(logReturn);

        double anchor = state.getAnchor() > 0 ? state.getAnchor() : oldPrice;
        anchor += (oldPrice - anchor) * style.getAnchorFollowRate();
        state.setAnchor(anchor);
        double weight = config.getDynamicAnchorWeight();
        double target = anchor * weight + def.getBasePrice() * (1 - weight);
        candidate += (target - candidate) * def.getMeanReversionRate() * style.getMeanReversionMultiplier();

        candidate += stateStore.drainOrderFlow(def.getTicker(),
                config.getMaxOrderFlowPct() * oldPrice,
                config.getOrderFlowDecay(),
                config.getOrderFlowNoiseFloorPct() * oldPrice);

        if (!Double.isFinite(candidate) || candidate <= 0) {
            log.debug("Degenerate price candidate for {}, keeping {}", def.getTicker(), oldPrice);
            candidate = oldPrice;
        }
        double newPrice = Numbers.clamp(candidate, oldPrice * (1 - maxMove), oldPrice * (1 + maxMove));
        newPrice = Numbers.clamp(newPrice, def.getMinPrice(), def.getMaxPrice());

        state.setLastReturn(Math.log(newPrice / oldPrice));
        state.setPrice(newPrice);
        double halfSpread = spread(def, newPrice, effVol, regime) / 2.0;
        state.setBid(newPrice - halfSpread);
        state.setAsk(newPrice + halfSpread);
        state.setHigh(Math.max(state.getHigh(), newPrice));
        state.setLow(Math.min(state.getLow(), newPrice));

        double movePct = Math.abs(newPrice - oldPrice) / oldPrice;
        double tickVolume = (config.getVolumeBase() + random.uniform(0, config.getVolumeJitter()))
                * (1 + movePct * config.getVolumeMoveMultiplier())
                * (1 + effVol * config.getVolumeVolMultiplier())
                * sessionClock.volumeMultiplier(def.getAssetClass(), now)
                * style.getVolumeMultiplier();
        state.setVolume(state.getVolume() + tickVolume);
        state.setUpdatedAt(now.toEpochMilli());
        return tickVolume;
    }

    private static void rollSession(PriceState state, Instant now) {
        LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (state.getSessionDay() == null) {
            state.setSessionDay(day);
            return;
        }
        if (!day.equals(state.getSessionDay())) {
            double price = state.getPrice();
            state.setPrevClose(price);
            state.setOpen(price);
            state.setHigh(price);
            state.setLow(price);
            state.setVolume(0);
            state.setSessionDay(day);
        }
    }

    private PriceState seed(InstrumentDefinition def, LocalDate day) {
        double offset = random.uniform(-config.getStartOffsetPct(), config.getStartOffsetPct());
        double price = Numbers.clamp(def.getBasePrice() * (1 + offset), def.getMinPrice(), def.getMaxPrice());
        double halfSpread = spread(def, price, def.getBaseVolatility(), RegimeType.NORMAL) / 2.0;
        return PriceState.builder()
                .ticker(def.getTicker())
                .price(price)
                .bid(price - halfSpread)
                .ask(price + halfSpread)
                .open(price)
                .high(price)
                .low(price)
                .prevClose(price)
                .volume(0)
                .volatility(def.getBaseVolatility())
                .anchor(price)
                .lastReturn(0)
                .sessionDay(day)
                .build();
    }

    private PriceState restore(InstrumentDefinition def, PriceState saved, LocalDate day) {
        PriceState state = saved.copy();
        double price = Double.isFinite(state.getPrice()) && state.getPrice() > 0
                ? Numbers.clamp(state.getPrice(), def.getMinPrice(), def.getMaxPrice())
                : def.getBasePrice();
        state.setPrice(price);
        if (!(state.getVolatility() > 0)) {
            state.setVolatility(def.getBaseVolatility());
        }
        state.setVolatility(Numbers.clamp(state.getVolatility(), volatilityFloor(def), volatilityCeiling(def)));
        if (!(state.getAnchor() > 0)) {
            state.setAnchor(price);
        }
        if (!(state.getBid() < price && price < state.getAsk())) {
            double halfSpread = spread(def, price, state.getVolatility(), RegimeType.NORMAL) / 2.0;
            state.setBid(price - halfSpread);
            state.setAsk(price + halfSpread);
        }
        if (!(state.getPrevClose() > 0)) {
            state.setPrevClose(price);
        }
        if (!(state.getOpen() > 0)) {
            state.setOpen(price);
        }
        state.setHigh(Math.max(state.getHigh(), price));
        state.setLow(state.getLow() > 0 ? Math.min(state.getLow(), price) : price);
        if (state.getSessionDay() == null) {
            state.setSessionDay(day);
        }
        return state;
    }

    private static TickSnapshot toSnapshot(InstrumentDefinition def, PriceState state, double effectiveVolatility,
                                           RegimeType regime, long timestamp) {
        int decimals = def.getDecimals();
        double change = state.getPrice() - state.getPrevClose();
        double changePct = state.getPrevClose() > 0 ? change / state.getPrevClose() * 100 : 0;
        return TickSnapshot.builder()
                .ticker(def.getTicker())
                .price(Numbers.round(state.getPrice(), decimals))
                .bid(Numbers.round(state.getBid(), decimals))
                .ask(Numbers.round(state.getAsk(), decimals))
                .open(Numbers.round(state.getOpen(), decimals))
                .high(Numbers.round(state.getHigh(), decimals))
                .low(Numbers.round(state.getLow(), decimals))
                .prevClose(Numbers.round(state.getPrevClose(), decimals))
                .volume(Math.floor(state.getVolume()))
                .change(Numbers.round(change, decimals))
                .changePct(Numbers.round(changePct, 2))
                .volatility(Numbers.round(effectiveVolatility, 6))
                .regime(regime)
                .timestamp(timestamp)
                .build();
    }

    public record TickResult(List<TickSnapshot> ticks, List<Candle> completedCandles) {
    }
}
