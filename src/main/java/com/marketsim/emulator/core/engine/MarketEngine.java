package com.marketsim.emulator.core.engine;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.event.TickEvent;
import com.marketsim.emulator.core.matching.BorrowAccrualService;
import com.marketsim.emulator.core.matching.MarginCallMonitor;
import com.marketsim.emulator.core.matching.OrderMatchingLoop;
import com.marketsim.emulator.core.model.Candle;
import com.marketsim.emulator.core.model.MacroFactorSnapshot;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.price.MacroFactorProcess;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.price.StochasticPriceProcess;
import com.marketsim.emulator.core.regime.RegimeController;
import com.marketsim.emulator.core.store.ExchangeStore;
import com.marketsim.emulator.core.store.StorageUnavailableException;
import com.marketsim.emulator.core.support.RateLimitedLogger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One tick of the exchange: macro factors, regime, prices and candles, persistence and
 * broadcast, borrow accrual, order matching and margin calls, in that order.
 * <p>
 * A tick that starts while the previous one is still running is skipped. Failures are logged
 * with rate limiting and never stop the next tick.
 */
@Slf4j
@Service
public class MarketEngine {

    private static final int MAX_PENDING_CANDLES = 10_000;

    private final ExchangeStore store;
    private final PriceStateStore priceStates;
    private final MacroFactorProcess macroFactors;
    private final RegimeController regimeController;
    private final StochasticPriceProcess priceProcess;
    private final BorrowAccrualService borrowAccrual;
    private final OrderMatchingLoop matchingLoop;
    private final MarginCallMonitor marginCallMonitor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int flushEveryTicks;
    private final RateLimitedLogger errorLog;

    private final AtomicBoolean tickInFlight = new AtomicBoolean(false);
    private final List<Candle> pendingCandles = new ArrayList<>();
    private volatile boolean paused;
    private volatile String pauseReason;
    private volatile long tickCount;

    public MarketEngine(ExchangeStore store, PriceStateStore priceStates, MacroFactorProcess macroFactors,
                        RegimeController regimeController, StochasticPriceProcess priceProcess,
                        BorrowAccrualService borrowAccrual, OrderMatchingLoop matchingLoop,
                        MarginCallMonitor marginCallMonitor, ApplicationEventPublisher eventPublisher,
                        Clock clock, EmulatorProperties properties) {
        this.store = store;
        this.priceStates = priceStates;
        this.macroFactors = macroFactors;
        this.regimeController = regimeController;
        this.priceProcess = priceProcess;
        this.borrowAccrual = borrowAccrual;
        this.matchingLoop = matchingLoop;
        this.marginCallMonitor = marginCallMonitor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.flushEveryTicks = Math.max(1, properties.getEngine().getFlushEveryTicks());
        this.errorLog = new RateLimitedLogger(log, clock, properties.getEngine().getErrorLogIntervalMs());
    }

    @PostConstruct
    public void initialize() {
        Instant now = clock.instant();
        Map<String, PriceState> persisted;
        try {
            persisted = store.loadPriceStates();
        } catch (StorageUnavailableException e) {
            errorLog.warn("restore", "Price state restore failed, seeding fresh prices", e);
            persisted = Map.of();
        }
        priceProcess.initialize(persisted, now);
        regimeController.restore(now);
        log.info("Market engine ready, regime={}", regimeController.current());
    }

    /**
     * @return false if the tick was skipped because the engine is paused or busy
     */
    public boolean runTick() {
        if (paused) {
            return false;
        }
        if (!tickInFlight.compareAndSet(false, true)) {
            log.debug("Previous tick still running, skipping");
            return false;
        }
        try {
            Instant now = clock.instant();
            long tick = ++tickCount;
            MacroFactorSnapshot factors = macroFactors.evolve(now);
            RegimeType regime = regimeController.review(now);
            StochasticPriceProcess.TickResult result = priceProcess.tick(now, factors, regime);

            bufferCandles(result.completedCandles());
            if (tick % flushEveryTicks == 0) {
                flush();
            }
            eventPublisher.publishEvent(new TickEvent(this, tick, regime, result.ticks()));

            runStage("borrow", () -> borrowAccrual.accrue(regime, now));
            runStage("match", () -> matchingLoop.matchAll(regime, now));
            runStage("margin", () -> marginCallMonitor.check(regime, now));
            return true;
        } catch (RuntimeException e) {
            errorLog.error("tick", "Tick failed", e);
            return true;
        } finally {
            tickInFlight.set(false);
        }
    }

    /**
     * Writes buffered candles and the current price table. Candles stay buffered if the
     * write fails.
     */
    public void flush() {
        List<Candle> batch;
        synchronized (pendingCandles) {
            batch = new ArrayList<>(pendingCandles);
        }
        try {
            if (!batch.isEmpty()) {
                store.upsertCandles(batch);
                synchronized (pendingCandles) {
                    pendingCandles.subList(0, batch.size()).clear();
                }
            }
            store.upsertPriceStates(priceStates.snapshot().values());
        } catch (StorageUnavailableException e) {
            errorLog.warn("flush", "Market data flush failed, " + batch.size() + " candles kept for retry", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        flush();
        log.info("Market engine stopped after {} ticks", tickCount);
    }

    public void pause(String reason) {
        if (paused) {
            return;
        }
        pauseReason = reason;
        paused = true;
        log.warn("Market engine paused ({})", reason);
    }

    public void resume() {
        if (!paused) {
            return;
        }
        paused = false;
        pauseReason = null;
        log.info("Market engine resumed");
    }

    public boolean isPaused() {
        return paused;
    }

    public String getPauseReason() {
        return pauseReason;
    }

    public long getTickCount() {
        return tickCount;
    }

    int pendingCandleCount() {
        synchronized (pendingCandles) {
            return pendingCandles.size();
        }
    }

    private void bufferCandles(List<Candle> completed) {
        if (completed.isEmpty()) {
            return;
        }
        synchronized (pendingCandles) {
            pendingCandles.addAll(completed);
            int overflow = pendingCandles.size() - MAX_PENDING_CANDLES;
            if (overflow > 0) {
                pendingCandles.subList(0, overflow).clear();
                log.warn("Candle buffer full, dropped {} oldest candles", overflow);
            }
        }
    }

    private void runStage(String stage, Runnable work) {
        try {
            work.run();
        } catch (StorageUnavailableException e) {
            errorLog.warn(stage, "Stage '" + stage + "' skipped, storage unavailable", e);
        } catch (RuntimeException e) {
            errorLog.error(stage, "Stage '" + stage + "' failed", e);
        }
    }
}
