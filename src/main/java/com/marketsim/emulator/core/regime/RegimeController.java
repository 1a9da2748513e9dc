package com.marketsim.emulator.core.regime;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.event.RegimeChangedEvent;
import com.marketsim.emulator.core.model.RegimeRecord;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.store.ExchangeStore;
import com.marketsim.emulator.core.store.StorageUnavailableException;
import com.marketsim.emulator.core.support.RandomSource;
import com.marketsim.emulator.core.support.RateLimitedLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Global market regime state machine.
 * <p>
 * The regime is re-drawn on a jittered schedule using {@link RegimeType#getScheduleWeight()}.
 * A large news shock forces {@link RegimeType#EVENT_SHOCK} for a fixed hold period during
 * which the schedule is suspended; when the hold expires a scheduled draw happens at once.
 */
@Slf4j
@Service
public class RegimeController {

    private final ExchangeStore store;
    private final RandomSource random;
    private final ApplicationEventPublisher eventPublisher;
    private final EmulatorProperties.Regime config;
    private final RateLimitedLogger errorLog;

    private RegimeRecord active;
    private long nextReviewAt;
    private long shockHoldUntil;

    public RegimeController(ExchangeStore store, RandomSource random, Clock clock,
                            ApplicationEventPublisher eventPublisher, EmulatorProperties properties) {
        this.store = store;
        this.random = random;
        this.eventPublisher = eventPublisher;
        this.config = properties.getRegime();
        this.errorLog = new RateLimitedLogger(log, clock, properties.getEngine().getErrorLogIntervalMs());
        this.active = RegimeRecord.builder()
                .id(UUID.randomUUID())
                .regime(RegimeType.NORMAL)
                .startedAt(clock.instant())
                .reason(RegimeRecord.Reason.INITIAL)
                .build();
        scheduleNextReview(clock.millis());
    }

    /**
     * Picks up the unended regime row left by a previous run, or starts in NORMAL.
     */
    public synchronized void restore(Instant now) {
        Optional<RegimeRecord> persisted;
        try {
            persisted = store.findActiveRegime();
        } catch (StorageUnavailableException e) {
            errorLog.warn("regime-restore", "Regime restore failed, starting in NORMAL", e);
            persisted = Optional.empty();
        }
        if (persisted.isPresent()) {
            active = persisted.get();
            if (active.getRegime() == RegimeType.EVENT_SHOCK) {
                shockHoldUntil = active.getStartedAt().toEpochMilli() + config.getEventShockHoldMs();
            }
            log.info("Restored regime {} (started at {})", active.getRegime(), active.getStartedAt());
        } else {
            transition(RegimeType.NORMAL, RegimeRecord.Reason.INITIAL, now);
        }
        scheduleNextReview(now.toEpochMilli());
    }

    /**
     * Called once per tick before prices move.
     *
     * @return the regime in force for this tick
     */
    public synchronized RegimeType review(Instant now) {
        long nowMs = now.toEpochMilli();
        if (shockHoldUntil > 0) {
            if (nowMs < shockHoldUntil) {
                return active.getRegime();
            }
            shockHoldUntil = 0;
            RegimeType next = drawScheduled();
            log.info("Event shock hold expired, scheduled draw gave {}", next);
            transition(next, RegimeRecord.Reason.SHOCK_EXPIRED, now);
            scheduleNextReview(nowMs);
            return active.getRegime();
        }
        if (nowMs >= nextReviewAt) {
            RegimeType next = drawScheduled();
            if (next != active.getRegime()) {
                transition(next, RegimeRecord.Reason.SCHEDULED, now);
            } else {
                log.debug("Scheduled regime review kept {}", next);
            }
            scheduleNextReview(nowMs);
        }
        return active.getRegime();
    }

    /**
     * Forces EVENT_SHOCK for the configured hold period, or extends the hold if already in it.
     */
    public synchronized void forceEventShock(Instant now) {
        shockHoldUntil = now.toEpochMilli() + config.getEventShockHoldMs();
        if (active.getRegime() != RegimeType.EVENT_SHOCK) {
            transition(RegimeType.EVENT_SHOCK, RegimeRecord.Reason.NEWS_SHOCK, now);
        } else {
            log.info("Event shock hold extended until {}", Instant.ofEpochMilli(shockHoldUntil));
        }
    }

    public synchronized RegimeType current() {
        return active.getRegime();
    }

    public synchronized RegimeRecord currentRecord() {
        return active.copy();
    }

    /**
     * @return epoch millis until which a news shock pins the regime, 0 when no hold is active
     */
    public synchronized long getShockHoldUntil() {
        return shockHoldUntil;
    }

    public synchronized long getNextReviewAt() {
        return nextReviewAt;
    }

    private void transition(RegimeType next, RegimeRecord.Reason reason, Instant now) {
        RegimeType previous = active.getRegime();
        RegimeRecord record = RegimeRecord.builder()
                .id(UUID.randomUUID())
                .regime(next)
                .startedAt(now)
                .reason(reason)
                .build();
        active = record;
        try {
            store.recordRegimeTransition(record, now);
        } catch (StorageUnavailableException e) {
            errorLog.warn("regime-persist", "Regime transition not persisted", e);
        }
        log.info("Regime {} -> {} ({})", previous, next, reason);
        eventPublisher.publishEvent(new RegimeChangedEvent(this, previous, record.copy()));
    }

    RegimeType drawScheduled() {
        int total = 0;
        for (RegimeType type : RegimeType.values()) {
            total += type.getScheduleWeight();
        }
        double pick = random.nextDouble() * total;
        double cumulative = 0;
        for (RegimeType type : RegimeType.values()) {
            cumulative += type.getScheduleWeight();
            if (pick < cumulative) {
                return type;
            }
        }
        return RegimeType.NORMAL;
    }

    private void scheduleNextReview(long nowMs) {
        double jitter = random.uniform(-config.getReviewJitterPct(), config.getReviewJitterPct());
        nextReviewAt = nowMs + Math.max(1L, Math.round(config.getReviewIntervalMs() * (1 + jitter)));
    }
}
