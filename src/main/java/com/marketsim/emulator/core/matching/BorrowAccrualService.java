package com.marketsim.emulator.core.matching;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.execution.ExecutionCostModel;
import com.marketsim.emulator.core.instrument.InstrumentCatalog;
import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.InstrumentDefinition;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeType;
import com.marketsim.emulator.core.price.PriceStateStore;
import com.marketsim.emulator.core.store.ExchangeStore;
import com.marketsim.emulator.core.store.LockContentionException;
import com.marketsim.emulator.core.support.Numbers;
import com.marketsim.emulator.core.support.RateLimitedLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Charges short borrow periodically. Each short is re-read under its account and position
 * locks so a concurrent fill that closes or resets the position is never double-charged.
 */
@Slf4j
@Service
public class BorrowAccrualService {

    private final ExchangeStore store;
    private final InstrumentCatalog catalog;
    private final PriceStateStore priceStates;
    private final ExecutionCostModel costModel;
    private final RateLimitedLogger errorLog;
    private final long accrualIntervalMs;

    public BorrowAccrualService(ExchangeStore store, InstrumentCatalog catalog, PriceStateStore priceStates,
                                ExecutionCostModel costModel, Clock clock, EmulatorProperties properties) {
        this.store = store;
        this.catalog = catalog;
        this.priceStates = priceStates;
        this.costModel = costModel;
        this.errorLog = new RateLimitedLogger(log, clock, properties.getEngine().getErrorLogIntervalMs());
        this.accrualIntervalMs = properties.getBorrow().getAccrualIntervalMs();
    }

    /**
     * @return number of positions charged
     */
    public int accrue(RegimeType regime, Instant now) {
        int charged = 0;
        for (Position candidate : store.findShortPositions()) {
            if (!due(candidate, now)) {
                continue;
            }
            InstrumentDefinition def = catalog.find(candidate.getTicker()).orElse(null);
            PriceState state = priceStates.get(candidate.getTicker()).orElse(null);
            if (def == null || state == null) {
                continue;
            }
            try {
                if (accrueOne(candidate.getUserId(), def, state.getPrice(), regime, now)) {
                    charged++;
                }
            } catch (LockContentionException e) {
                log.debug("Borrow accrual for {}/{} deferred: {}", candidate.getUserId(), candidate.getTicker(),
                        e.getMessage());
            } catch (RuntimeException e) {
                errorLog.warn("borrow", "Borrow accrual failed for " + candidate.getUserId() + "/"
                        + candidate.getTicker(), e);
            }
        }
        return charged;
    }

    private boolean accrueOne(String userId, InstrumentDefinition def, double price, RegimeType regime, Instant now) {
        return store.inTransaction(tx -> {
            Account account = tx.lockAccount(userId).orElse(null);
            Position position = tx.lockPosition(userId, def.getTicker()).orElse(null);
            if (account == null || position == null || !position.isShort() || !due(position, now)) {
                return false;
            }
            long elapsedMs = now.toEpochMilli() - lastAccrual(position).toEpochMilli();
            double notional = Math.abs(position.getQuantity()) * price;
            BigDecimal amount = Numbers.price(costModel.estimateBorrowAccrual(notional,
                    def.getMicrostructure().getBorrowAprShort(), elapsedMs, regime));
            account.debit(amount);
            BigDecimal accrued = position.getAccruedBorrow() == null ? BigDecimal.ZERO : position.getAccruedBorrow();
            position.setAccruedBorrow(accrued.add(amount));
            position.setLastBorrowAccrualAt(now);
            tx.saveAccount(account);
            tx.savePosition(position);
            log.debug("Borrow accrued: user={} ticker={} qty={} elapsedMs={} amount={}",
                    userId, def.getTicker(), position.getQuantity(), elapsedMs, amount);
            return true;
        });
    }

    private boolean due(Position position, Instant now) {
        return now.toEpochMilli() - lastAccrual(position).toEpochMilli() >= accrualIntervalMs;
    }

    static Instant lastAccrual(Position position) {
        if (position.getLastBorrowAccrualAt() != null) {
            return position.getLastBorrowAccrualAt();
        }
        return position.getOpenedAt() != null ? position.getOpenedAt() : Instant.EPOCH;
    }
}
