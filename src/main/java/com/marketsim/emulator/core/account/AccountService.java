package com.marketsim.emulator.core.account;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.Trade;
import com.marketsim.emulator.core.store.ExchangeStore;
import com.marketsim.emulator.core.support.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class AccountService {

    private final ExchangeStore store;
    private final Clock clock;
    private final BigDecimal initialBalance;

    public AccountService(ExchangeStore store, Clock clock, EmulatorProperties properties) {
        this.store = store;
        this.clock = clock;
        this.initialBalance = properties.getAccount().getInitialBalance();
    }

    /**
     * @param cash starting cash, or null for the configured initial balance
     * @return empty if the user already has an account
     * @throws IllegalArgumentException if the user id is blank or the cash is negative
     */
    public Optional<Account> createAccount(String userId, BigDecimal cash) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        BigDecimal starting = Numbers.money(cash != null ? cash : initialBalance);
        if (starting.signum() < 0) {
            throw new IllegalArgumentException("Starting cash must not be negative");
        }
        Account account = Account.builder()
                .userId(userId)
                .cash(starting)
                .startingCash(starting)
                .createdAt(clock.instant())
                .build();
        if (!store.createAccount(account)) {
            log.warn("Account {} already exists", userId);
            return Optional.empty();
        }
        log.info("Account created: user={} cash={}", userId, starting);
        return Optional.of(account);
    }

    public Optional<Account> findAccount(String userId) {
        return store.findAccount(userId);
    }

    public List<Position> positions(String userId) {
        return store.findPositions(userId);
    }

    public List<Trade> recentTrades(String userId, int limit) {
        return store.findTrades(userId, Math.max(1, limit));
    }
}
