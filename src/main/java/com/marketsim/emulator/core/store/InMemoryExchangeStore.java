package com.marketsim.emulator.core.store;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.Candle;
import com.marketsim.emulator.core.model.CandleInterval;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeRecord;
import com.marketsim.emulator.core.model.Trade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reference {@link ExchangeStore} keeping every table in memory.
 * <p>
 * Row locks are {@link ReentrantLock}s keyed by table and primary key and acquired with a
 * bounded wait. An entry lives only while some transaction holds or waits for it. Table reads and commits synchronize on a single monitor, so a reader never
 * observes half of a commit.
 */
@Slf4j
@Component
public class InMemoryExchangeStore implements ExchangeStore {

    private final Object tables = new Object();
    private final Map<UUID, Order> orders = new LinkedHashMap<>();
    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<Trade> trades = new ArrayList<>();
    private final Map<String, PriceState> priceStates = new HashMap<>();
    private final Map<String, Candle> candles = new HashMap<>();
    private final List<RegimeRecord> regimes = new ArrayList<>();

    private final Map<String, RowLock> rowLocks = new ConcurrentHashMap<>();
    private final long lockTimeoutMs;
    private volatile boolean available = true;

    public InMemoryExchangeStore(EmulatorProperties properties) {
        this.lockTimeoutMs = properties.getExecution().getLockTimeoutMs();
    }

    /**
     * Simulates a storage outage: while unavailable every operation throws
     * {@link StorageUnavailableException}.
     */
    public void setAvailable(boolean available) {
        if (this.available != available) {
            log.warn("Exchange store is now {}", available ? "available" : "UNAVAILABLE");
        }
        this.available = available;
    }

    public boolean isAvailable() {
        return available;
    }

    @Override
    public <T> T inTransaction(Function<LedgerTransaction, T> work) {
        checkAvailable();
        Transaction tx = new Transaction();
        try {
            T result = work.apply(tx);
            checkAvailable();
            tx.commit();
            return result;
        } catch (RuntimeException e) {
            tx.discard();
            throw e;
        } finally {
            tx.releaseLocks();
        }
    }

    // Orders

    @Override
    public void insertOrder(Order order) {
        checkAvailable();
        synchronized (tables) {
            if (orders.putIfAbsent(order.getId(), order.copy()) != null) {
                throw new IllegalArgumentException("Order already exists: " + order.getId());
            }
        }
    }

    @Override
    public Optional<Order> findOrder(UUID orderId) {
        checkAvailable();
        synchronized (tables) {
            return Optional.ofNullable(orders.get(orderId)).map(Order::copy);
        }
    }

    @Override
    public List<Order> findOpenOrders() {
        checkAvailable();
        synchronized (tables) {
            return orders.values().stream()
                    .filter(Order::isWorking)
                    .map(Order::copy)
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<Order> findOrdersByUser(String userId) {
        checkAvailable();
        synchronized (tables) {
            return orders.values().stream()
                    .filter(o -> o.getUserId().equals(userId))
                    .map(Order::copy)
                    .collect(Collectors.toList());
        }
    }

    // Accounts and positions

    @Override
    public boolean createAccount(Account account) {
        checkAvailable();
        synchronized (tables) {
            return accounts.putIfAbsent(account.getUserId(), account.copy()) == null;
        }
    }

    @Override
    public Optional<Account> findAccount(String userId) {
        checkAvailable();
        synchronized (tables) {
            return Optional.ofNullable(accounts.get(userId)).map(Account::copy);
        }
    }

    @Override
    public List<Position> findPositions(String userId) {
        checkAvailable();
        synchronized (tables) {
            return positions.values().stream()
                    .filter(p -> p.getUserId().equals(userId))
                    .map(Position::copy)
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<Position> findShortPositions() {
        checkAvailable();
        synchronized (tables) {
            return positions.values().stream()
                    .filter(Position::isShort)
                    .map(Position::copy)
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<Trade> findTrades(String userId, int limit) {
        checkAvailable();
        synchronized (tables) {
            List<Trade> result = new ArrayList<>();
            for (int i = trades.size() - 1; i >= 0 && result.size() < limit; i--) {
                Trade trade = trades.get(i);
                if (trade.getUserId().equals(userId)) {
                    result.add(trade);
                }
            }
            return result;
        }
    }

    // Market data

    @Override
    public void upsertPriceStates(Collection<PriceState> states) {
        checkAvailable();
        synchronized (tables) {
            for (PriceState state : states) {
                priceStates.put(state.getTicker(), state.copy());
            }
        }
    }

    @Override
    public Map<String, PriceState> loadPriceStates() {
        checkAvailable();
        synchronized (tables) {
            Map<String, PriceState> copy = new HashMap<>();
            priceStates.forEach((ticker, state) -> copy.put(ticker, state.copy()));
            return copy;
        }
    }

    @Override
    public void upsertCandles(Collection<Candle> batch) {
        checkAvailable();
        synchronized (tables) {
            for (Candle candle : batch) {
                Candle existing = candles.get(candle.key());
                if (existing == null) {
                    candles.put(candle.key(), candle.copy());
                } else {
                    existing.absorb(candle);
                }
            }
        }
    }

    /**
     * @return the newest {@code limit} bars, oldest first
     */
    @Override
    public List<Candle> findCandles(String ticker, CandleInterval interval, int limit) {
        checkAvailable();
        synchronized (tables) {
            List<Candle> newest = candles.values().stream()
                    .filter(c -> c.getTicker().equals(ticker) && c.getInterval() == interval)
                    .sorted(Comparator.comparingLong(Candle::getOpenTime).reversed())
                    .limit(Math.max(0, limit))
                    .map(Candle::copy)
                    .collect(Collectors.toList());
            newest.sort(Comparator.comparingLong(Candle::getOpenTime));
            return newest;
        }
    }

    // Regimes

    @Override
    public void recordRegimeTransition(RegimeRecord next, Instant at) {
        checkAvailable();
        synchronized (tables) {
            for (RegimeRecord record : regimes) {
                if (record.isActive()) {
                    record.setEndedAt(at);
                }
            }
            regimes.add(next.copy());
        }
    }

    @Override
    public Optional<RegimeRecord> findActiveRegime() {
        checkAvailable();
        synchronized (tables) {
            for (int i = regimes.size() - 1; i >= 0; i--) {
                if (regimes.get(i).isActive()) {
                    return Optional.of(regimes.get(i).copy());
                }
            }
            return Optional.empty();
        }
    }

    @Override
    public List<RegimeRecord> findRegimeHistory(int limit) {
        checkAvailable();
        synchronized (tables) {
            List<RegimeRecord> result = new ArrayList<>();
            for (int i = regimes.size() - 1; i >= 0 && result.size() < limit; i--) {
                result.add(regimes.get(i).copy());
            }
            return result;
        }
    }

    private void checkAvailable() {
        if (!available) {
            throw new StorageUnavailableException("Exchange store is unavailable");
        }
    }

    private static String orderKey(UUID orderId) {
        return "order:" + orderId;
    }

    private static String accountKey(String userId) {
        return "account:" + userId;
    }

    private static String positionKey(String userId, String ticker) {
        return userId + "|" + ticker;
    }

    int rowLockCount() {
        return rowLocks.size();
    }

    private void releaseRowLock(String key) {
        rowLocks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    // users counts holders plus waiters and only changes inside compute
    private static final class RowLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    private class Transaction implements LedgerTransaction {
        private final List<String> held = new ArrayList<>();
        private final Set<String> lockedKeys = new HashSet<>();
        private final Map<UUID, Order> stagedOrders = new LinkedHashMap<>();
        private final Map<String, Account> stagedAccounts = new LinkedHashMap<>();
        // Empty optional marks a deletion
        private final Map<String, Optional<Position>> stagedPositions = new LinkedHashMap<>();
        private final List<Trade> stagedTrades = new ArrayList<>();

        @Override
        public Optional<Order> lockOrder(UUID orderId) {
            lock(orderKey(orderId));
            Order staged = stagedOrders.get(orderId);
            if (staged != null) {
                return Optional.of(staged.copy());
            }
            synchronized (tables) {
                return Optional.ofNullable(orders.get(orderId)).map(Order::copy);
            }
        }

        @Override
        public Optional<Account> lockAccount(String userId) {
            lock(accountKey(userId));
            Account staged = stagedAccounts.get(userId);
            if (staged != null) {
                return Optional.of(staged.copy());
            }
            synchronized (tables) {
                return Optional.ofNullable(accounts.get(userId)).map(Account::copy);
            }
        }

        @Override
        public Optional<Position> lockPosition(String userId, String ticker) {
            String key = positionKey(userId, ticker);
            lock("position:" + key);
            if (stagedPositions.containsKey(key)) {
                return stagedPositions.get(key).map(Position::copy);
            }
            synchronized (tables) {
                return Optional.ofNullable(positions.get(key)).map(Position::copy);
            }
        }

        @Override
        public List<Order> lockOcoSiblings(String ocoId, UUID exceptOrderId) {
            if (ocoId == null) {
                return List.of();
            }
            List<UUID> candidates;
            synchronized (tables) {
                candidates = orders.values().stream()
                        .filter(o -> ocoId.equals(o.getOcoId()) && !o.getId().equals(exceptOrderId))
                        .map(Order::getId)
                        .collect(Collectors.toList());
            }
            List<Order> siblings = new ArrayList<>();
            for (UUID id : candidates) {
                lockOrder(id).filter(Order::isWorking).ifPresent(siblings::add);
            }
            return siblings;
        }

        @Override
        public void saveOrder(Order order) {
            requireLocked(orderKey(order.getId()));
            stagedOrders.put(order.getId(), order.copy());
        }

        @Override
        public void saveAccount(Account account) {
            requireLocked(accountKey(account.getUserId()));
            stagedAccounts.put(account.getUserId(), account.copy());
        }

        @Override
        public void savePosition(Position position) {
            String key = positionKey(position.getUserId(), position.getTicker());
            requireLocked("position:" + key);
            if (position.getQuantity() == 0) {
                stagedPositions.put(key, Optional.empty());
            } else {
                stagedPositions.put(key, Optional.of(position.copy()));
            }
        }

        @Override
        public void deletePosition(String userId, String ticker) {
            String key = positionKey(userId, ticker);
            requireLocked("position:" + key);
            stagedPositions.put(key, Optional.empty());
        }

        @Override
        public void appendTrade(Trade trade) {
            stagedTrades.add(trade);
        }

        void commit() {
            synchronized (tables) {
                orders.putAll(stagedOrders);
                accounts.putAll(stagedAccounts);
                stagedPositions.forEach((key, position) -> {
                    if (position.isPresent()) {
                        positions.put(key, position.get());
                    } else {
                        positions.remove(key);
                    }
                });
                trades.addAll(stagedTrades);
            }
            discard();
        }

        void discard() {
            stagedOrders.clear();
            stagedAccounts.clear();
            stagedPositions.clear();
            stagedTrades.clear();
        }

        void releaseLocks() {
            for (int i = held.size() - 1; i >= 0; i--) {
                String key = held.get(i);
                rowLocks.get(key).lock.unlock();
                releaseRowLock(key);
            }
            held.clear();
            lockedKeys.clear();
        }

        private void lock(String key) {
            if (lockedKeys.contains(key)) {
                return;
            }
            RowLock rowLock = rowLocks.compute(key, (k, existing) -> {
                RowLock entry = existing == null ? new RowLock() : existing;
                entry.users++;
                return entry;
            });
            boolean acquired;
            try {
                acquired = rowLock.lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                releaseRowLock(key);
                throw new LockContentionException(key, lockTimeoutMs);
            }
            if (!acquired) {
                releaseRowLock(key);
                throw new LockContentionException(key, lockTimeoutMs);
            }
            held.add(key);
            lockedKeys.add(key);
        }

        private void requireLocked(String key) {
            if (!lockedKeys.contains(key)) {
                throw new IllegalStateException("Row " + key + " must be locked before it is written");
            }
        }
    }
}
