package com.marketsim.emulator.core.store;

import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.Candle;
import com.marketsim.emulator.core.model.CandleInterval;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.PriceState;
import com.marketsim.emulator.core.model.RegimeRecord;
import com.marketsim.emulator.core.model.Trade;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Persistence gateway of the exchange. Every operation may throw
 * {@link StorageUnavailableException}; reads return detached copies.
 */
public interface ExchangeStore {

    /**
     * Runs {@code work} in one transaction. Commits if it returns normally, otherwise
     * rolls back every staged write and rethrows.
     *
     * @throws LockContentionException if a row lock could not be taken in time
     */
    <T> T inTransaction(Function<LedgerTransaction, T> work);

    default void runInTransaction(Consumer<LedgerTransaction> work) {
        inTransaction(tx -> {
            work.accept(tx);
            return null;
        });
    }

    // Orders

    void insertOrder(Order order);

    Optional<Order> findOrder(UUID orderId);

    List<Order> findOpenOrders();

    List<Order> findOrdersByUser(String userId);

    // Accounts and positions

    /**
     * @return false if the account already exists
     */
    boolean createAccount(Account account);

    Optional<Account> findAccount(String userId);

    List<Position> findPositions(String userId);

    List<Position> findShortPositions();

    // Trades

    List<Trade> findTrades(String userId, int limit);

    // Market data

    void upsertPriceStates(Collection<PriceState> states);

    Map<String, PriceState> loadPriceStates();

    void upsertCandles(Collection<Candle> candles);

    List<Candle> findCandles(String ticker, CandleInterval interval, int limit);

    // Regimes

    /**
     * Ends the active regime row (if any) at {@code at} and appends {@code next}.
     */
    void recordRegimeTransition(RegimeRecord next, Instant at);

    Optional<RegimeRecord> findActiveRegime();

    List<RegimeRecord> findRegimeHistory(int limit);
}
