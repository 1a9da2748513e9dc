package com.marketsim.emulator.core.store;

import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.Trade;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Unit of work over the ledger tables. Every {@code lock*} call takes an exclusive row lock
 * held until the transaction ends and returns a private copy of the row; writes are staged
 * and only become visible on commit.
 */
public interface LedgerTransaction {

    Optional<Order> lockOrder(UUID orderId);

    Optional<Account> lockAccount(String userId);

    /**
     * Locks the user+ticker position row even when no position exists yet.
     */
    Optional<Position> lockPosition(String userId, String ticker);

    /**
     * Locks and returns the working orders sharing {@code ocoId}, excluding {@code exceptOrderId}.
     */
    List<Order> lockOcoSiblings(String ocoId, UUID exceptOrderId);

    void saveOrder(Order order);

    void saveAccount(Account account);

    void savePosition(Position position);

    void deletePosition(String userId, String ticker);

    void appendTrade(Trade trade);
}
