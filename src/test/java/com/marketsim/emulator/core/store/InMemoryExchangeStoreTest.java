package com.marketsim.emulator.core.store;

import com.marketsim.emulator.config.EmulatorProperties;
import com.marketsim.emulator.core.model.Account;
import com.marketsim.emulator.core.model.Candle;
import com.marketsim.emulator.core.model.CandleInterval;
import com.marketsim.emulator.core.model.Order;
import com.marketsim.emulator.core.model.OrderSide;
import com.marketsim.emulator.core.model.OrderStatus;
import com.marketsim.emulator.core.model.OrderType;
import com.marketsim.emulator.core.model.Position;
import com.marketsim.emulator.core.model.RegimeRecord;
import com.marketsim.emulator.core.model.RegimeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryExchangeStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-05T10:00:00Z");

    private InMemoryExchangeStore store;

    @BeforeEach
    void setUp() {
        EmulatorProperties properties = new EmulatorProperties();
        properties.getExecution().setLockTimeoutMs(50);
        store = new InMemoryExchangeStore(properties);
        store.createAccount(Account.builder()
                .userId("alice")
                .cash(new BigDecimal("1000"))
                .startingCash(new BigDecimal("1000"))
                .build());
    }

    private Order order(String ocoId) {
        return Order.builder()
                .id(UUID.randomUUID())
                .userId("alice")
                .ticker("AAPL")
                .type(OrderType.MARKET)
                .side(OrderSide.BUY)
                .quantity(10)
                .ocoId(ocoId)
                .build();
    }

    @Test
    void testRollbackLeavesNoPartialMutation() {
        Order order = order(null);
        store.insertOrder(order);

        assertThrows(IllegalStateException.class, () -> store.runInTransaction(tx -> {
            Account account = tx.lockAccount("alice").orElseThrow();
            account.debit(new BigDecimal("500"));
            tx.saveAccount(account);
            Order locked = tx.lockOrder(order.getId()).orElseThrow();
            locked.fill(10, new BigDecimal("50"), NOW);
            tx.saveOrder(locked);
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, new BigDecimal("1000").compareTo(store.findAccount("alice").orElseThrow().getCash()));
        assertEquals(OrderStatus.OPEN, store.findOrder(order.getId()).orElseThrow().getStatus());
    }

    @Test
    void testCommitAppliesAllWrites() {
        store.runInTransaction(tx -> {
            Account account = tx.lockAccount("alice").orElseThrow();
            account.debit(new BigDecimal("100"));
            tx.saveAccount(account);
            tx.lockPosition("alice", "AAPL");
            tx.savePosition(Position.builder()
                    .userId("alice")
                    .ticker("AAPL")
                    .quantity(1)
                    .averageCost(new BigDecimal("100"))
                    .build());
        });

        assertEquals(0, new BigDecimal("900").compareTo(store.findAccount("alice").orElseThrow().getCash()));
        assertEquals(1, store.findPositions("alice").size());
    }

    @Test
    void testWritingUnlockedRowIsRejected() {
        assertThrows(IllegalStateException.class, () -> store.runInTransaction(tx ->
                tx.saveAccount(Account.builder().userId("alice").cash(BigDecimal.ZERO).build())));
    }

    @Test
    void testReadsReturnDetachedCopies() {
        Account copy = store.findAccount("alice").orElseThrow();
        copy.debit(new BigDecimal("1000"));

        assertEquals(0, new BigDecimal("1000").compareTo(store.findAccount("alice").orElseThrow().getCash()));
    }

    @Test
    void testZeroQuantityPositionIsDeleted() {
        store.runInTransaction(tx -> {
            tx.lockPosition("alice", "AAPL");
            tx.savePosition(Position.builder().userId("alice").ticker("AAPL").quantity(-3)
                    .averageCost(BigDecimal.TEN).build());
        });
        assertEquals(1, store.findShortPositions().size());

        store.runInTransaction(tx -> {
            Position position = tx.lockPosition("alice", "AAPL").orElseThrow();
            position.setQuantity(0);
            tx.savePosition(position);
        });
        assertTrue(store.findPositions("alice").isEmpty());
    }

    @Test
    void testLockTimeoutRaisesContention() throws Exception {
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> store.runInTransaction(tx -> {
                tx.lockAccount("alice");
                locked.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertTrue(locked.await(5, TimeUnit.SECONDS));

            LockContentionException e = assertThrows(LockContentionException.class,
                    () -> store.runInTransaction(tx -> tx.lockAccount("alice")));
            assertEquals("account:alice", e.getRowKey());
            assertEquals(1, store.rowLockCount());

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            store.runInTransaction(tx -> tx.lockAccount("alice"));
            assertEquals(0, store.rowLockCount());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testRowLocksAreDroppedOnceReleased() {
        for (int i = 0; i < 2000; i++) {
            Order order = order(null);
            store.insertOrder(order);
            store.runInTransaction(tx -> {
                Order locked = tx.lockOrder(order.getId()).orElseThrow();
                tx.lockAccount("alice");
                tx.lockPosition("alice", "AAPL");
                locked.cancel(NOW);
                tx.saveOrder(locked);
            });
        }
        assertTrue(store.findOpenOrders().isEmpty());
        assertEquals(0, store.rowLockCount());

        Order failing = order(null);
        store.insertOrder(failing);
        assertThrows(IllegalStateException.class, () -> store.runInTransaction(tx -> {
            tx.lockOrder(failing.getId());
            throw new IllegalStateException("boom");
        }));
        assertEquals(0, store.rowLockCount());
    }

    @Test
    void testOutageFailsEveryOperation() {
        store.setAvailable(false);

        assertThrows(StorageUnavailableException.class, () -> store.findAccount("alice"));
        assertThrows(StorageUnavailableException.class, () -> store.findOpenOrders());
        assertThrows(StorageUnavailableException.class, () -> store.runInTransaction(tx -> tx.lockAccount("alice")));

        store.setAvailable(true);
        assertTrue(store.findAccount("alice").isPresent());
    }

    @Test
    void testCandleUpsertMergesByKey() {
        long openTime = CandleInterval.ONE_MINUTE.bucketStart(NOW.toEpochMilli());
        Candle first = Candle.builder().ticker("AAPL").interval(CandleInterval.ONE_MINUTE).openTime(openTime)
                .open(100).high(101).low(99).close(100.5).volume(10).build();
        Candle again = Candle.builder().ticker("AAPL").interval(CandleInterval.ONE_MINUTE).openTime(openTime)
                .open(100).high(102).low(99.5).close(101.5).volume(5).build();

        store.upsertCandles(List.of(first));
        store.upsertCandles(List.of(again));

        List<Candle> stored = store.findCandles("AAPL", CandleInterval.ONE_MINUTE, 10);
        assertEquals(1, stored.size());
        Candle merged = stored.get(0);
        assertEquals(100, merged.getOpen(), 1e-9);
        assertEquals(102, merged.getHigh(), 1e-9);
        assertEquals(99, merged.getLow(), 1e-9);
        assertEquals(101.5, merged.getClose(), 1e-9);
        assertEquals(15, merged.getVolume(), 1e-9);
    }

    @Test
    void testFindCandlesReturnsNewestOldestFirst() {
        long base = CandleInterval.ONE_MINUTE.bucketStart(NOW.toEpochMilli());
        for (int i = 0; i < 5; i++) {
            store.upsertCandles(List.of(Candle.seed("AAPL", CandleInterval.ONE_MINUTE, base + i * 60_000L, 100 + i, 1)));
        }

        List<Candle> candles = store.findCandles("AAPL", CandleInterval.ONE_MINUTE, 3);

        assertEquals(3, candles.size());
        assertEquals(base + 2 * 60_000L, candles.get(0).getOpenTime());
        assertEquals(base + 4 * 60_000L, candles.get(2).getOpenTime());
    }

    @Test
    void testOcoSiblingsExcludeTerminalOrders() {
        Order a = order("X");
        Order b = order("X");
        Order c = order("X");
        c.cancel(NOW);
        store.insertOrder(a);
        store.insertOrder(b);
        store.insertOrder(c);

        List<Order> siblings = store.inTransaction(tx -> tx.lockOcoSiblings("X", a.getId()));

        assertEquals(1, siblings.size());
        assertEquals(b.getId(), siblings.get(0).getId());
    }

    @Test
    void testRegimeTransitionEndsPreviousRow() {
        RegimeRecord normal = RegimeRecord.builder().id(UUID.randomUUID()).regime(RegimeType.NORMAL)
                .startedAt(NOW).reason(RegimeRecord.Reason.INITIAL).build();
        RegimeRecord shock = RegimeRecord.builder().id(UUID.randomUUID()).regime(RegimeType.EVENT_SHOCK)
                .startedAt(NOW.plusSeconds(60)).reason(RegimeRecord.Reason.NEWS_SHOCK).build();

        store.recordRegimeTransition(normal, NOW);
        store.recordRegimeTransition(shock, NOW.plusSeconds(60));

        assertEquals(RegimeType.EVENT_SHOCK, store.findActiveRegime().orElseThrow().getRegime());
        List<RegimeRecord> history = store.findRegimeHistory(10);
        assertEquals(2, history.size());
        assertFalse(history.get(1).isActive());
        assertEquals(NOW.plusSeconds(60), history.get(1).getEndedAt());
    }

    @Test
    void testDuplicateAccountRejected() {
        assertFalse(store.createAccount(Account.builder().userId("alice").cash(BigDecimal.ONE).build()));
    }
}
