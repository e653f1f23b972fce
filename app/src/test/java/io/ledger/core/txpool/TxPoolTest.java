package io.ledger.core.txpool;

import io.ledger.core.metrics.NodeMetrics;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.state.InMemoryStateStore;
import io.ledger.core.wallet.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static io.ledger.core.txpool.SignedTxs.funded;
import static io.ledger.core.txpool.SignedTxs.transfer;
import static org.junit.jupiter.api.Assertions.*;

class TxPoolTest {

    private static final long BALANCE = 1_000_000_000L;

    private InMemoryStateStore state;
    private NodeMetrics metrics;
    private SignedTxs.ManualClock clock;
    private TxPool pool;

    @BeforeEach
    void setUp() {
        state = new InMemoryStateStore();
        metrics = new NodeMetrics();
        clock = new SignedTxs.ManualClock(1_000_000L);
        pool = newPool(TxPoolConfig.defaults());
    }

    private TxPool newPool(TxPoolConfig config) {
        TxValidator validator = new TxValidator(state, 100, 30_000_000L, config);
        return new TxPool(validator, state, config, metrics, clock);
    }

    @Test
    void budgetDeferralLeavesThirdTransactionForNextBlock() {
        Wallet alice = funded(state, BALANCE);
        Transaction t0 = transfer(alice, 0, 1, 22_000);
        Transaction t1 = transfer(alice, 1, 1, 22_000);
        Transaction t2 = transfer(alice, 2, 1, 22_000);
        pool.add(t0);
        pool.add(t1);
        pool.add(t2);

        List<Transaction> first = pool.pop(52_500);
        assertEquals(List.of(t0, t1), first);
        assertEquals(3, pool.size());
        TxLookup deferred = pool.getByHash(t2.hash()).orElseThrow();
        assertEquals(TxStatus.EXECUTABLE, deferred.status());
        assertSame(t2, deferred.transaction());

        pool.markIncluded(List.of(t0.hash(), t1.hash()));
        List<Transaction> second = pool.pop(52_500);
        assertEquals(List.of(t2), second);
    }

    @Test
    void accountWhoseHeadDoesNotFitIsSkippedWithoutLosingIt() {
        Wallet big = funded(state, BALANCE);
        Wallet small = funded(state, BALANCE);
        Transaction bigHead = transfer(big, 0, 10, 50_000);
        Transaction bigNext = transfer(big, 1, 100, 21_000);
        Transaction s0 = transfer(small, 0, 5);
        Transaction s1 = transfer(small, 1, 5);
        pool.add(bigHead);
        pool.add(bigNext);
        pool.add(s0);
        pool.add(s1);

        List<Transaction> popped = pool.pop(45_000);

        assertEquals(List.of(s0, s1), popped);
        assertEquals(TxStatus.EXECUTABLE, pool.getByHash(bigHead.hash()).orElseThrow().status());
        assertEquals(TxStatus.EXECUTABLE, pool.getByHash(bigNext.hash()).orElseThrow().status());
        assertEquals(4, pool.size());
        assertTrue(metrics.counterValue("txpool.pop.deferred") >= 1.0);
    }

    @Test
    void popOrdersByPriceThenArrival() {
        Wallet a = funded(state, BALANCE);
        Wallet b = funded(state, BALANCE);
        Wallet c = funded(state, BALANCE);
        Transaction cheap = transfer(a, 0, 5);
        Transaction early = transfer(b, 0, 10);
        Transaction late = transfer(c, 0, 10);
        pool.add(cheap);
        pool.add(early);
        pool.add(late);

        assertEquals(List.of(early, late, cheap), pool.pop(1_000_000));
    }

    @Test
    void nextNonceIsRankedAtItsOwnPrice() {
        Wallet a = funded(state, BALANCE);
        Wallet b = funded(state, BALANCE);
        Transaction a0 = transfer(a, 0, 10);
        Transaction a1 = transfer(a, 1, 1);
        Transaction b0 = transfer(b, 0, 5);
        pool.add(a1);
        pool.add(a0);
        pool.add(b0);

        assertEquals(List.of(a0, b0, a1), pool.pop(1_000_000));
    }

    @Test
    void popNeverExceedsBudget() {
        Wallet a = funded(state, BALANCE);
        Wallet b = funded(state, BALANCE);
        for (int n = 0; n < 5; n++) {
            pool.add(transfer(a, n, 3 + n, 30_000));
            pool.add(transfer(b, n, 4, 21_000 + n * 1_000));
        }
        long budget = 100_000;
        long used = pool.pop(budget).stream().mapToLong(Transaction::gasLimit).sum();
        assertTrue(used <= budget, "used " + used);
        assertTrue(used > 0);
    }

    @Test
    void replaceByFeeRequiresStrictlyHigherPrice() {
        Wallet a = funded(state, BALANCE);
        Transaction p10 = transfer(a, 5, 10);
        Transaction p20 = transfer(a, 5, 20);
        Transaction p15 = transfer(a, 5, 15);
        Transaction p20again = transfer(a, 5, 20, 21_001);

        pool.add(p10);
        pool.add(p20);
        assertEquals(1, pool.size());
        assertTrue(pool.getByHash(p10.hash()).isEmpty());
        assertEquals(20, pool.pendingTransactions().get(a.getAddress()).get(0).gasPrice());

        TxPoolException low = assertThrows(TxPoolException.class, () -> pool.add(p15));
        assertEquals(TxPoolError.UNDERPRICED, low.kind());
        TxPoolException equal = assertThrows(TxPoolException.class, () -> pool.add(p20again));
        assertEquals(TxPoolError.UNDERPRICED, equal.kind());

        assertEquals(List.of(p20), pool.pendingTransactions().get(a.getAddress()));
        assertEquals(1.0, metrics.counterValue("txpool.dropped", "reason", "replaced"));
    }

    @Test
    void resubmittingSameTransactionIsIdempotent() {
        Wallet a = funded(state, BALANCE);
        Transaction tx = transfer(a, 0, 2);

        Hash first = pool.add(tx);
        Hash second = pool.add(tx);

        assertEquals(first, second);
        assertEquals(1, pool.size());
        assertEquals(1.0, metrics.counterValue("txpool.added"));
    }

    @Test
    void selectedEntryCannotBeReplaced() {
        Wallet a = funded(state, BALANCE);
        pool.add(transfer(a, 0, 2));
        assertEquals(1, pool.pop(1_000_000).size());

        TxPoolException e = assertThrows(TxPoolException.class, () -> pool.add(transfer(a, 0, 50)));
        assertEquals(TxPoolError.UNDERPRICED, e.kind());
    }

    @Test
    void demoteRestoresSelectedEntriesWithTheirPriority() {
        Wallet a = funded(state, BALANCE);
        Wallet b = funded(state, BALANCE);
        Transaction a0 = transfer(a, 0, 10);
        Transaction a1 = transfer(a, 1, 10);
        Transaction b0 = transfer(b, 0, 5);
        pool.add(a0);
        pool.add(a1);
        pool.add(b0);

        assertEquals(List.of(a0, a1), pool.pop(42_000));
        assertEquals(TxStatus.SELECTED, pool.getByHash(a1.hash()).orElseThrow().status());

        pool.demote(List.of(a0.hash()));

        assertEquals(TxStatus.EXECUTABLE, pool.getByHash(a0.hash()).orElseThrow().status());
        assertEquals(TxStatus.EXECUTABLE, pool.getByHash(a1.hash()).orElseThrow().status());
        assertEquals(3, pool.size());
        assertEquals(List.of(a0, a1, b0), pool.pop(1_000_000));
        assertEquals(2.0, metrics.counterValue("txpool.demoted"));
    }

    @Test
    void gapClosesWhenMissingNonceArrives() {
        Wallet a = funded(state, BALANCE);
        Transaction t1 = transfer(a, 1, 3);
        Transaction t3 = transfer(a, 3, 3);
        pool.add(t1);
        pool.add(t3);
        assertEquals(TxStatus.QUEUED, pool.getByHash(t1.hash()).orElseThrow().status());
        assertEquals(0, pool.pendingNonce(a.getAddress()));
        assertTrue(pool.pop(1_000_000).isEmpty());

        pool.add(transfer(a, 0, 3));

        assertEquals(TxStatus.EXECUTABLE, pool.getByHash(t1.hash()).orElseThrow().status());
        assertEquals(TxStatus.QUEUED, pool.getByHash(t3.hash()).orElseThrow().status());
        assertEquals(2, pool.pendingNonce(a.getAddress()));
        assertEquals(new PoolStatus(1, 2, 1, 0), pool.status());
    }

    @Test
    void lookupCarriesBlockPositionOnceIncluded() {
        Wallet a = funded(state, BALANCE);
        Wallet b = funded(state, BALANCE);
        Transaction ta = transfer(a, 0, 3);
        Transaction tb = transfer(b, 0, 4);
        pool.add(ta);
        pool.add(tb);

        TxLookup pending = pool.getByHash(ta.hash()).orElseThrow();
        assertTrue(pending.isPending());
        assertEquals(0L, pending.blockNumber());
        assertEquals(Hash.ZERO, pending.blockHash());
        assertEquals(0L, pending.transactionIndex());

        List<Transaction> popped = pool.pop(1_000_000);
        assertEquals(List.of(tb, ta), popped);
        Hash blockHash = Hash.sha256(new byte[] {7});
        pool.markIncluded(new BlockInclusion(7, blockHash, List.of(tb.hash(), ta.hash())));

        TxLookup included = pool.getByHash(ta.hash()).orElseThrow();
        assertFalse(included.isPending());
        assertEquals(TxStatus.INCLUDED, included.status());
        assertEquals(7L, included.blockNumber());
        assertEquals(blockHash, included.blockHash());
        assertEquals(1L, included.transactionIndex());
        assertEquals(0, pool.size());
    }

    @Test
    void includedLookupKeepsRecentlyQueriedEntries() {
        pool = newPool(TxPoolConfig.builder().includedRetention(2).build());
        Wallet alice = funded(state, BALANCE);
        Transaction t0 = transfer(alice, 0, 1);
        Transaction t1 = transfer(alice, 1, 1);
        Transaction t2 = transfer(alice, 2, 1);
        for (Transaction tx : List.of(t0, t1, t2)) {
            pool.add(tx);
        }
        Hash blockHash = Hash.sha256(new byte[] {1});

        pool.pop(21_000);
        pool.markIncluded(new BlockInclusion(1, blockHash, List.of(t0.hash())));
        pool.pop(21_000);
        pool.markIncluded(new BlockInclusion(2, blockHash, List.of(t1.hash())));
        assertTrue(pool.getByHash(t0.hash()).isPresent());

        pool.pop(21_000);
        pool.markIncluded(new BlockInclusion(3, blockHash, List.of(t2.hash())));

        assertEquals(1L, pool.getByHash(t0.hash()).orElseThrow().blockNumber());
        assertEquals(Optional.empty(), pool.getByHash(t1.hash()));
        assertEquals(3L, pool.getByHash(t2.hash()).orElseThrow().blockNumber());
    }

    @Test
    void unknownHashIsNotFound() {
        assertEquals(Optional.empty(), pool.getByHash(Hash.sha256(new byte[] {1, 2, 3})));
    }

    @Test
    void nonceBelowConfirmedIsRejected() {
        Wallet a = funded(state, BALANCE);
        state.setNonce(a.getAddress(), 3);

        TxPoolException e = assertThrows(TxPoolException.class, () -> pool.add(transfer(a, 2, 1)));
        assertEquals(TxPoolError.NONCE_TOO_LOW, e.kind());
        assertEquals(1.0, metrics.counterValue("txpool.rejected", "kind", "nonce_too_low"));
        assertEquals(3, pool.pendingNonce(a.getAddress()));
    }

    @Test
    void sweepDropsNoncesConfirmedElsewhere() {
        Wallet a = funded(state, BALANCE);
        Transaction t0 = transfer(a, 0, 1);
        Transaction t1 = transfer(a, 1, 1);
        pool.add(t0);
        pool.add(t1);

        state.setNonce(a.getAddress(), 1);
        pool.sweep();

        assertTrue(pool.getByHash(t0.hash()).isEmpty());
        assertEquals(List.of(t1), pool.pop(1_000_000));
    }

    @Test
    void fullPoolEvictsCheapestTailForBetterOffer() {
        pool = newPool(TxPoolConfig.builder().maxSlots(2).build());
        Wallet a = funded(state, BALANCE);
        Wallet b = funded(state, BALANCE);
        Wallet c = funded(state, BALANCE);
        Wallet d = funded(state, BALANCE);
        Transaction cheapest = transfer(a, 0, 1);
        Transaction middle = transfer(b, 0, 2);
        pool.add(cheapest);
        pool.add(middle);

        Transaction rich = transfer(c, 0, 3);
        pool.add(rich);

        assertEquals(2, pool.size());
        assertTrue(pool.getByHash(cheapest.hash()).isEmpty());
        assertEquals(1.0, metrics.counterValue("txpool.dropped", "reason", "evicted_capacity"));

        TxPoolException e = assertThrows(TxPoolException.class, () -> pool.add(transfer(d, 0, 2)));
        assertEquals(TxPoolError.POOL_FULL, e.kind());
        assertEquals(2, pool.size());
    }

    @Test
    void fullPoolStillAcceptsReplacement() {
        pool = newPool(TxPoolConfig.builder().maxSlots(1).build());
        Wallet a = funded(state, BALANCE);
        pool.add(transfer(a, 0, 1));

        Transaction bump = transfer(a, 0, 2);
        pool.add(bump);

        assertEquals(1, pool.size());
        assertTrue(pool.getByHash(bump.hash()).isPresent());
    }

    @Test
    void sweepEvictsStaleEntriesButKeepsSelectedOnes() {
        Wallet a = funded(state, BALANCE);
        Wallet b = funded(state, BALANCE);
        Transaction sealing = transfer(a, 0, 9);
        Transaction idle = transfer(b, 0, 1);
        pool.add(sealing);
        pool.add(idle);
        assertEquals(List.of(sealing), pool.pop(21_000));

        clock.advance(TxPoolConfig.defaults().staleAfterMillis + 1);
        pool.sweep();

        assertTrue(pool.getByHash(sealing.hash()).isPresent());
        assertTrue(pool.getByHash(idle.hash()).isEmpty());
        assertEquals(1.0, metrics.counterValue("txpool.dropped", "reason", "evicted_stale"));
    }

    @Test
    void raisingGasFloorEvictsUnderpricedOnNextSweep() {
        Wallet a = funded(state, BALANCE);
        Wallet b = funded(state, BALANCE);
        Transaction low = transfer(a, 0, 1);
        Transaction high = transfer(b, 0, 5);
        pool.add(low);
        pool.add(high);

        pool.setMinGasPrice(3);
        pool.sweep();

        assertTrue(pool.getByHash(low.hash()).isEmpty());
        assertTrue(pool.getByHash(high.hash()).isPresent());
        TxPoolException e = assertThrows(TxPoolException.class, () -> pool.add(transfer(a, 0, 2)));
        assertEquals(TxPoolError.UNDERPRICED, e.kind());
    }

    @Test
    void integrityCheckRebuildsAccountThatLostAnEntry() {
        Wallet a = funded(state, BALANCE);
        Transaction t0 = transfer(a, 0, 1);
        Transaction t1 = transfer(a, 1, 1);
        pool.add(t0);
        pool.add(t1);

        AccountQueue queue = pool.queueOf(a.getAddress());
        queue.lock();
        try {
            queue.remove(1);
        } finally {
            queue.unlock();
        }

        assertEquals(1, pool.verifyIntegrity());
        assertEquals(1.0, metrics.counterValue("txpool.inconsistencies"));
        assertNotSame(queue, pool.queueOf(a.getAddress()));
        assertEquals(List.of(t0, t1), pool.pop(1_000_000));
        assertEquals(0, pool.verifyIntegrity());
    }
}
