package io.ledger.core.node;

import io.ledger.core.chain.ChainStore;
import io.ledger.core.chain.InMemoryChainStore;
import io.ledger.core.metrics.NodeMetrics;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.state.InMemoryStateStore;
import io.ledger.core.txpool.SignedTxs;
import io.ledger.core.txpool.SignedTxs.ManualClock;
import io.ledger.core.txpool.TxLookup;
import io.ledger.core.txpool.TxPool;
import io.ledger.core.txpool.TxPoolConfig;
import io.ledger.core.txpool.TxStatus;
import io.ledger.core.txpool.TxValidator;
import io.ledger.core.wallet.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static io.ledger.core.txpool.SignedTxs.funded;
import static io.ledger.core.txpool.SignedTxs.transfer;
import static org.junit.jupiter.api.Assertions.*;

class DevSealerTest {

    private static final long GAS_LIMIT = 1_000_000L;

    private InMemoryStateStore state;
    private NodeMetrics metrics;
    private ManualClock clock;
    private TxPool pool;

    @BeforeEach
    void setUp() {
        state = new InMemoryStateStore();
        metrics = new NodeMetrics();
        clock = new ManualClock(5_000L);
        TxPoolConfig config = TxPoolConfig.defaults();
        pool = new TxPool(new TxValidator(state, 100, GAS_LIMIT, config), state, config, metrics, clock);
    }

    private DevSealer sealer(ChainStore chain) {
        return new DevSealer(chain, state, pool, metrics, GAS_LIMIT, clock);
    }

    private static InMemoryChainStore chainWithGenesis(long timestamp) {
        InMemoryChainStore chain = new InMemoryChainStore();
        chain.putBlock(GenesisBuilder.buildGenesis(GAS_LIMIT, timestamp));
        return chain;
    }

    @Test
    void sealsPoppedTransactionsAndRecordsTheirPosition() {
        InMemoryChainStore chain = chainWithGenesis(1_000L);
        Wallet alice = funded(state, 1_000_000);
        Transaction first = transfer(alice, 0, 2);
        Transaction second = transfer(alice, 1, 2);
        pool.add(first);
        pool.add(second);

        Block block = sealer(chain).tick().orElseThrow();

        assertEquals(1, block.number());
        assertEquals(5_000L, block.header().timestamp());
        assertEquals(42_000L, block.header().gasUsed());
        assertEquals(2, state.getNonce(alice.getAddress()));
        assertEquals(2, state.getBalance(SignedTxs.RECIPIENT));
        assertEquals(0, pool.size());
        assertEquals(block, chain.getHead().orElseThrow());

        TxLookup lookup = pool.getByHash(second.hash()).orElseThrow();
        assertEquals(TxStatus.INCLUDED, lookup.status());
        assertEquals(1, lookup.blockNumber());
        assertEquals(block.hash(), lookup.blockHash());
        assertEquals(1, lookup.transactionIndex());
        assertEquals(1.0, metrics.counterValue("blocks.sealed"));
    }

    @Test
    void timestampNeverGoesBackwards() {
        InMemoryChainStore chain = chainWithGenesis(9_000L);
        Wallet alice = funded(state, 1_000_000);
        pool.add(transfer(alice, 0, 2));

        Block block = sealer(chain).tick().orElseThrow();

        assertEquals(9_000L, block.header().timestamp());
    }

    @Test
    void emptyPoolSealsNothing() {
        InMemoryChainStore chain = chainWithGenesis(1_000L);

        assertEquals(Optional.empty(), sealer(chain).tick());
        assertEquals(1, chain.size());
    }

    @Test
    void missingGenesisIsAnError() {
        assertThrows(IllegalStateException.class, () -> sealer(new InMemoryChainStore()).tick());
    }

    @Test
    void unaffordableTransactionIsDiscardedAndTheRestIsSealed() {
        InMemoryChainStore chain = chainWithGenesis(1_000L);
        Wallet alice = funded(state, 60_000);
        Wallet bob = funded(state, 1_000_000);
        Transaction aliceFirst = transfer(alice, 0, 2);
        Transaction aliceSecond = transfer(alice, 1, 2);
        Transaction aliceThird = transfer(alice, 2, 2);
        Transaction bobs = transfer(bob, 0, 2);
        pool.add(aliceFirst);
        pool.add(aliceSecond);
        pool.add(aliceThird);
        pool.add(bobs);

        Block block = sealer(chain).tick().orElseThrow();

        assertEquals(2, block.transactions().size());
        assertTrue(block.transactions().containsAll(List.of(aliceFirst, bobs)));
        assertEquals(1, state.getNonce(alice.getAddress()));
        assertEquals(1, state.getNonce(bob.getAddress()));
        assertEquals(60_000 - 42_001, state.getBalance(alice.getAddress()));

        assertTrue(pool.getByHash(aliceSecond.hash()).isEmpty());
        assertEquals(1.0, metrics.counterValue("txpool.dropped", "reason", "execution_failed"));
        assertEquals(TxStatus.QUEUED, pool.getByHash(aliceThird.hash()).orElseThrow().status());
        assertEquals(1, pool.size());
        assertEquals(TxStatus.INCLUDED, pool.getByHash(bobs.hash()).orElseThrow().status());
    }

    @Test
    void nothingExecutableLeavesTheChainAndDropsTheFailure() {
        InMemoryChainStore chain = chainWithGenesis(1_000L);
        Wallet alice = funded(state, 1_000_000);
        Transaction tx = transfer(alice, 0, 2);
        pool.add(tx);
        state.setBalance(alice.getAddress(), 0);

        assertEquals(Optional.empty(), sealer(chain).tick());

        assertEquals(0, chain.getHead().orElseThrow().number());
        assertEquals(0, state.getNonce(alice.getAddress()));
        assertTrue(pool.getByHash(tx.hash()).isEmpty());
        assertEquals(0, pool.size());
        assertEquals(Optional.empty(), sealer(chain).tick());
    }

    @Test
    void laterNonceBecomesSealableOnceTheGapIsRefilled() {
        InMemoryChainStore chain = chainWithGenesis(1_000L);
        Wallet alice = funded(state, 50_000);
        Transaction second = transfer(alice, 1, 1);
        pool.add(transfer(alice, 0, 2));
        pool.add(second);
        state.setBalance(alice.getAddress(), 0);

        assertEquals(Optional.empty(), sealer(chain).tick());
        assertEquals(TxStatus.QUEUED, pool.getByHash(second.hash()).orElseThrow().status());

        state.setBalance(alice.getAddress(), 1_000_000);
        pool.add(transfer(alice, 0, 1));

        Block block = sealer(chain).tick().orElseThrow();
        assertEquals(2, block.transactions().size());
        assertEquals(2, state.getNonce(alice.getAddress()));
    }

    @Test
    void revertsStateWhenPersistenceFails() {
        Wallet alice = funded(state, 1_000_000);
        Transaction tx = transfer(alice, 0, 2);
        pool.add(tx);

        RuntimeException ex = assertThrows(RuntimeException.class,
                () -> sealer(new FailingChainStore()).tick());

        assertEquals("persist-failure", ex.getMessage());
        assertEquals(1_000_000, state.getBalance(alice.getAddress()));
        assertEquals(0, state.getNonce(alice.getAddress()));
        assertEquals(0, state.getBalance(SignedTxs.RECIPIENT));
        assertEquals(1, pool.size());
        assertEquals(tx, pool.pop(GAS_LIMIT).get(0));
    }

    private static final class FailingChainStore implements ChainStore {
        private final Block genesis = GenesisBuilder.buildGenesis(GAS_LIMIT, 1L);

        @Override
        public void putBlock(Block block) {
            throw new RuntimeException("persist-failure");
        }

        @Override
        public Optional<Block> getBlock(Hash blockHash) {
            return genesis.hash().equals(blockHash) ? Optional.of(genesis) : Optional.empty();
        }

        @Override
        public Optional<Block> getBlockByNumber(long number) {
            return number == 0 ? Optional.of(genesis) : Optional.empty();
        }

        @Override
        public Optional<Block> getHead() {
            return Optional.of(genesis);
        }

        @Override
        public long size() {
            return 1;
        }
    }
}
