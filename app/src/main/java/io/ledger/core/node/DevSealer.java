package io.ledger.core.node;

import io.ledger.core.chain.ChainStore;
import io.ledger.core.metrics.NodeMetrics;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.BlockHeader;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Merkle;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.state.StateStore;
import io.ledger.core.txpool.BlockInclusion;
import io.ledger.core.txpool.DropReason;
import io.ledger.core.txpool.TxPool;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-node sealer: pops the best transactions that fit the block gas limit, executes
 * them, stores the block and reports the outcome back to the pool.
 */
public final class DevSealer {
    private static final Logger LOG = Logger.getLogger(DevSealer.class.getName());

    private final ChainStore chain;
    private final StateStore state;
    private final TxPool pool;
    private final NodeMetrics metrics;
    private final long blockGasLimit;
    private final Clock clock;

    public DevSealer(ChainStore chain, StateStore state, TxPool pool, NodeMetrics metrics,
                     long blockGasLimit, Clock clock) {
        this.chain = chain;
        this.state = state;
        this.pool = pool;
        this.metrics = metrics;
        this.blockGasLimit = blockGasLimit;
        this.clock = clock;
    }

    /**
     * One sealing attempt. Transactions execute one at a time; one the state refuses is
     * discarded and its sender's later nonces go back to the pool unsealed. Returns the new
     * head, or empty when nothing executed. If the block cannot be stored, the state is
     * rolled back, every popped transaction that was not refused is demoted and the error rethrown.
     */
    public synchronized Optional<Block> tick() {
        Block parent = chain.getHead()
                .orElseThrow(() -> new IllegalStateException("Genesis block missing; call Node.start() first"));
        long number = parent.number() + 1;

        List<Transaction> txs = pool.pop(blockGasLimit);
        if (txs.isEmpty()) {
            return Optional.empty();
        }

        List<Transaction> applied = new ArrayList<>();
        List<Hash> excluded = new ArrayList<>();
        List<Hash> rejected = new ArrayList<>();
        Set<String> failedSenders = new HashSet<>();
        for (Transaction tx : txs) {
            if (failedSenders.contains(tx.from())) {
                excluded.add(tx.hash());
                continue;
            }
            try {
                state.applyTransaction(tx);
                applied.add(tx);
            } catch (RuntimeException e) {
                failedSenders.add(tx.from());
                rejected.add(tx.hash());
                LOG.log(Level.WARNING, "Tx " + tx.hash() + " failed to execute in block " + number, e);
            }
        }

        if (applied.isEmpty()) {
            settle(excluded, rejected);
            return Optional.empty();
        }

        Block block;
        try {
            block = buildBlock(parent, applied);
            chain.putBlock(block);
        } catch (RuntimeException e) {
            revertQuietly(applied, number, e);
            List<Hash> back = new ArrayList<>(hashesOf(applied));
            back.addAll(excluded);
            settle(back, rejected);
            LOG.log(Level.WARNING, "Sealing block " + number + " failed; "
                    + back.size() + " txs demoted", e);
            throw e;
        }

        pool.markIncluded(new BlockInclusion(block.number(), block.hash(), block.transactionHashes()));
        settle(excluded, rejected);
        metrics.blockSealed();
        final Block sealed = block;
        LOG.info(() -> "Sealed block " + sealed.number() + " with " + applied.size() + " txs, gasUsed="
                + sealed.header().gasUsed());
        return Optional.of(sealed);
    }

    /** Demote before discarding, so the refused nonce leaves a gap behind plain pooled entries. */
    private void settle(List<Hash> demote, List<Hash> rejected) {
        if (!demote.isEmpty()) {
            pool.demote(demote);
        }
        if (!rejected.isEmpty()) {
            pool.discard(rejected, DropReason.EXECUTION_FAILED);
        }
    }

    private static List<Hash> hashesOf(List<Transaction> txs) {
        return txs.stream().map(Transaction::hash).toList();
    }

    private Block buildBlock(Block parent, List<Transaction> txs) {
        long gasUsed = 0L;
        for (Transaction tx : txs) {
            gasUsed = Math.addExact(gasUsed, tx.gasLimit());
        }
        List<Hash> hashes = hashesOf(txs);
        BlockHeader header = new BlockHeader(
                parent.hash(),
                Merkle.rootOf(hashes),
                parent.number() + 1,
                Math.max(clock.millis(), parent.header().timestamp()),
                blockGasLimit,
                gasUsed
        );
        return new Block(header, txs);
    }

    private void revertQuietly(List<Transaction> txs, long number, RuntimeException cause) {
        try {
            for (int i = txs.size() - 1; i >= 0; i--) {
                state.revertTransaction(txs.get(i));
            }
        } catch (RuntimeException revertFailure) {
            cause.addSuppressed(revertFailure);
            LOG.log(Level.SEVERE, "State revert after failed block " + number + " failed", revertFailure);
        }
    }
}
