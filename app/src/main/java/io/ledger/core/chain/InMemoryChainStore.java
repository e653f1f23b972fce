package io.ledger.core.chain;

import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.Hash;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Simple, fast in-memory chain store for a single-sealer node.
 * Blocks must extend the current head; the pool is volatile, so is the chain.
 */
public final class InMemoryChainStore implements ChainStore {

    /** Map: blockHash -> Block */
    private final Map<Hash, Block> blocks = new HashMap<>();

    /** Map: number -> blockHash (canonical chain only) */
    private final Map<Long, Hash> byNumber = new HashMap<>();

    /** Current head (best tip) */
    private Block head; // null until genesis

    @Override
    public synchronized void putBlock(Block block) {
        if (block == null) return;
        Hash h = block.hash();
        if (blocks.containsKey(h)) {
            return;
        }
        long expected = head == null ? 0L : head.number() + 1;
        if (block.number() != expected) {
            throw new IllegalArgumentException("Bad block number: expected " + expected + ", got " + block.number());
        }
        Hash expectedParent = head == null ? Hash.ZERO : head.hash();
        if (!expectedParent.equals(block.header().parentHash())) {
            throw new IllegalArgumentException("Block does not extend the current head");
        }
        if (!block.computeTxRoot().equals(block.header().txRoot())) {
            throw new IllegalArgumentException("Transaction root mismatch");
        }
        blocks.put(h, block);
        byNumber.put(block.number(), h);
        head = block;
    }

    @Override
    public synchronized Optional<Block> getBlock(Hash blockHash) {
        if (blockHash == null) return Optional.empty();
        return Optional.ofNullable(blocks.get(blockHash));
    }

    @Override
    public synchronized Optional<Block> getBlockByNumber(long number) {
        Hash h = byNumber.get(number);
        return h == null ? Optional.empty() : Optional.ofNullable(blocks.get(h));
    }

    @Override
    public synchronized Optional<Block> getHead() {
        return Optional.ofNullable(head);
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }
}
