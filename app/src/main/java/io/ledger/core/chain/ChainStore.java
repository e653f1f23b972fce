package io.ledger.core.chain;

import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.Hash;

import java.util.Optional;

/**
 * Minimal chain storage API.
 * Stores blocks by header hash and by number, and tracks the current head.
 */
public interface ChainStore {

    /** Persist a block (idempotent). Safe to call again with the same block. */
    void putBlock(Block block);

    /** Fetch a block by its header hash. */
    Optional<Block> getBlock(Hash blockHash);

    /** Fetch a block on the canonical chain by number. */
    Optional<Block> getBlockByNumber(long number);

    /** Current head block if any. */
    Optional<Block> getHead();

    /** Number of blocks stored (debug/metrics). */
    long size();

    /** Head number, or -1 while the chain is empty. */
    default long headNumber() {
        return getHead().map(Block::number).orElse(-1L);
    }
}
