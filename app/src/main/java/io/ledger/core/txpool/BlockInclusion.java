package io.ledger.core.txpool;

import io.ledger.core.protocol.Hash;

import java.util.List;

/**
 * Commit notice for {@link TxPool#markIncluded(BlockInclusion)}: the block's position and
 * its transaction hashes in block order (list index = transaction index).
 */
public record BlockInclusion(long blockNumber, Hash blockHash, List<Hash> transactionHashes) {

    public BlockInclusion {
        if (blockNumber < 0) {
            throw new IllegalArgumentException("blockNumber must be >= 0");
        }
        blockHash = blockHash == null ? Hash.ZERO : blockHash;
        transactionHashes = transactionHashes == null ? List.of() : List.copyOf(transactionHashes);
    }

    /** Inclusion whose block position is not known to the caller. */
    public static BlockInclusion withoutBlock(List<Hash> transactionHashes) {
        return new BlockInclusion(0L, Hash.ZERO, transactionHashes);
    }
}
