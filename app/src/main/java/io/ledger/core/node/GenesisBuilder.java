package io.ledger.core.node;

import io.ledger.core.chain.ChainStore;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.BlockHeader;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Merkle;
import io.ledger.core.state.StateStore;

import java.util.List;
import java.util.Map;

/**
 * Creates the genesis block and seeds initial balances.
 * - number = 0, parentHash = zero hash
 * - txRoot of the empty list (zero hash)
 * - gasUsed = 0
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    /** Build an empty genesis block carrying the node's gas limit. */
    public static Block buildGenesis(long blockGasLimit, long timestamp) {
        BlockHeader hdr = new BlockHeader(
                Hash.ZERO,
                Merkle.rootOf(List.of()),
                0L,
                timestamp,
                blockGasLimit,
                0L
        );
        return new Block(hdr, List.of());
    }

    /** Credit initial balances (allocations map) into state. */
    public static void seedBalances(StateStore state, Map<String, Long> allocations) {
        if (allocations == null || allocations.isEmpty()) return;
        for (Map.Entry<String, Long> e : allocations.entrySet()) {
            state.credit(e.getKey(), e.getValue() == null ? 0L : e.getValue());
        }
    }

    /**
     * If the chain is empty, seed balances and store the genesis block.
     * Returns false when a head already exists.
     */
    public static boolean initIfNeeded(ChainStore chain, StateStore state, NodeConfig config) {
        if (chain.getHead().isPresent()) return false;
        seedBalances(state, config.genesisAllocations);
        chain.putBlock(buildGenesis(config.blockGasLimit, System.currentTimeMillis()));
        return true;
    }
}
