package io.ledger.core.txpool;

import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;

/**
 * Answer to a by-hash query. Block position fields are zero while the transaction is
 * still pending and populated once it was marked included.
 */
public record TxLookup(Transaction transaction,
                       TxStatus status,
                       long blockNumber,
                       Hash blockHash,
                       long transactionIndex) {

    static TxLookup pending(PoolEntry entry) {
        return new TxLookup(entry.transaction(), entry.status(), 0L, Hash.ZERO, 0L);
    }

    static TxLookup included(Transaction tx, long blockNumber, Hash blockHash, long index) {
        return new TxLookup(tx, TxStatus.INCLUDED, blockNumber, blockHash, index);
    }

    public boolean isPending() {
        return status.isPending();
    }
}
