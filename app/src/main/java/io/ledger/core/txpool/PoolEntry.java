package io.ledger.core.txpool;

import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;

/**
 * A pool-owned transaction: the immutable tx, its arrival sequence (tie-break for equal
 * prices) and a status that only changes under the owning account's lock.
 */
public final class PoolEntry {
    private final Transaction transaction;
    private final long sequence;
    private final long addedAtMillis;
    private volatile TxStatus status = TxStatus.QUEUED;

    PoolEntry(Transaction transaction, long sequence, long addedAtMillis) {
        this.transaction = transaction;
        this.sequence = sequence;
        this.addedAtMillis = addedAtMillis;
    }

    public Transaction transaction() { return transaction; }
    public Hash hash() { return transaction.hash(); }
    public String sender() { return transaction.from(); }
    public long nonce() { return transaction.nonce(); }
    public long gasPrice() { return transaction.gasPrice(); }
    public long gasLimit() { return transaction.gasLimit(); }
    public long sequence() { return sequence; }
    public long addedAtMillis() { return addedAtMillis; }
    public TxStatus status() { return status; }

    void status(TxStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return "PoolEntry{" + transaction + ", seq=" + sequence + ", " + status + "}";
    }
}
