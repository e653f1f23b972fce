package io.ledger.core.txpool;

/** Point-in-time counts reported by {@link TxPool#status()}. */
public record PoolStatus(int accounts, int executable, int queued, int selected) {

    public int total() {
        return executable + queued + selected;
    }
}
