package io.ledger.core.txpool;

public enum TxStatus {
    /** Present and valid, blocked behind a nonce gap. */
    QUEUED,
    /** Part of the contiguous run starting at the account's confirmed nonce. */
    EXECUTABLE,
    /** Handed to the sealer by pop; held until markIncluded or demote. */
    SELECTED,
    /** Committed in a block; only visible through the included lookup. */
    INCLUDED;

    /** Client-facing "pending": anything still owned by the pool. */
    public boolean isPending() {
        return this != INCLUDED;
    }
}
