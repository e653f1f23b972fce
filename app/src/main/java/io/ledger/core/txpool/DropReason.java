package io.ledger.core.txpool;

import java.util.Locale;

/** Why an admitted transaction left the pool without being included. */
public enum DropReason {
    REPLACED,
    EVICTED_STALE,
    EVICTED_UNDERPRICED,
    EVICTED_CAPACITY,
    NONCE_CONFIRMED,
    EXECUTION_FAILED,
    INCONSISTENT;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
