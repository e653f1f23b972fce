package io.ledger.core.txpool;

import java.util.Locale;

/**
 * Exhaustive classification of {@link TxPool#add} failures.
 * Every kind except {@link #INTERNAL_INCONSISTENCY} is a permanent rejection of the
 * submitted transaction; the pool never retries it.
 */
public enum TxPoolError {
    INVALID_SIGNATURE,
    MALFORMED,
    NONCE_TOO_LOW,
    UNDERPRICED,
    INSUFFICIENT_FUNDS,
    EXCEEDS_BLOCK_GAS_LIMIT,
    POOL_FULL,
    /** An index invariant was violated; the affected account was rebuilt. */
    INTERNAL_INCONSISTENCY;

    public boolean isFatal() {
        return this == INTERNAL_INCONSISTENCY;
    }

    /** Stable snake_case code for wire responses and metric tags. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
