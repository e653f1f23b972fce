package io.ledger.core.txpool;

/**
 * Synchronous rejection raised by the pool; callers branch on {@link #kind()}.
 */
public class TxPoolException extends RuntimeException {
    private final TxPoolError kind;

    public TxPoolException(TxPoolError kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TxPoolError kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "TxPoolException[" + kind + "]: " + getMessage();
    }
}
