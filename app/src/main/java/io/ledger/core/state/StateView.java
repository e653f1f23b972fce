package io.ledger.core.state;

/**
 * Read-only account view the pool consults: balances and confirmed nonces.
 */
public interface StateView {
    long getBalance(String address);

    /** Lowest nonce not yet confirmed for the address. */
    long getNonce(String address);
}
