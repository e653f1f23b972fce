package io.ledger.core.state;

import io.ledger.core.protocol.Transaction;

/**
 * Minimal account state: balances + nonces.
 */
public interface StateStore extends StateView {

    /** Apply a single transaction (nonce and funds checked here). */
    void applyTransaction(Transaction tx);

    /** Revert a single transaction (inverse of applyTransaction). */
    void revertTransaction(Transaction tx);

    /** Credit an address (genesis funding or manual recovery). */
    void credit(String address, long amount);

    void setBalance(String address, long balance);

    void setNonce(String address, long nonce);
}
