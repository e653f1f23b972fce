package io.ledger.core.state;

import io.ledger.core.protocol.Transaction;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory implementation of StateStore.
 * Tracks balances and nonces using simple HashMaps.
 * Not persistent; resets every process run.
 */
public final class InMemoryStateStore implements StateStore {

    private final Map<String, Long> balances = new HashMap<>();
    private final Map<String, Long> nonces   = new HashMap<>();

    @Override
    public synchronized long getBalance(String address) {
        return balances.getOrDefault(address, 0L);
    }

    @Override
    public synchronized long getNonce(String address) {
        return nonces.getOrDefault(address, 0L);
    }

    @Override
    public synchronized void setBalance(String address, long balance) {
        balances.put(address, balance);
    }

    @Override
    public synchronized void setNonce(String address, long nonce) {
        nonces.put(address, nonce);
    }

    @Override
    public synchronized void applyTransaction(Transaction tx) {
        long expectedNonce = getNonce(tx.from());
        if (tx.nonce() != expectedNonce) {
            throw new IllegalStateException("Nonce mismatch for " + tx.from()
                    + ": expected " + expectedNonce + ", got " + tx.nonce());
        }
        long cost = tx.maxCost();
        long fromBal = getBalance(tx.from());
        if (fromBal < cost) {
            throw new IllegalStateException("Insufficient balance for " + tx.from());
        }

        // debit sender
        balances.put(tx.from(), fromBal - cost);
        nonces.put(tx.from(), tx.nonce() + 1);

        // credit recipient; contract creation just burns the value
        if (tx.to() != null) {
            balances.put(tx.to(), getBalance(tx.to()) + tx.value());
        }
    }

    @Override
    public synchronized void revertTransaction(Transaction tx) {
        if (tx.to() != null) {
            balances.put(tx.to(), getBalance(tx.to()) - tx.value());
        }
        balances.put(tx.from(), getBalance(tx.from()) + tx.maxCost());
        nonces.put(tx.from(), tx.nonce());
    }

    @Override
    public synchronized void credit(String address, long amount) {
        balances.put(address, getBalance(address) + amount);
    }
}
