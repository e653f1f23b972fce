package io.ledger.core.state;

import io.ledger.core.protocol.Transaction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateStoreTest {

    private static Transaction tx(String from, long nonce, long value) {
        return Transaction.builder().from(from).to("bob").value(value).gasPrice(1).gasLimit(21_000).nonce(nonce).build();
    }

    @Test
    void applyDebitsCostAndBumpsNonce() {
        InMemoryStateStore state = new InMemoryStateStore();
        state.setBalance("alice", 100_000);

        state.applyTransaction(tx("alice", 0, 10));

        assertEquals(100_000 - 21_000 - 10, state.getBalance("alice"));
        assertEquals(10, state.getBalance("bob"));
        assertEquals(1, state.getNonce("alice"));
    }

    @Test
    void insufficientBalanceRejectsWithoutPartialDebit() {
        InMemoryStateStore state = new InMemoryStateStore();
        state.setBalance("alice", 30_000);
        state.applyTransaction(tx("alice", 0, 1));

        assertThrows(IllegalStateException.class, () -> state.applyTransaction(tx("alice", 1, 1)));

        assertEquals(30_000 - 21_001, state.getBalance("alice"));
        assertEquals(1, state.getBalance("bob"));
        assertEquals(1, state.getNonce("alice"));
    }

    @Test
    void nonceMustMatch() {
        InMemoryStateStore state = new InMemoryStateStore();
        state.setBalance("alice", 100_000);
        assertThrows(IllegalStateException.class, () -> state.applyTransaction(tx("alice", 1, 1)));
    }

    @Test
    void revertInReverseOrderRestoresBalancesAndNonces() {
        InMemoryStateStore state = new InMemoryStateStore();
        state.setBalance("alice", 100_000);
        Transaction first = tx("alice", 0, 5);
        Transaction second = tx("alice", 1, 5);

        state.applyTransaction(first);
        state.applyTransaction(second);
        state.revertTransaction(second);
        state.revertTransaction(first);

        assertEquals(100_000, state.getBalance("alice"));
        assertEquals(0, state.getBalance("bob"));
        assertEquals(0, state.getNonce("alice"));
    }
}
