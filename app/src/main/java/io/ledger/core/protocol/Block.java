package io.ledger.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Block = header + ordered transactions.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;

    public Block(BlockHeader header, List<Transaction> txs) {
        this.header = header;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        basicValidate();
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public long number() { return header.number(); }
    public Hash hash() { return header.hash(); }

    public List<Hash> transactionHashes() {
        List<Hash> out = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) out.add(tx.hash());
        return out;
    }

    public Hash computeTxRoot() {
        return Merkle.rootOf(transactionHashes());
    }

    public void basicValidate() {
        if (header == null) throw new IllegalArgumentException("missing header");
        long gas = 0;
        for (Transaction tx : transactions) gas += tx.gasLimit();
        if (gas > header.gasLimit()) throw new IllegalArgumentException("transactions exceed block gas limit");
    }

    @Override public String toString() {
        return "Block{number=" + header.number() + ", txs=" + transactions.size() + "}";
    }
}
