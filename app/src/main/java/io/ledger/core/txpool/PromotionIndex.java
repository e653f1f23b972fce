package io.ledger.core.txpool;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Price-ordered view over the executable head of every account.
 * Not thread-safe on its own; the pool guards it with its index lock.
 */
final class PromotionIndex {

    /** Highest gas price first, then oldest arrival. Hash only breaks exact ties. */
    static final Comparator<PoolEntry> PRIORITY = Comparator
            .comparingLong(PoolEntry::gasPrice).reversed()
            .thenComparingLong(PoolEntry::sequence)
            .thenComparing(PoolEntry::hash);

    private final TreeSet<PoolEntry> ordered = new TreeSet<>(PRIORITY);
    private final Map<String, PoolEntry> heads = new HashMap<>();

    /** Points {@code address} at {@code head}; a null head removes the account. */
    void upsert(String address, PoolEntry head) {
        if (head == null) {
            remove(address);
            return;
        }
        if (!address.equals(head.sender())) {
            throw new IllegalArgumentException("Head " + head.hash() + " does not belong to " + address);
        }
        PoolEntry previous = heads.put(address, head);
        if (previous == head) {
            return;
        }
        if (previous != null) {
            ordered.remove(previous);
        }
        ordered.add(head);
    }

    PoolEntry remove(String address) {
        PoolEntry previous = heads.remove(address);
        if (previous != null) {
            ordered.remove(previous);
        }
        return previous;
    }

    /** Snapshot of all heads in priority order. */
    List<PoolEntry> peekAll() {
        return new ArrayList<>(ordered);
    }
}
