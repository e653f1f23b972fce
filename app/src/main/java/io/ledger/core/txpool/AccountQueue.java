package io.ledger.core.txpool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One sender's outstanding transactions keyed by nonce, plus the lowest nonce the
 * executor has not confirmed yet.
 *
 * Entries form a contiguous executable run starting at {@code nextNonce}; anything after
 * the first gap is queued. All methods except {@link #address()} require the caller to
 * hold {@link #lock()}: the pool combines several of them into one critical section.
 */
final class AccountQueue {

    /** Result of {@link #insert(PoolEntry)}. */
    record Insertion(PoolEntry replaced, boolean headChanged) {}

    private final String address;
    private final ReentrantLock lock = new ReentrantLock();
    private final NavigableMap<Long, PoolEntry> byNonce = new TreeMap<>();
    private long nextNonce;
    private boolean retired;

    AccountQueue(String address, long confirmedNonce) {
        this.address = address;
        this.nextNonce = Math.max(0L, confirmedNonce);
    }

    /**
     * Fresh queue for an account whose indexes disagreed: keeps the highest-priced entry
     * per nonce at or above {@code confirmedNonce}; every other candidate lands in
     * {@code discarded}.
     */
    static AccountQueue rebuild(String address, long confirmedNonce,
                                Collection<PoolEntry> candidates, List<PoolEntry> discarded) {
        AccountQueue queue = new AccountQueue(address, confirmedNonce);
        List<PoolEntry> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingLong(PoolEntry::nonce)
                .thenComparing(Comparator.comparingLong(PoolEntry::gasPrice).reversed())
                .thenComparingLong(PoolEntry::sequence));
        for (PoolEntry entry : sorted) {
            if (!address.equals(entry.sender())
                    || entry.nonce() < queue.nextNonce
                    || queue.byNonce.containsKey(entry.nonce())) {
                discarded.add(entry);
                continue;
            }
            queue.byNonce.put(entry.nonce(), entry);
        }
        queue.refreshStatuses();
        return queue;
    }

    String address() {
        return address;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    /**
     * Adds an entry, replacing a same-nonce entry only when the newcomer pays a strictly
     * higher gas price and the old one is not being sealed.
     */
    Insertion insert(PoolEntry entry) {
        checkLocked();
        if (retired) {
            throw new IllegalStateException("Account queue retired: " + address);
        }
        long nonce = entry.nonce();
        if (nonce < nextNonce) {
            throw new TxPoolException(TxPoolError.NONCE_TOO_LOW,
                    "nonce " + nonce + " < next expected " + nextNonce);
        }
        PoolEntry existing = byNonce.get(nonce);
        if (existing != null) {
            if (existing.hash().equals(entry.hash())) {
                throw new TxPoolException(TxPoolError.INTERNAL_INCONSISTENCY,
                        "hash " + entry.hash().hex() + " queued for " + address + " but missing from hash index");
            }
            if (existing.status() == TxStatus.SELECTED) {
                throw new TxPoolException(TxPoolError.UNDERPRICED,
                        "nonce " + nonce + " is being sealed and cannot be replaced");
            }
            if (entry.gasPrice() <= existing.gasPrice()) {
                throw new TxPoolException(TxPoolError.UNDERPRICED,
                        "replacement gasPrice " + entry.gasPrice() + " must exceed " + existing.gasPrice());
            }
        }
        PoolEntry before = head();
        byNonce.put(nonce, entry);
        refreshStatuses();
        return new Insertion(existing, head() != before);
    }

    /** Lowest executable entry not already handed to the sealer, or null. */
    PoolEntry head() {
        checkLocked();
        long n = nextNonce;
        PoolEntry entry = byNonce.get(n);
        while (entry != null && entry.status() == TxStatus.SELECTED) {
            entry = byNonce.get(++n);
        }
        return entry;
    }

    void markSelected(PoolEntry entry) {
        checkLocked();
        if (head() != entry) {
            throw new IllegalStateException("Only the head can be selected: " + entry);
        }
        entry.status(TxStatus.SELECTED);
    }

    /**
     * Returns SELECTED entries from {@code entry} upwards to the executable set. Later
     * nonces cannot be sealed without this one, so they are demoted with it.
     */
    List<PoolEntry> demote(PoolEntry entry) {
        checkLocked();
        List<PoolEntry> demoted = new ArrayList<>();
        if (entry.status() != TxStatus.SELECTED || byNonce.get(entry.nonce()) != entry) {
            return demoted;
        }
        for (PoolEntry e : byNonce.tailMap(entry.nonce(), true).values()) {
            if (e.status() == TxStatus.SELECTED) {
                e.status(TxStatus.EXECUTABLE);
                demoted.add(e);
            }
        }
        refreshStatuses();
        return demoted;
    }

    /**
     * Removes a committed entry and advances the confirmed nonce past it. Returns the
     * entries that the advance made stale (nonces below the new confirmed nonce).
     */
    List<PoolEntry> markIncluded(PoolEntry entry) {
        checkLocked();
        if (byNonce.get(entry.nonce()) != entry) {
            throw new IllegalStateException("Entry not owned by " + address + ": " + entry);
        }
        byNonce.remove(entry.nonce());
        entry.status(TxStatus.INCLUDED);
        return advanceTo(entry.nonce() + 1);
    }

    /**
     * Moves the confirmed pointer forward to the executor's nonce and re-evaluates which
     * entries are executable. Skipped while a seal is in flight: its entries still need
     * markIncluded or demote.
     */
    List<PoolEntry> promoteFrom(long confirmedNonce) {
        checkLocked();
        if (confirmedNonce <= nextNonce || hasSelected()) {
            return List.of();
        }
        return advanceTo(confirmedNonce);
    }

    /** Removes the entry at {@code nonce}; later entries fall back to queued. */
    PoolEntry remove(long nonce) {
        checkLocked();
        PoolEntry removed = byNonce.remove(nonce);
        if (removed != null) {
            refreshStatuses();
        }
        return removed;
    }

    /** Highest-nonce entry when it may be evicted, i.e. not being sealed. */
    PoolEntry tail() {
        checkLocked();
        Map.Entry<Long, PoolEntry> last = byNonce.lastEntry();
        if (last == null || last.getValue().status() == TxStatus.SELECTED) {
            return null;
        }
        return last.getValue();
    }

    /**
     * One past the highest contiguous nonce starting at the confirmed nonce, or at
     * {@code confirmedNonce} when the executor is already ahead of this queue.
     */
    long pendingNonce(long confirmedNonce) {
        checkLocked();
        long n = Math.max(nextNonce, confirmedNonce);
        while (byNonce.containsKey(n)) {
            n++;
        }
        return n;
    }

    PoolEntry entryAt(long nonce) {
        checkLocked();
        return byNonce.get(nonce);
    }

    boolean contains(PoolEntry entry) {
        checkLocked();
        return byNonce.get(entry.nonce()) == entry;
    }

    boolean hasSelected() {
        checkLocked();
        for (PoolEntry e : byNonce.values()) {
            if (e.status() == TxStatus.SELECTED) {
                return true;
            }
        }
        return false;
    }

    /** Nonce keys match their entries, all belong to this sender, none is already confirmed. */
    boolean isConsistent() {
        checkLocked();
        for (Map.Entry<Long, PoolEntry> e : byNonce.entrySet()) {
            PoolEntry entry = e.getValue();
            if (entry.nonce() != e.getKey()
                    || entry.nonce() < nextNonce
                    || !address.equals(entry.sender())
                    || entry.status() == TxStatus.INCLUDED) {
                return false;
            }
        }
        return true;
    }

    List<PoolEntry> entries() {
        checkLocked();
        return new ArrayList<>(byNonce.values());
    }

    int size() {
        checkLocked();
        return byNonce.size();
    }

    boolean isEmpty() {
        checkLocked();
        return byNonce.isEmpty();
    }

    long nextNonce() {
        checkLocked();
        return nextNonce;
    }

    void retire() {
        checkLocked();
        retired = true;
    }

    boolean isRetired() {
        checkLocked();
        return retired;
    }

    private List<PoolEntry> advanceTo(long confirmedNonce) {
        List<PoolEntry> stale = new ArrayList<>();
        if (confirmedNonce > nextNonce) {
            nextNonce = confirmedNonce;
        }
        Iterator<PoolEntry> it = byNonce.headMap(nextNonce, false).values().iterator();
        while (it.hasNext()) {
            stale.add(it.next());
            it.remove();
        }
        refreshStatuses();
        return stale;
    }

    private void refreshStatuses() {
        long expected = nextNonce;
        boolean contiguous = true;
        for (PoolEntry e : byNonce.values()) {
            if (contiguous && e.nonce() == expected) {
                if (e.status() != TxStatus.SELECTED) {
                    e.status(TxStatus.EXECUTABLE);
                }
                expected++;
            } else {
                contiguous = false;
                if (e.status() != TxStatus.SELECTED) {
                    e.status(TxStatus.QUEUED);
                }
            }
        }
    }

    private void checkLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Account lock not held for " + address);
        }
    }
}
