package io.ledger.core.txpool;

import io.ledger.core.metrics.NodeMetrics;
import io.ledger.core.protocol.Hash;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.state.StateView;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Concurrent transaction pool: per-sender nonce queues plus a price-ordered index of
 * their executable heads.
 *
 * <p>Locking: each {@link AccountQueue} has its own lock; {@code indexLock} guards the
 * {@link PromotionIndex}. When both are needed the index lock is always taken first.
 * {@link #add} inserts under the sender's lock alone and only then republishes the head,
 * so producers never wait for a running {@link #pop} longer than one index update.
 * Hash index writes for an entry happen under its sender's lock; reads are lock-free.
 */
public final class TxPool {
    private static final Logger LOG = Logger.getLogger(TxPool.class.getName());

    private final TxValidator validator;
    private final StateView state;
    private final TxPoolConfig config;
    private final NodeMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, AccountQueue> accounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Hash, PoolEntry> byHash = new ConcurrentHashMap<>();
    private final ReentrantLock indexLock = new ReentrantLock();
    private final PromotionIndex index = new PromotionIndex();
    private final Map<Hash, TxLookup> included;
    private final AtomicLong sequence = new AtomicLong();

    public TxPool(TxValidator validator, StateView state, TxPoolConfig config) {
        this(validator, state, config, new NodeMetrics(), Clock.systemUTC());
    }

    public TxPool(TxValidator validator, StateView state, TxPoolConfig config,
                  NodeMetrics metrics, Clock clock) {
        if (validator == null || state == null || config == null || metrics == null || clock == null) {
            throw new IllegalArgumentException("validator, state, config, metrics and clock are required");
        }
        this.validator = validator;
        this.state = state;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        final int retention = config.includedRetention;
        this.included = Collections.synchronizedMap(new LinkedHashMap<Hash, TxLookup>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Hash, TxLookup> eldest) {
                return size() > retention;
            }
        });
        metrics.gauge("txpool.size", byHash, Map::size);
    }

    /**
     * Validates and admits a transaction. Re-submitting a resident hash returns it again
     * without creating a second entry.
     *
     * @throws TxPoolException with the rejection kind
     */
    public Hash add(Transaction tx) {
        try {
            return admit(tx);
        } catch (TxPoolException e) {
            metrics.txRejected(e.kind().code());
            LOG.fine(() -> "Rejected " + tx + ": " + e.kind() + " " + e.getMessage());
            throw e;
        }
    }

    private Hash admit(Transaction tx) {
        if (tx != null && byHash.containsKey(tx.hash())) {
            return tx.hash();
        }
        validator.validate(tx);
        Hash hash = tx.hash();
        String sender = tx.from();
        if (byHash.size() >= config.maxSlots) {
            makeRoom(tx);
        }
        PoolEntry entry = new PoolEntry(tx, sequence.incrementAndGet(), clock.millis());

        while (true) {
            AccountQueue queue = accounts.computeIfAbsent(sender, a -> new AccountQueue(a, state.getNonce(a)));
            TxPoolException broken = null;
            queue.lock();
            try {
                if (queue.isRetired()) {
                    continue;
                }
                if (byHash.containsKey(hash)) {
                    return hash;
                }
                drop(queue.promoteFrom(state.getNonce(sender)), DropReason.NONCE_CONFIRMED);
                AccountQueue.Insertion insertion = queue.insert(entry);
                byHash.put(hash, entry);
                if (insertion.replaced() != null) {
                    drop(List.of(insertion.replaced()), DropReason.REPLACED);
                    LOG.fine(() -> "Replaced " + insertion.replaced().hash() + " with " + hash);
                }
            } catch (TxPoolException e) {
                if (!e.kind().isFatal()) {
                    throw e;
                }
                broken = e;
            } finally {
                queue.unlock();
            }

            indexLock.lock();
            try {
                if (broken != null) {
                    recover(sender, broken.getMessage());
                    throw broken;
                }
                publish(sender);
            } finally {
                indexLock.unlock();
            }
            metrics.txAdded();
            return hash;
        }
    }

    /**
     * Picks the best executable transactions whose gas fits {@code maxGas}, in the order
     * they must be sealed. An account whose head does not fit is skipped for the rest of
     * the pass and keeps that head; the returned entries stay in the pool as SELECTED
     * until {@link #markIncluded} or {@link #demote}.
     */
    public List<Transaction> pop(long maxGas) {
        if (maxGas < TxValidator.INTRINSIC_GAS) {
            return List.of();
        }
        return metrics.recordPop(() -> select(maxGas));
    }

    private List<Transaction> select(long maxGas) {
        List<Transaction> selected = new ArrayList<>();
        indexLock.lock();
        try {
            PriorityQueue<PoolEntry> candidates = new PriorityQueue<>(PromotionIndex.PRIORITY);
            candidates.addAll(index.peekAll());
            Set<String> blocked = new HashSet<>();
            Set<String> touched = new LinkedHashSet<>();
            long remaining = maxGas;

            while (!candidates.isEmpty() && remaining >= TxValidator.INTRINSIC_GAS) {
                PoolEntry candidate = candidates.poll();
                String sender = candidate.sender();
                AccountQueue queue = accounts.get(sender);
                if (queue == null || blocked.contains(sender)) {
                    continue;
                }
                queue.lock();
                try {
                    PoolEntry head = queue.head();
                    if (head != candidate) {
                        // index lagged behind a concurrent add; rank the live head instead
                        touched.add(sender);
                        if (head != null) {
                            candidates.add(head);
                        }
                        continue;
                    }
                    if (head.gasLimit() > remaining) {
                        blocked.add(sender);
                        continue;
                    }
                    queue.markSelected(head);
                    remaining -= head.gasLimit();
                    selected.add(head.transaction());
                    touched.add(sender);
                    PoolEntry next = queue.head();
                    if (next != null) {
                        candidates.add(next);
                    }
                } finally {
                    queue.unlock();
                }
            }

            for (String sender : touched) {
                publish(sender);
            }
            int deferred = blocked.size() + candidates.size();
            metrics.popDeferred(deferred);
            final long left = remaining;
            LOG.fine(() -> "Selected " + selected.size() + " txs, " + left + " gas left, "
                    + deferred + " accounts deferred");
        } finally {
            indexLock.unlock();
        }
        return selected;
    }

    /** Commit notice without block position; lookups report block number zero. */
    public void markIncluded(List<Hash> hashes) {
        markIncluded(BlockInclusion.withoutBlock(hashes));
    }

    /**
     * Removes the block's transactions for good, advances each sender's confirmed nonce and
     * promotes whatever that unblocks. Hashes the pool does not hold are ignored.
     */
    public void markIncluded(BlockInclusion inclusion) {
        Map<Hash, Integer> positions = new HashMap<>();
        List<Hash> hashes = inclusion.transactionHashes();
        for (int i = 0; i < hashes.size(); i++) {
            positions.putIfAbsent(hashes.get(i), i);
        }
        int count = 0;
        Set<String> touched = new LinkedHashSet<>();
        Set<String> inconsistent = new LinkedHashSet<>();

        indexLock.lock();
        try {
            for (Hash hash : hashes) {
                PoolEntry entry = byHash.get(hash);
                if (entry == null) {
                    continue;
                }
                String sender = entry.sender();
                AccountQueue queue = accounts.get(sender);
                if (queue == null) {
                    inconsistent.add(sender);
                    continue;
                }
                queue.lock();
                try {
                    if (!queue.contains(entry)) {
                        inconsistent.add(sender);
                        continue;
                    }
                    List<PoolEntry> stale = queue.markIncluded(entry);
                    recordIncluded(entry, inclusion, positions.get(hash));
                    count++;
                    for (PoolEntry s : stale) {
                        Integer position = positions.get(s.hash());
                        if (position != null) {
                            s.status(TxStatus.INCLUDED);
                            recordIncluded(s, inclusion, position);
                            count++;
                        } else {
                            drop(List.of(s), DropReason.NONCE_CONFIRMED);
                        }
                    }
                    touched.add(sender);
                } finally {
                    queue.unlock();
                }
            }
            for (String sender : touched) {
                publish(sender);
            }
            for (String sender : inconsistent) {
                recover(sender, "included hash missing from its account queue");
            }
        } finally {
            indexLock.unlock();
        }
        metrics.txIncluded(count);
        final int n = count;
        LOG.fine(() -> "Marked " + n + " txs included in block " + inclusion.blockNumber());
    }

    /**
     * Returns SELECTED entries to the executable set after an abandoned seal. Entries keep
     * their arrival sequence, so they rank exactly where they did before.
     */
    public void demote(List<Hash> hashes) {
        int count = 0;
        Set<String> touched = new LinkedHashSet<>();
        Set<String> inconsistent = new LinkedHashSet<>();
        indexLock.lock();
        try {
            for (Hash hash : hashes) {
                PoolEntry entry = byHash.get(hash);
                if (entry == null || entry.status() != TxStatus.SELECTED) {
                    continue;
                }
                String sender = entry.sender();
                AccountQueue queue = accounts.get(sender);
                if (queue == null) {
                    inconsistent.add(sender);
                    continue;
                }
                queue.lock();
                try {
                    if (!queue.contains(entry)) {
                        inconsistent.add(sender);
                        continue;
                    }
                    count += queue.demote(entry).size();
                    touched.add(sender);
                } finally {
                    queue.unlock();
                }
            }
            for (String sender : touched) {
                publish(sender);
            }
            for (String sender : inconsistent) {
                recover(sender, "demoted hash missing from its account queue");
            }
        } finally {
            indexLock.unlock();
        }
        metrics.txDemoted(count);
        if (count > 0) {
            final int n = count;
            LOG.info(() -> "Demoted " + n + " selected txs back to the pool");
        }
    }

    /**
     * Removes transactions the executor refused, classified by {@code reason}. Higher nonces
     * of the same sender stay pooled and turn QUEUED behind the gap. Returns how many left.
     */
    public int discard(List<Hash> hashes, DropReason reason) {
        int count = 0;
        Set<String> touched = new LinkedHashSet<>();
        Set<String> inconsistent = new LinkedHashSet<>();
        indexLock.lock();
        try {
            for (Hash hash : hashes) {
                PoolEntry entry = byHash.get(hash);
                if (entry == null) {
                    continue;
                }
                String sender = entry.sender();
                AccountQueue queue = accounts.get(sender);
                if (queue == null) {
                    inconsistent.add(sender);
                    continue;
                }
                queue.lock();
                try {
                    if (!queue.contains(entry)) {
                        inconsistent.add(sender);
                        continue;
                    }
                    queue.remove(entry.nonce());
                    drop(List.of(entry), reason);
                    count++;
                    touched.add(sender);
                } finally {
                    queue.unlock();
                }
            }
            for (String sender : touched) {
                publish(sender);
            }
            for (String sender : inconsistent) {
                recover(sender, "discarded hash missing from its account queue");
            }
        } finally {
            indexLock.unlock();
        }
        if (count > 0) {
            final int n = count;
            LOG.warning(() -> "Discarded " + n + " txs (" + reason.code() + ")");
        }
        return count;
    }

    public Optional<TxLookup> getByHash(Hash hash) {
        if (hash == null) {
            return Optional.empty();
        }
        PoolEntry entry = byHash.get(hash);
        if (entry != null) {
            return Optional.of(TxLookup.pending(entry));
        }
        return Optional.ofNullable(included.get(hash));
    }

    /** Next nonce {@code address} could use, counting its contiguous pooled transactions. */
    public long pendingNonce(String address) {
        long confirmed = state.getNonce(address);
        AccountQueue queue = accounts.get(address);
        if (queue == null) {
            return confirmed;
        }
        queue.lock();
        try {
            return queue.pendingNonce(confirmed);
        } finally {
            queue.unlock();
        }
    }

    /**
     * Background maintenance: resyncs confirmed nonces from state, evicts entries below the
     * gas price floor or older than the staleness limit, then checks index integrity.
     * Entries being sealed are left alone.
     */
    public void sweep() {
        long now = clock.millis();
        long floor = validator.minGasPrice();
        int underpriced = 0;
        int stale = 0;
        indexLock.lock();
        try {
            for (AccountQueue queue : new ArrayList<>(accounts.values())) {
                String sender = queue.address();
                boolean consistent;
                queue.lock();
                try {
                    if (queue.isRetired()) {
                        continue;
                    }
                    drop(queue.promoteFrom(state.getNonce(sender)), DropReason.NONCE_CONFIRMED);
                    List<PoolEntry> cheap = new ArrayList<>();
                    List<PoolEntry> old = new ArrayList<>();
                    for (PoolEntry e : queue.entries()) {
                        if (e.status() == TxStatus.SELECTED) {
                            continue;
                        }
                        if (e.gasPrice() < floor) {
                            cheap.add(e);
                        } else if (now - e.addedAtMillis() >= config.staleAfterMillis) {
                            old.add(e);
                        }
                    }
                    for (PoolEntry e : cheap) {
                        queue.remove(e.nonce());
                    }
                    for (PoolEntry e : old) {
                        queue.remove(e.nonce());
                    }
                    drop(cheap, DropReason.EVICTED_UNDERPRICED);
                    drop(old, DropReason.EVICTED_STALE);
                    underpriced += cheap.size();
                    stale += old.size();
                    consistent = queue.isConsistent();
                } finally {
                    queue.unlock();
                }
                if (consistent) {
                    publish(sender);
                } else {
                    recover(sender, "account queue failed integrity check");
                }
            }
            verifyHashIndex();
        } finally {
            indexLock.unlock();
        }
        if (underpriced + stale > 0) {
            final int u = underpriced;
            final int s = stale;
            LOG.info(() -> "Sweep evicted " + u + " underpriced and " + s + " stale txs");
        }
    }

    /**
     * Cross-checks the hash index against the account queues and rebuilds every account
     * that disagrees. Returns the number of accounts rebuilt.
     */
    public int verifyIntegrity() {
        indexLock.lock();
        try {
            return verifyHashIndex();
        } finally {
            indexLock.unlock();
        }
    }

    /** Changes the admission floor; resident entries below it go on the next sweep. */
    public void setMinGasPrice(long floor) {
        validator.minGasPrice(floor);
    }

    public int size() {
        return byHash.size();
    }

    public PoolStatus status() {
        int executable = 0;
        int queued = 0;
        int selected = 0;
        int senders = 0;
        for (AccountQueue queue : accounts.values()) {
            queue.lock();
            try {
                if (queue.isEmpty()) {
                    continue;
                }
                senders++;
                for (PoolEntry e : queue.entries()) {
                    switch (e.status()) {
                        case EXECUTABLE -> executable++;
                        case QUEUED -> queued++;
                        case SELECTED -> selected++;
                        default -> { }
                    }
                }
            } finally {
                queue.unlock();
            }
        }
        return new PoolStatus(senders, executable, queued, selected);
    }

    /** Pooled transactions per sender in nonce order. */
    public Map<String, List<Transaction>> pendingTransactions() {
        Map<String, List<Transaction>> out = new TreeMap<>();
        for (AccountQueue queue : accounts.values()) {
            queue.lock();
            try {
                if (queue.isEmpty()) {
                    continue;
                }
                List<Transaction> txs = new ArrayList<>(queue.size());
                for (PoolEntry e : queue.entries()) {
                    txs.add(e.transaction());
                }
                out.put(queue.address(), txs);
            } finally {
                queue.unlock();
            }
        }
        return out;
    }

    AccountQueue queueOf(String address) {
        return accounts.get(address);
    }

    // ---- internals; callers hold indexLock unless noted ----

    /** Points the index at the account's current head, retiring the queue once empty. */
    private void publish(String sender) {
        AccountQueue queue = accounts.get(sender);
        if (queue == null) {
            index.remove(sender);
            return;
        }
        queue.lock();
        try {
            if (queue.isEmpty()) {
                queue.retire();
                accounts.remove(sender, queue);
                index.remove(sender);
            } else {
                index.upsert(sender, queue.head());
            }
        } finally {
            queue.unlock();
        }
    }

    /** Evicts the cheapest evictable entry of another sender, or rejects {@code incoming}. */
    private void makeRoom(Transaction incoming) {
        indexLock.lock();
        try {
            if (byHash.size() < config.maxSlots) {
                return;
            }
            AccountQueue own = accounts.get(incoming.from());
            if (own != null) {
                own.lock();
                try {
                    PoolEntry sameNonce = own.entryAt(incoming.nonce());
                    if (sameNonce != null && sameNonce.status() != TxStatus.SELECTED) {
                        return;
                    }
                } finally {
                    own.unlock();
                }
            }

            PoolEntry victim = null;
            for (AccountQueue queue : accounts.values()) {
                if (queue.address().equals(incoming.from())) {
                    continue;
                }
                queue.lock();
                try {
                    PoolEntry tail = queue.tail();
                    if (tail != null && (victim == null || cheaper(tail, victim))) {
                        victim = tail;
                    }
                } finally {
                    queue.unlock();
                }
            }
            if (victim == null || incoming.gasPrice() <= victim.gasPrice()) {
                throw new TxPoolException(TxPoolError.POOL_FULL,
                        "pool holds " + byHash.size() + " txs and nothing cheaper than gasPrice "
                                + incoming.gasPrice() + " can be evicted");
            }

            AccountQueue owner = accounts.get(victim.sender());
            boolean evicted = false;
            if (owner != null) {
                owner.lock();
                try {
                    if (owner.contains(victim) && victim.status() != TxStatus.SELECTED) {
                        owner.remove(victim.nonce());
                        drop(List.of(victim), DropReason.EVICTED_CAPACITY);
                        evicted = true;
                    }
                } finally {
                    owner.unlock();
                }
            }
            if (evicted) {
                publish(victim.sender());
                final PoolEntry v = victim;
                LOG.fine(() -> "Evicted " + v + " to admit " + incoming.hash());
            }
        } finally {
            indexLock.unlock();
        }
    }

    private static boolean cheaper(PoolEntry a, PoolEntry b) {
        if (a.gasPrice() != b.gasPrice()) {
            return a.gasPrice() < b.gasPrice();
        }
        return a.sequence() > b.sequence();
    }

    /** Removes already-unlinked entries from the hash index. Caller holds the sender's lock. */
    private void drop(List<PoolEntry> entries, DropReason reason) {
        int removed = 0;
        for (PoolEntry e : entries) {
            if (byHash.remove(e.hash(), e)) {
                removed++;
            }
        }
        metrics.txDropped(reason.code(), removed);
    }

    /** Caller holds the sender's lock; the lookup must be visible before the hash leaves byHash. */
    private void recordIncluded(PoolEntry entry, BlockInclusion inclusion, int position) {
        if (config.includedRetention > 0) {
            included.put(entry.hash(), TxLookup.included(entry.transaction(),
                    inclusion.blockNumber(), inclusion.blockHash(), position));
        }
        byHash.remove(entry.hash(), entry);
    }

    private int verifyHashIndex() {
        Set<String> broken = new LinkedHashSet<>();
        for (PoolEntry entry : byHash.values()) {
            String sender = entry.sender();
            if (broken.contains(sender)) {
                continue;
            }
            AccountQueue queue = accounts.get(sender);
            if (queue == null) {
                broken.add(sender);
                continue;
            }
            queue.lock();
            try {
                if (!queue.contains(entry)) {
                    broken.add(sender);
                }
            } finally {
                queue.unlock();
            }
        }
        for (String sender : broken) {
            recover(sender, "hash index entry missing from its account queue");
        }
        return broken.size();
    }

    /**
     * Rebuilds one sender's queue from the entries the hash index still holds, keeping the
     * best-priced entry per nonce. Whatever the old queue held outside the hash index is lost.
     */
    private void recover(String sender, String cause) {
        metrics.inconsistency();
        LOG.severe(() -> "Internal inconsistency for account " + sender + ": " + cause + "; rebuilding");

        List<PoolEntry> discarded = new ArrayList<>();
        AccountQueue old;
        while (true) {
            old = accounts.computeIfAbsent(sender, a -> new AccountQueue(a, state.getNonce(a)));
            old.lock();
            if (!old.isRetired()) {
                break;
            }
            old.unlock();
        }
        try {
            List<PoolEntry> candidates = new ArrayList<>();
            for (PoolEntry e : byHash.values()) {
                if (sender.equals(e.sender())) {
                    candidates.add(e);
                }
            }
            AccountQueue fresh = AccountQueue.rebuild(sender, old.nextNonce(), candidates, discarded);
            drop(discarded, DropReason.INCONSISTENT);
            old.retire();
            accounts.put(sender, fresh);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Rebuilding account " + sender + " failed", e);
            throw e;
        } finally {
            old.unlock();
        }
        publish(sender);
        if (!discarded.isEmpty()) {
            LOG.warning("Dropped " + discarded.size() + " conflicting txs while rebuilding " + sender);
        }
    }
}
