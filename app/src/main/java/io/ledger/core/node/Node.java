package io.ledger.core.node;

import io.ledger.core.chain.ChainStore;
import io.ledger.core.chain.InMemoryChainStore;
import io.ledger.core.metrics.NodeMetrics;
import io.ledger.core.protocol.Block;
import io.ledger.core.state.InMemoryStateStore;
import io.ledger.core.state.StateStore;
import io.ledger.core.txpool.TxPool;
import io.ledger.core.txpool.TxPoolSweeper;
import io.ledger.core.txpool.TxValidator;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires state, chain, the transaction pool and the sealer.
 * Call start() once, then either tick() by hand or startSealing() for the background loop.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final NodeConfig config;
    private final ChainStore chain;
    private final StateStore state;
    private final NodeMetrics metrics;
    private final TxPool pool;
    private final DevSealer sealer;
    private final TxPoolSweeper sweeper;
    private ScheduledExecutorService sealing;

    public Node(NodeConfig config, ChainStore chain, StateStore state, NodeMetrics metrics, Clock clock) {
        this.config = config;
        this.chain = chain;
        this.state = state;
        this.metrics = metrics;
        TxValidator validator = new TxValidator(state, config.chainId, config.blockGasLimit, config.txPool);
        this.pool = new TxPool(validator, state, config.txPool, metrics, clock);
        this.sealer = new DevSealer(chain, state, pool, metrics, config.blockGasLimit, clock);
        this.sweeper = new TxPoolSweeper(pool, config.txPool.sweepIntervalMillis);
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(config, new InMemoryChainStore(), new InMemoryStateStore(), new NodeMetrics(), Clock.systemUTC());
    }

    /** Ensure genesis exists and balances are seeded. Safe to call multiple times. */
    public void start() {
        if (GenesisBuilder.initIfNeeded(chain, state, config)) {
            LOG.info("Created genesis block, funded " + config.genesisAllocations.size() + " accounts");
        }
    }

    /** Try to seal one block. */
    public Optional<Block> tick() {
        return sealer.tick();
    }

    /** Seal every {@code sealIntervalMillis} and sweep the pool in the background. */
    public synchronized void startSealing() {
        if (sealing != null) {
            throw new IllegalStateException("Sealing already started");
        }
        sealing = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ledger-sealer");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                metrics.recordSealing(sealer::tick);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Background sealing tick failed", e);
            }
        };
        sealing.scheduleWithFixedDelay(task, config.sealIntervalMillis, config.sealIntervalMillis, TimeUnit.MILLISECONDS);
        sweeper.start();
        LOG.info("Sealing every " + config.sealIntervalMillis + " ms, block gas limit " + config.blockGasLimit);
    }

    @Override
    public synchronized void close() {
        if (sealing != null) {
            sealing.shutdownNow();
            sealing = null;
        }
        sweeper.stop();
    }

    public NodeConfig config() { return config; }
    public ChainStore chain() { return chain; }
    public StateStore state() { return state; }
    public TxPool pool() { return pool; }
    public NodeMetrics metrics() { return metrics; }
}
