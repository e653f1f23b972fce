package io.ledger.core.txpool;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs {@link TxPool#sweep()} on a daemon thread every {@code sweepIntervalMillis}.
 * A failing sweep is logged and the schedule keeps going.
 */
public final class TxPoolSweeper implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(TxPoolSweeper.class.getName());

    private final TxPool pool;
    private final long intervalMillis;
    private ScheduledExecutorService executor;

    public TxPoolSweeper(TxPool pool, long intervalMillis) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("intervalMillis must be > 0");
        }
        this.pool = pool;
        this.intervalMillis = intervalMillis;
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Sweeper already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ledger-txpool-sweeper");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                pool.sweep();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Background txpool sweep failed", e);
            }
        };
        executor.scheduleWithFixedDelay(task, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        LOG.fine(() -> "Txpool sweeper every " + intervalMillis + " ms");
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    public synchronized void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    @Override
    public void close() {
        stop();
    }
}
