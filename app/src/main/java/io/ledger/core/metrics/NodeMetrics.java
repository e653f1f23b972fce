package io.ledger.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Counters and timers for the pool and the sealer, backed by one registry per node.
 */
public class NodeMetrics {
    private final MeterRegistry registry;
    private final Counter added;
    private final Counter included;
    private final Counter demoted;
    private final Counter deferred;
    private final Counter inconsistencies;
    private final Counter blocksSealed;
    private final Timer popTime;
    private final Timer sealTime;

    public NodeMetrics() {
        this(new SimpleMeterRegistry());
    }

    public NodeMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.added = registry.counter("txpool.added");
        this.included = registry.counter("txpool.included");
        this.demoted = registry.counter("txpool.demoted");
        this.deferred = registry.counter("txpool.pop.deferred");
        this.inconsistencies = registry.counter("txpool.inconsistencies");
        this.blocksSealed = registry.counter("blocks.sealed");
        this.popTime = registry.timer("txpool.pop.time");
        this.sealTime = registry.timer("block.sealing.time");
    }

    public void txAdded() {
        added.increment();
    }

    public void txRejected(String kind) {
        registry.counter("txpool.rejected", "kind", kind).increment();
    }

    public void txDropped(String reason, int count) {
        if (count > 0) {
            registry.counter("txpool.dropped", "reason", reason).increment(count);
        }
    }

    public void txIncluded(int count) {
        included.increment(count);
    }

    public void txDemoted(int count) {
        demoted.increment(count);
    }

    public void popDeferred(int count) {
        deferred.increment(count);
    }

    public void inconsistency() {
        inconsistencies.increment();
    }

    public void blockSealed() {
        blocksSealed.increment();
    }

    public <T> T recordPop(Supplier<T> selection) {
        return popTime.record(selection);
    }

    public <T> T recordSealing(Supplier<T> sealing) {
        return sealTime.record(sealing);
    }

    /** Registers a gauge sampling {@code source}; the registry holds it weakly. */
    public <S> void gauge(String name, S source, ToDoubleFunction<S> value) {
        Gauge.builder(name, source, value).register(registry);
    }

    public double counterValue(String name, String... tags) {
        Counter c = registry.find(name).tags(tags).counter();
        return c == null ? 0.0 : c.count();
    }

    public String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{");
                for (Tag tag : m.getId().getTags()) {
                    sb.append(tag.getKey()).append("=").append(tag.getValue()).append(",");
                }
                sb.append("stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
