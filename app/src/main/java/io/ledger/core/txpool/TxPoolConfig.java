package io.ledger.core.txpool;

/** Admission and eviction limits for a {@link TxPool}. */
public final class TxPoolConfig {
    public final int maxSlots;
    public final long minGasPrice;
    public final long staleAfterMillis;
    public final long sweepIntervalMillis;
    public final int includedRetention;
    public final int maxPayloadBytes;

    private TxPoolConfig(Builder b) {
        if (b.maxSlots <= 0) throw new IllegalArgumentException("maxSlots must be > 0");
        if (b.minGasPrice < 0) throw new IllegalArgumentException("minGasPrice must be >= 0");
        if (b.staleAfterMillis <= 0) throw new IllegalArgumentException("staleAfterMillis must be > 0");
        if (b.sweepIntervalMillis <= 0) throw new IllegalArgumentException("sweepIntervalMillis must be > 0");
        if (b.includedRetention < 0) throw new IllegalArgumentException("includedRetention must be >= 0");
        if (b.maxPayloadBytes < 0) throw new IllegalArgumentException("maxPayloadBytes must be >= 0");
        this.maxSlots = b.maxSlots;
        this.minGasPrice = b.minGasPrice;
        this.staleAfterMillis = b.staleAfterMillis;
        this.sweepIntervalMillis = b.sweepIntervalMillis;
        this.includedRetention = b.includedRetention;
        this.maxPayloadBytes = b.maxPayloadBytes;
    }

    public static TxPoolConfig defaults() {
        return builder().build();
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return builder()
                .maxSlots(maxSlots)
                .minGasPrice(minGasPrice)
                .staleAfterMillis(staleAfterMillis)
                .sweepIntervalMillis(sweepIntervalMillis)
                .includedRetention(includedRetention)
                .maxPayloadBytes(maxPayloadBytes);
    }

    public static final class Builder {
        private int maxSlots = 4096;
        private long minGasPrice = 0L;
        private long staleAfterMillis = 3L * 60 * 60 * 1000;
        private long sweepIntervalMillis = 10_000L;
        private int includedRetention = 4096;
        private int maxPayloadBytes = 128 * 1024;

        public Builder maxSlots(int v) { this.maxSlots = v; return this; }
        public Builder minGasPrice(long v) { this.minGasPrice = v; return this; }
        public Builder staleAfterMillis(long v) { this.staleAfterMillis = v; return this; }
        public Builder sweepIntervalMillis(long v) { this.sweepIntervalMillis = v; return this; }
        public Builder includedRetention(int v) { this.includedRetention = v; return this; }
        public Builder maxPayloadBytes(int v) { this.maxPayloadBytes = v; return this; }

        public TxPoolConfig build() { return new TxPoolConfig(this); }
    }

    @Override
    public String toString() {
        return "TxPoolConfig{maxSlots=" + maxSlots + ", minGasPrice=" + minGasPrice
                + ", staleAfterMillis=" + staleAfterMillis + "}";
    }
}
