package io.ledger.core.protocol;

import java.nio.ByteBuffer;

/**
 * Minimal header for sealed blocks.
 * - parentHash: link to previous block
 * - txRoot: merkle commitment to the block's transaction hashes
 * - number: block number (genesis = 0)
 * - gasLimit / gasUsed: the budget the sealer popped with and what it consumed
 */
public final class BlockHeader {
    private final Hash parentHash;
    private final Hash txRoot;
    private final long number;
    private final long timestamp;
    private final long gasLimit;
    private final long gasUsed;

    public BlockHeader(Hash parentHash,
                       Hash txRoot,
                       long number,
                       long timestamp,
                       long gasLimit,
                       long gasUsed) {
        this.parentHash = parentHash != null ? parentHash : Hash.ZERO;
        this.txRoot = txRoot != null ? txRoot : Hash.ZERO;
        this.number = number;
        this.timestamp = timestamp;
        this.gasLimit = gasLimit;
        this.gasUsed = gasUsed;
        basicValidate();
    }

    public Hash parentHash() { return parentHash; }
    public Hash txRoot() { return txRoot; }
    public long number() { return number; }
    public long timestamp() { return timestamp; }
    public long gasLimit() { return gasLimit; }
    public long gasUsed() { return gasUsed; }

    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(Hash.LENGTH * 2 + 8 * 4);
        buf.put(parentHash.bytes());
        buf.put(txRoot.bytes());
        buf.putLong(number);
        buf.putLong(timestamp);
        buf.putLong(gasLimit);
        buf.putLong(gasUsed);
        return buf.array();
    }

    public Hash hash() {
        return Hash.sha256(serialize());
    }

    public void basicValidate() {
        if (number < 0) throw new IllegalArgumentException("number must be >= 0");
        if (timestamp <= 0) throw new IllegalArgumentException("timestamp must be > 0");
        if (gasUsed < 0 || gasUsed > gasLimit) throw new IllegalArgumentException("gasUsed out of range: " + gasUsed);
    }

    @Override public String toString() {
        return "BlockHeader{n=" + number + ", gasUsed=" + gasUsed + "/" + gasLimit + "}";
    }
}
