package io.ledger.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;

import static java.lang.Math.addExact;
import static java.lang.Math.multiplyExact;

/**
 * Immutable account-model transaction.
 * Identity is the SHA-256 of the unsigned encoding, so the same content always
 * maps to the same hash regardless of how often it is relayed.
 */
public final class Transaction {

    public static final int CURRENT_VERSION = 1;

    private final int version;
    private final int chainId;

    private final String from;
    private final String to;        // null for contract creation
    private final long value;

    private final long gasPrice;
    private final long gasLimit;
    private final long nonce;

    private final byte[] payload;
    private final byte[] signature;

    private final PublicKey publicKey;
    private final Hash hash;

    private Transaction(int version,
                        int chainId,
                        String from,
                        String to,
                        long value,
                        long gasPrice,
                        long gasLimit,
                        long nonce,
                        byte[] payload,
                        byte[] signature,
                        PublicKey publicKey) {
        this.version = version;
        this.chainId = chainId;
        this.from = from;
        this.to = (to == null || to.isBlank()) ? null : to;
        this.value = value;
        this.gasPrice = gasPrice;
        this.gasLimit = gasLimit;
        this.nonce = nonce;
        this.payload = payload != null ? payload.clone() : new byte[0];
        this.signature = signature != null ? signature.clone() : new byte[0];
        this.publicKey = publicKey;
        this.hash = Hash.sha256(toUnsignedBytes());
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int version = CURRENT_VERSION;
        private int chainId = 100;
        private String from;
        private String to;
        private long value;
        private long gasPrice = 1;
        private long gasLimit = 21_000;
        private long nonce;
        private byte[] payload = new byte[0];
        private byte[] signature = new byte[0];
        private PublicKey publicKey;

        public Builder version(int v) { this.version = v; return this; }
        public Builder chainId(int id) { this.chainId = id; return this; }
        public Builder from(String f) { this.from = f; return this; }
        public Builder to(String t) { this.to = t; return this; }
        public Builder value(long v) { this.value = v; return this; }
        public Builder gasPrice(long p) { this.gasPrice = p; return this; }
        public Builder gasLimit(long g) { this.gasLimit = g; return this; }
        public Builder nonce(long n) { this.nonce = n; return this; }
        public Builder payload(byte[] p) { this.payload = p != null ? p.clone() : new byte[0]; return this; }
        public Builder signature(byte[] s) { this.signature = s != null ? s.clone() : new byte[0]; return this; }
        public Builder publicKey(PublicKey pk) { this.publicKey = pk; return this; }

        public Transaction build() {
            return new Transaction(version, chainId, from, to, value, gasPrice, gasLimit,
                                   nonce, payload, signature, publicKey);
        }
    }

    /** Builder pre-filled with every field of this transaction. */
    public Builder toBuilder() {
        return builder()
                .version(version)
                .chainId(chainId)
                .from(from)
                .to(to)
                .value(value)
                .gasPrice(gasPrice)
                .gasLimit(gasLimit)
                .nonce(nonce)
                .payload(payload)
                .signature(signature)
                .publicKey(publicKey);
    }

    // -------------------- getters --------------------
    public int version() { return version; }
    public int chainId() { return chainId; }
    public String from() { return from; }
    public String to() { return to; }
    public long value() { return value; }
    public long gasPrice() { return gasPrice; }
    public long gasLimit() { return gasLimit; }
    public long nonce() { return nonce; }
    public byte[] payload() { return payload.clone(); }
    public int payloadLength() { return payload.length; }
    public byte[] signature() { return signature.clone(); }
    public boolean isSigned() { return signature.length > 0 && publicKey != null; }
    public PublicKey publicKey() { return publicKey; }
    public Hash hash() { return hash; }

    /** Upper bound the sender must be able to pay: value + gasLimit * gasPrice. */
    public long maxCost() {
        return addExact(value, multiplyExact(gasLimit, gasPrice));
    }

    // -------------------- core methods --------------------
    public byte[] serialize() {
        byte[] key = publicKey != null ? publicKey.getEncoded() : new byte[0];
        ByteBuffer buf = ByteBuffer.allocate(estimateSize(true, key.length));
        writeUnsigned(buf);
        putBytes(buf, signature);
        putBytes(buf, key);
        return sliceToArray(buf);
    }

    public byte[] toUnsignedBytes() {
        ByteBuffer buf = ByteBuffer.allocate(estimateSize(false, 0));
        writeUnsigned(buf);
        return sliceToArray(buf);
    }

    public void basicValidate() {
        if (version != CURRENT_VERSION) throw new IllegalArgumentException("Unsupported version: " + version);
        if (chainId <= 0) throw new IllegalArgumentException("Invalid chainId");
        if (from == null || from.isBlank()) throw new IllegalArgumentException("Missing from");
        if (from.equals(to)) throw new IllegalArgumentException("from == to");
        if (value < 0) throw new IllegalArgumentException("value must be >= 0");
        if (gasPrice < 0) throw new IllegalArgumentException("gasPrice must be >= 0");
        if (gasLimit <= 0) throw new IllegalArgumentException("gasLimit must be > 0");
        if (nonce < 0) throw new IllegalArgumentException("nonce must be >= 0");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Transaction && hash.equals(((Transaction) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "Tx{" + hash.hex().substring(0, 8) + " from=" + from + " nonce=" + nonce
                + " gasPrice=" + gasPrice + " gas=" + gasLimit + "}";
    }

    // -------------------- helpers --------------------
    private void writeUnsigned(ByteBuffer buf) {
        putInt(buf, version);
        putInt(buf, chainId);
        putStr(buf, from);
        putStr(buf, to);
        putLong(buf, value);
        putLong(buf, gasPrice);
        putLong(buf, gasLimit);
        putLong(buf, nonce);
        putBytes(buf, payload);
    }

    private int estimateSize(boolean includeSig, int keyLength) {
        int size = 0;
        size += 4 + 4;
        size += 4 + (from == null ? 0 : from.getBytes(StandardCharsets.UTF_8).length);
        size += 4 + (to == null ? 0 : to.getBytes(StandardCharsets.UTF_8).length);
        size += 8 * 4;
        size += 4 + payload.length;
        if (includeSig) size += 4 + signature.length;
        if (includeSig) size += 4 + keyLength;
        return size;
    }

    private static void putInt(ByteBuffer buf, int v){ buf.putInt(v); }
    private static void putLong(ByteBuffer buf, long v){ buf.putLong(v); }
    private static void putStr(ByteBuffer buf, String s){
        byte[] b = s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
        putBytes(buf, b);
    }
    private static void putBytes(ByteBuffer buf, byte[] b){
        buf.putInt(b.length); buf.put(b);
    }
    private static byte[] sliceToArray(ByteBuffer buf){
        buf.flip(); byte[] out = new byte[buf.remaining()]; buf.get(out); return out;
    }
}
