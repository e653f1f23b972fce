package io.ledger.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;

/**
 * Decodes the wire form produced by {@link Transaction#serialize()}.
 */
public final class TransactionCodec {
    private TransactionCodec(){}

    public static Transaction fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Malformed Transaction bytes: empty");
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);

            int version = buf.getInt();
            int chainId = buf.getInt();
            String from = readString(buf);
            String to = readString(buf);
            long value = buf.getLong();
            long gasPrice = buf.getLong();
            long gasLimit = buf.getLong();
            long nonce = buf.getLong();
            byte[] payload = readBytes(buf);

            byte[] signature = new byte[0];
            PublicKey publicKey = null;
            if (buf.hasRemaining()) {
                signature = readBytes(buf);
            }
            if (buf.hasRemaining()) {
                byte[] encodedKey = readBytes(buf);
                if (encodedKey.length > 0) {
                    publicKey = SignatureUtil.decodePublicKey(encodedKey);
                }
            }
            if (buf.hasRemaining()) {
                throw new IllegalArgumentException("Trailing bytes: " + buf.remaining());
            }

            return Transaction.builder()
                    .version(version)
                    .chainId(chainId)
                    .from(from.isEmpty() ? null : from)
                    .to(to.isEmpty() ? null : to)
                    .value(value)
                    .gasPrice(gasPrice)
                    .gasLimit(gasLimit)
                    .nonce(nonce)
                    .payload(payload)
                    .signature(signature)
                    .publicKey(publicKey)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction bytes", ex);
        }
    }

    private static String readString(ByteBuffer b) {
        byte[] arr = readBytes(b);
        return new String(arr, StandardCharsets.UTF_8);
    }

    private static byte[] readBytes(ByteBuffer b) {
        if (b.remaining() < 4) {
            throw new IllegalArgumentException("Truncated length prefix");
        }
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
