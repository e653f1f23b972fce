package io.ledger.core.protocol;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * 32-byte identity value: transaction hashes and block hashes.
 */
public final class Hash implements Comparable<Hash> {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Hash sha256(byte[] data) {
        return new Hash(digest(data));
    }

    static byte[] digest(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Parses 64 hex chars, with or without a 0x prefix. */
    public static Hash fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hash hex required");
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Hash hex must be 64 characters");
        }
        byte[] out = new byte[LENGTH];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(normalized.charAt(i * 2), 16);
            int lo = Character.digit(normalized.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Hash hex must be hexadecimal");
            }
            out[i] = (byte) ((hi << 4) + lo);
        }
        return new Hash(out);
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return toHex(bytes); }

    private static String toHex(byte[] b){
        char[] out=new char[b.length*2];
        for(int i=0,j=0;i<b.length;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }

    @Override
    public int compareTo(Hash other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+hex().substring(0,8)+"…)"; }
}
