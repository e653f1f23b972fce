package io.ledger.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple Merkle tree helper over hash leaves.
 * - If there are no leaves, root = 32 zero bytes.
 * - If odd count at a level, duplicate the last (Bitcoin-style) for simplicity.
 */
public final class Merkle {
    private Merkle(){}

    public static Hash rootOf(List<Hash> leaves) {
        if (leaves == null || leaves.isEmpty()) return Hash.ZERO;
        List<byte[]> level = new ArrayList<>(leaves.size());
        for (Hash leaf : leaves) level.add(leaf.bytes());
        while (level.size() > 1) {
            List<byte[]> next = new ArrayList<>((level.size()+1)/2);
            for (int i=0; i<level.size(); i+=2) {
                byte[] left = level.get(i);
                byte[] right = (i+1 < level.size()) ? level.get(i+1) : left;
                next.add(Hash.digest(concat(left, right)));
            }
            level = next;
        }
        return new Hash(level.get(0));
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
