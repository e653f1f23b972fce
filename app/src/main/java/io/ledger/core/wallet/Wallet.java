package io.ledger.core.wallet;

import io.ledger.core.protocol.SignatureUtil;
import io.ledger.core.protocol.Transaction;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * In-memory signing identity: an EC key pair and the address derived from it.
 */
public class Wallet {
    private final KeyPair keyPair;
    private final String address;

    public Wallet(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = SignatureUtil.deriveAddress(keyPair.getPublic());
    }

    public static Wallet generate() {
        return new Wallet(SignatureUtil.generateKeyPair());
    }

    public String getAddress() {
        return address;
    }

    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    public byte[] sign(byte[] data) {
        return SignatureUtil.sign(data, getPrivateKey());
    }

    /** Stamps sender and key onto the draft, then signs its unsigned encoding. */
    public Transaction signTransaction(Transaction.Builder draft) {
        Transaction unsignedTx = draft
                .from(address)
                .publicKey(getPublicKey())
                .signature(null)
                .build();
        byte[] sig = sign(unsignedTx.toUnsignedBytes());
        return unsignedTx.toBuilder().signature(sig).build();
    }
}
