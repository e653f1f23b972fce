package io.ledger.core.protocol;

import io.ledger.core.wallet.Wallet;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TransactionCodecTest {

    @Test
    void decodesSignedTransaction() {
        Wallet alice = Wallet.generate();
        Transaction tx = alice.signTransaction(Transaction.builder()
                .to("00000000000000000000000000000000000000aa")
                .value(123).gasPrice(4).gasLimit(30_000).nonce(7)
                .payload(new byte[] {1, 2, 3}));

        Transaction decoded = TransactionCodec.fromBytes(tx.serialize());

        assertEquals(tx.hash(), decoded.hash());
        assertEquals(alice.getAddress(), decoded.from());
        assertEquals(7, decoded.nonce());
        assertEquals(4, decoded.gasPrice());
        assertArrayEquals(new byte[] {1, 2, 3}, decoded.payload());
        assertArrayEquals(tx.signature(), decoded.signature());
        assertTrue(SignatureUtil.verify(decoded.toUnsignedBytes(), decoded.signature(), decoded.publicKey()));
    }

    @Test
    void hashIgnoresSignature() {
        Transaction unsigned = Transaction.builder().from("a1").to("b2").nonce(1).build();
        Transaction signed = unsigned.toBuilder().signature(new byte[] {9}).build();
        assertEquals(unsigned.hash(), signed.hash());
    }

    @Test
    void rejectsMalformedBytes() {
        Wallet alice = Wallet.generate();
        byte[] bytes = alice.signTransaction(Transaction.builder().to("b2")).serialize();

        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromBytes(null));
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromBytes(new byte[0]));
        assertThrows(IllegalArgumentException.class,
                () -> TransactionCodec.fromBytes(Arrays.copyOf(bytes, bytes.length - 3)));
        assertThrows(IllegalArgumentException.class,
                () -> TransactionCodec.fromBytes(Arrays.copyOf(bytes, bytes.length + 1)));
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromBytes(new byte[] {0, 0, 0, 1}));
    }

    @Test
    void maxCostOverflowIsDetected() {
        Transaction tx = Transaction.builder().from("a1").to("b2")
                .gasPrice(Long.MAX_VALUE).gasLimit(2).build();
        assertThrows(ArithmeticException.class, tx::maxCost);
    }
}
