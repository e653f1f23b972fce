package io.ledger.core.txpool;

import io.ledger.core.protocol.Transaction;
import io.ledger.core.state.StateStore;
import io.ledger.core.wallet.Wallet;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HexFormat;

/** Signed transfer fixtures shared by the pool, sealer and RPC tests. */
public final class SignedTxs {
    public static final String RECIPIENT = "00000000000000000000000000000000000000aa";

    private SignedTxs() {}

    public static Wallet funded(StateStore state, long balance) {
        Wallet wallet = Wallet.generate();
        state.setBalance(wallet.getAddress(), balance);
        return wallet;
    }

    public static Transaction transfer(Wallet from, long nonce, long gasPrice, long gasLimit) {
        return from.signTransaction(Transaction.builder()
                .to(RECIPIENT)
                .value(1)
                .nonce(nonce)
                .gasPrice(gasPrice)
                .gasLimit(gasLimit));
    }

    public static Transaction transfer(Wallet from, long nonce, long gasPrice) {
        return transfer(from, nonce, gasPrice, TxValidator.INTRINSIC_GAS);
    }

    public static String hex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }

    /** Clock the tests move by hand. */
    public static final class ManualClock extends Clock {
        private volatile long millis;

        public ManualClock(long startMillis) {
            this.millis = startMillis;
        }

        public void advance(long deltaMillis) {
            millis += deltaMillis;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
