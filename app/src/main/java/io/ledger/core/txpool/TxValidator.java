package io.ledger.core.txpool;

import io.ledger.core.protocol.SignatureUtil;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.state.StateView;

/**
 * Quick-reject gate run before a transaction touches any pool structure.
 * Reads the executor's view but never mutates anything, so it is safe to call from any
 * number of producer threads at once.
 */
public final class TxValidator {
    /** Minimum gas any transaction burns. */
    public static final long INTRINSIC_GAS = 21_000L;

    private final StateView state;
    private final int chainId;
    private final long blockGasLimit;
    private final int maxPayloadBytes;
    private volatile long minGasPrice;

    public TxValidator(StateView state, int chainId, long blockGasLimit, TxPoolConfig config) {
        if (state == null) {
            throw new IllegalArgumentException("State view required");
        }
        if (blockGasLimit < INTRINSIC_GAS) {
            throw new IllegalArgumentException("blockGasLimit below intrinsic gas: " + blockGasLimit);
        }
        this.state = state;
        this.chainId = chainId;
        this.blockGasLimit = blockGasLimit;
        this.maxPayloadBytes = config.maxPayloadBytes;
        this.minGasPrice = config.minGasPrice;
    }

    public void validate(Transaction tx) {
        if (tx == null) {
            throw reject(TxPoolError.MALFORMED, "Transaction required");
        }
        try {
            tx.basicValidate();
        } catch (IllegalArgumentException e) {
            throw reject(TxPoolError.MALFORMED, e.getMessage());
        }
        if (tx.chainId() != chainId) {
            throw reject(TxPoolError.MALFORMED, "Wrong chainId: " + tx.chainId());
        }
        if (tx.gasLimit() < INTRINSIC_GAS) {
            throw reject(TxPoolError.MALFORMED, "gasLimit below intrinsic gas: " + tx.gasLimit());
        }
        if (tx.payloadLength() > maxPayloadBytes) {
            throw reject(TxPoolError.MALFORMED, "payload exceeds " + maxPayloadBytes + " bytes");
        }
        long cost;
        try {
            cost = tx.maxCost();
        } catch (ArithmeticException e) {
            throw reject(TxPoolError.MALFORMED, "value + gas cost overflows");
        }
        if (tx.gasLimit() > blockGasLimit) {
            throw reject(TxPoolError.EXCEEDS_BLOCK_GAS_LIMIT,
                    "gasLimit " + tx.gasLimit() + " exceeds block gas limit " + blockGasLimit);
        }

        if (!tx.isSigned()) {
            throw reject(TxPoolError.INVALID_SIGNATURE, "Missing signature or public key");
        }
        if (!SignatureUtil.verify(tx.toUnsignedBytes(), tx.signature(), tx.publicKey())) {
            throw reject(TxPoolError.INVALID_SIGNATURE, "Signature does not verify");
        }
        if (!SignatureUtil.deriveAddress(tx.publicKey()).equals(tx.from())) {
            throw reject(TxPoolError.INVALID_SIGNATURE, "Sender does not match signing key");
        }

        if (tx.gasPrice() < minGasPrice) {
            throw reject(TxPoolError.UNDERPRICED, "gasPrice below floor " + minGasPrice);
        }
        long confirmed = state.getNonce(tx.from());
        if (tx.nonce() < confirmed) {
            throw reject(TxPoolError.NONCE_TOO_LOW, "nonce " + tx.nonce() + " < confirmed " + confirmed);
        }
        if (state.getBalance(tx.from()) < cost) {
            throw reject(TxPoolError.INSUFFICIENT_FUNDS, "balance below value + gas cost " + cost);
        }
    }

    public long minGasPrice() {
        return minGasPrice;
    }

    /** Raises or lowers the admission floor; the next sweep evicts entries below it. */
    public void minGasPrice(long floor) {
        if (floor < 0) {
            throw new IllegalArgumentException("minGasPrice must be >= 0");
        }
        this.minGasPrice = floor;
    }

    private static TxPoolException reject(TxPoolError kind, String message) {
        return new TxPoolException(kind, message);
    }
}
