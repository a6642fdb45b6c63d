package io.blockchain.walletsync.protocol;

/** Reference to an output of an earlier transaction. */
public record TxIn(Hash txId, int index) {
    public TxIn {
        if (txId == null) throw new IllegalArgumentException("missing txId");
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    }
}
