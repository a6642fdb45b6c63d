package io.blockchain.walletsync.protocol;

/** Amount (minor units) paid to an address. */
public record TxOut(String address, long amountMinor) {
    public TxOut {
        if (address == null || address.isBlank()) throw new IllegalArgumentException("missing address");
        if (amountMinor < 0) throw new IllegalArgumentException("amountMinor must be >= 0");
    }
}
