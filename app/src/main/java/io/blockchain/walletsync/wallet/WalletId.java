package io.blockchain.walletsync.wallet;

import java.util.Objects;

/** Opaque identifier of a tracked wallet. */
public final class WalletId {
    private final String value;

    public WalletId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("wallet id must not be blank");
        }
        this.value = value;
    }

    public static WalletId of(String value) {
        return new WalletId(value);
    }

    public String value() { return value; }

    @Override public boolean equals(Object o) {
        return o instanceof WalletId && value.equals(((WalletId) o).value);
    }

    @Override public int hashCode() { return Objects.hash(value); }

    @Override public String toString() { return value; }
}
