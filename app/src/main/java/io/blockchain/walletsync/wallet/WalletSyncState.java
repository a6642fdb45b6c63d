package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.protocol.Hash;

import java.util.Objects;
import java.util.Optional;

/**
 * Recorded synchronization state of a wallet: registered but never synced,
 * or synced with a given chain tip. A wallet without any record is unknown
 * and is represented by an empty {@code Optional} at the store boundary.
 */
public final class WalletSyncState {
    public static final WalletSyncState NOT_SYNCED = new WalletSyncState(null);

    private final Hash tip; // null when not synced

    private WalletSyncState(Hash tip) {
        this.tip = tip;
    }

    public static WalletSyncState syncedWith(Hash tip) {
        return new WalletSyncState(Objects.requireNonNull(tip, "tip"));
    }

    public Optional<Hash> tip() {
        return Optional.ofNullable(tip);
    }

    @Override public boolean equals(Object o) {
        return o instanceof WalletSyncState && Objects.equals(tip, ((WalletSyncState) o).tip);
    }

    @Override public int hashCode() { return Objects.hashCode(tip); }

    @Override public String toString() {
        return tip == null ? "NotSynced" : "SyncedWith(" + tip + ")";
    }
}
