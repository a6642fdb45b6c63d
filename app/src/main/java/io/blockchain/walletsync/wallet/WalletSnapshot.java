package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.tracking.TxHistoryEntry;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Immutable copy of one wallet view. */
public final class WalletSnapshot {
    private final WalletSyncState syncState;
    private final List<TxHistoryEntry> history;
    private final Map<Hash, Long> confirmations;
    private final long balanceMinor;

    public WalletSnapshot(WalletSyncState syncState,
                          List<TxHistoryEntry> history,
                          Map<Hash, Long> confirmations,
                          long balanceMinor) {
        this.syncState = syncState;
        this.history = List.copyOf(history);
        this.confirmations = Map.copyOf(confirmations);
        this.balanceMinor = balanceMinor;
    }

    public Optional<WalletSyncState> syncState() { return Optional.ofNullable(syncState); }
    public List<TxHistoryEntry> history() { return history; }
    public Map<Hash, Long> confirmations() { return confirmations; }
    public long balanceMinor() { return balanceMinor; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WalletSnapshot)) return false;
        WalletSnapshot other = (WalletSnapshot) o;
        return balanceMinor == other.balanceMinor
                && Objects.equals(syncState, other.syncState)
                && history.equals(other.history)
                && confirmations.equals(other.confirmations);
    }

    @Override public int hashCode() {
        return Objects.hash(syncState, history, confirmations, balanceMinor);
    }

    @Override public String toString() {
        return "WalletSnapshot{sync=" + syncState + ", txs=" + history.size() + ", balance=" + balanceMinor + "}";
    }
}
