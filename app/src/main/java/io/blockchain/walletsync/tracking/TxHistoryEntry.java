package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.protocol.Hash;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One wallet-relevant transaction: where it was included and how it moved the balance.
 */
public final class TxHistoryEntry {
    private final Hash txId;
    private final Hash blockHash;
    private final Long difficulty;
    private final Instant timestamp;
    private final long deltaMinor;

    public TxHistoryEntry(Hash txId, Hash blockHash, Optional<Long> difficulty, Optional<Instant> timestamp, long deltaMinor) {
        this.txId = Objects.requireNonNull(txId, "txId");
        this.blockHash = Objects.requireNonNull(blockHash, "blockHash");
        this.difficulty = difficulty.orElse(null);
        this.timestamp = timestamp.orElse(null);
        this.deltaMinor = deltaMinor;
    }

    public Hash txId() { return txId; }
    public Hash blockHash() { return blockHash; }
    public Optional<Long> difficulty() { return Optional.ofNullable(difficulty); }
    public Optional<Instant> timestamp() { return Optional.ofNullable(timestamp); }
    public long deltaMinor() { return deltaMinor; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TxHistoryEntry)) return false;
        TxHistoryEntry other = (TxHistoryEntry) o;
        return deltaMinor == other.deltaMinor
                && txId.equals(other.txId)
                && blockHash.equals(other.blockHash)
                && Objects.equals(difficulty, other.difficulty)
                && Objects.equals(timestamp, other.timestamp);
    }

    @Override public int hashCode() {
        return Objects.hash(txId, blockHash, difficulty, timestamp, deltaMinor);
    }

    @Override public String toString() {
        return "TxHistoryEntry{tx=" + txId + ", block=" + blockHash + ", delta=" + deltaMinor + "}";
    }
}
