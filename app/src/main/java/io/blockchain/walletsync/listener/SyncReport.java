package io.blockchain.walletsync.listener;

import io.blockchain.walletsync.listener.WalletSyncResult.Outcome;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.wallet.WalletId;

import java.util.List;
import java.util.Optional;

/** Per-wallet results of one apply or rollback call, in wallet processing order. */
public final class SyncReport {
    private final SyncPhase phase;
    private final int blockCount;
    private final Hash newTip;
    private final List<WalletSyncResult> results;

    public SyncReport(SyncPhase phase, int blockCount, Hash newTip, List<WalletSyncResult> results) {
        this.phase = phase;
        this.blockCount = blockCount;
        this.newTip = newTip;
        this.results = List.copyOf(results);
    }

    public SyncPhase phase() { return phase; }
    public int blockCount() { return blockCount; }
    public Hash newTip() { return newTip; }
    public List<WalletSyncResult> results() { return results; }

    public long count(Outcome outcome) {
        return results.stream().filter(r -> r.outcome() == outcome).count();
    }

    public Optional<WalletSyncResult> resultFor(WalletId wallet) {
        return results.stream().filter(r -> r.wallet().equals(wallet)).findFirst();
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder("SyncReport{")
                .append(phase).append(", blocks=").append(blockCount)
                .append(", newTip=").append(newTip);
        for (Outcome outcome : Outcome.values()) {
            long n = count(outcome);
            if (n > 0) sb.append(", ").append(outcome.metricTag()).append('=').append(n);
        }
        return sb.append('}').toString();
    }
}
