package io.blockchain.walletsync.listener;

import io.blockchain.walletsync.wallet.WalletId;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/** What happened to one wallet during one listener call. */
public final class WalletSyncResult {

    public enum Outcome {
        SYNCED,
        SKIPPED_UNKNOWN,
        SKIPPED_NOT_SYNCED,
        SKIPPED_TIP_MISMATCH,
        FAILED;

        public String metricTag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final WalletId wallet;
    private final Outcome outcome;
    private final String failure;

    private WalletSyncResult(WalletId wallet, Outcome outcome, String failure) {
        this.wallet = Objects.requireNonNull(wallet, "wallet");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.failure = failure;
    }

    public static WalletSyncResult of(WalletId wallet, Outcome outcome) {
        if (outcome == Outcome.FAILED) {
            throw new IllegalArgumentException("use failed(...) for failures");
        }
        return new WalletSyncResult(wallet, outcome, null);
    }

    public static WalletSyncResult failed(WalletId wallet, String failure) {
        return new WalletSyncResult(wallet, Outcome.FAILED, Objects.requireNonNull(failure, "failure"));
    }

    public WalletId wallet() { return wallet; }
    public Outcome outcome() { return outcome; }
    public Optional<String> failure() { return Optional.ofNullable(failure); }

    @Override public String toString() {
        return "WalletSyncResult{" + outcome + (failure == null ? "" : ", " + failure) + "}";
    }
}
