package io.blockchain.walletsync.listener;

import io.blockchain.walletsync.listener.WalletSyncResult.Outcome;
import io.blockchain.walletsync.logging.SafeLog;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.wallet.WalletId;
import io.blockchain.walletsync.wallet.WalletStore;
import io.blockchain.walletsync.wallet.WalletSyncState;

import java.util.Objects;
import java.util.Optional;

import static io.blockchain.walletsync.logging.SafeLog.secretOnly;

/**
 * Runs a wallet action only when the wallet's recorded tip equals the chain
 * tip before the incoming window. Otherwise the wallet is skipped and the
 * reason is logged.
 */
public final class TipGuard {

    @FunctionalInterface
    public interface WalletAction {
        void run() throws Exception;
    }

    private final WalletStore store;
    private final SafeLog log;

    public TipGuard(WalletStore store, SafeLog log) {
        this.store = Objects.requireNonNull(store, "store");
        this.log = Objects.requireNonNull(log, "log");
    }

    public Outcome guard(Hash currentTip, WalletId wallet, WalletAction action) throws Exception {
        Optional<WalletSyncState> state = store.getWalletSyncTip(wallet);
        if (state.isEmpty()) {
            log.warning(sl -> "There is no syncTip corresponding to wallet #" + secretOnly(sl, wallet));
            return Outcome.SKIPPED_UNKNOWN;
        }
        Optional<Hash> walletTip = state.get().tip();
        if (walletTip.isEmpty()) {
            log.info(sl -> "Wallet #" + secretOnly(sl, wallet) + " hasn't been synced yet");
            return Outcome.SKIPPED_NOT_SYNCED;
        }
        Hash tip = walletTip.get();
        if (!tip.equals(currentTip)) {
            log.warning(sl -> "Skip wallet #" + secretOnly(sl, wallet) + ", because of wallet's tip " + tip.hex()
                    + " mismatched with current tip " + currentTip.hex());
            return Outcome.SKIPPED_TIP_MISMATCH;
        }
        action.run();
        return Outcome.SYNCED;
    }
}
