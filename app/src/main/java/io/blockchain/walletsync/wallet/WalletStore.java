package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.tracking.Modifier;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent wallet views and their sync tips.
 */
public interface WalletStore {

    /** Empty when the wallet has no sync record at all. */
    Optional<WalletSyncState> getWalletSyncTip(WalletId walletId);

    /** Every tracked wallet, in a stable order. */
    List<WalletId> getWalletAddresses();

    Set<String> getCustomAddresses(CustomAddressType type);

    /** Add {@code modifier} to the wallet view and record {@code newTip} as its sync tip. */
    void applyModifierToWallet(WalletId walletId, Hash newTip, Modifier modifier);

    /** Subtract {@code modifier} from the wallet view and record {@code newTip} as its sync tip. */
    void rollbackModifierFromWallet(WalletId walletId, Hash newTip, Modifier modifier);
}
