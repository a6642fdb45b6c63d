package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.tracking.AccountModifier;
import io.blockchain.walletsync.tracking.Modifier;
import io.blockchain.walletsync.tracking.TxHistoryEntry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory wallet store for {@link AccountModifier} deltas.
 * Not persistent; resets every process run.
 *
 * Custom address sets are shared by all wallets. Used addresses are kept as
 * use counts; an address leaves the USED set when its last use is rolled back.
 */
public final class InMemoryWalletStore implements WalletStore {

    /** Wallets in registration order. */
    private final Map<WalletId, WalletView> wallets = new LinkedHashMap<>();

    private final Map<CustomAddressType, Map<String, Integer>> customAddresses = new EnumMap<>(CustomAddressType.class);

    public InMemoryWalletStore() {
        for (CustomAddressType type : CustomAddressType.values()) {
            customAddresses.put(type, new HashMap<>());
        }
    }

    /** Track a wallet that has no sync record yet. */
    public synchronized void addWallet(WalletId walletId) {
        Objects.requireNonNull(walletId, "walletId");
        wallets.putIfAbsent(walletId, new WalletView());
    }

    public synchronized void setWalletSyncTip(WalletId walletId, WalletSyncState state) {
        requireView(walletId).syncState = Objects.requireNonNull(state, "state");
    }

    public synchronized void removeWallet(WalletId walletId) {
        wallets.remove(walletId);
    }

    public synchronized WalletSnapshot snapshot(WalletId walletId) {
        WalletView view = requireView(walletId);
        return new WalletSnapshot(view.syncState, new ArrayList<>(view.history.values()), view.confirmations, view.balanceMinor);
    }

    public synchronized void addCustomAddress(CustomAddressType type, String address) {
        customAddresses.get(type).merge(address, 1, Integer::sum);
    }

    @Override
    public synchronized Optional<WalletSyncState> getWalletSyncTip(WalletId walletId) {
        WalletView view = wallets.get(walletId);
        return view == null ? Optional.empty() : Optional.ofNullable(view.syncState);
    }

    @Override
    public synchronized List<WalletId> getWalletAddresses() {
        return List.copyOf(wallets.keySet());
    }

    @Override
    public synchronized Set<String> getCustomAddresses(CustomAddressType type) {
        return Set.copyOf(customAddresses.get(type).keySet());
    }

    @Override
    public synchronized void applyModifierToWallet(WalletId walletId, Hash newTip, Modifier modifier) {
        Objects.requireNonNull(newTip, "newTip");
        WalletView view = requireView(walletId);
        AccountModifier m = accountModifier(modifier);

        long balance = Math.addExact(view.balanceMinor, m.balanceDeltaMinor());
        Map<String, Integer> used = customAddresses.get(CustomAddressType.USED);
        for (String address : m.usedAddresses()) {
            used.merge(address, 1, Integer::sum);
        }
        for (TxHistoryEntry entry : m.history()) {
            view.history.put(entry.txId(), entry);
        }
        view.confirmations.putAll(m.confirmations());
        view.balanceMinor = balance;
        view.syncState = WalletSyncState.syncedWith(newTip);
    }

    @Override
    public synchronized void rollbackModifierFromWallet(WalletId walletId, Hash newTip, Modifier modifier) {
        Objects.requireNonNull(newTip, "newTip");
        WalletView view = requireView(walletId);
        AccountModifier m = accountModifier(modifier);

        long balance = Math.subtractExact(view.balanceMinor, m.balanceDeltaMinor());
        Map<String, Integer> used = customAddresses.get(CustomAddressType.USED);
        for (String address : m.usedAddresses()) {
            used.computeIfPresent(address, (k, count) -> count > 1 ? count - 1 : null);
        }
        for (TxHistoryEntry entry : m.history()) {
            view.history.remove(entry.txId());
            view.confirmations.remove(entry.txId());
        }
        view.balanceMinor = balance;
        view.syncState = WalletSyncState.syncedWith(newTip);
    }

    private WalletView requireView(WalletId walletId) {
        WalletView view = wallets.get(walletId);
        if (view == null) {
            throw new UnknownWalletException(walletId);
        }
        return view;
    }

    private static AccountModifier accountModifier(Modifier modifier) {
        if (modifier instanceof AccountModifier m) {
            return m;
        }
        throw new IllegalArgumentException("Unsupported modifier type: "
                + (modifier == null ? "null" : modifier.getClass().getName()));
    }

    private static final class WalletView {
        WalletSyncState syncState; // null = no sync record
        final Map<Hash, TxHistoryEntry> history = new LinkedHashMap<>();
        final Map<Hash, Long> confirmations = new HashMap<>();
        long balanceMinor;
    }
}
