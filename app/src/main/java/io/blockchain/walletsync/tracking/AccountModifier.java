package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.logging.SecurityLevel;
import io.blockchain.walletsync.protocol.Hash;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Delta of an account-style wallet view.
 *
 * The same shape describes an apply delta and a rollback delta; the wallet
 * store adds it on apply and subtracts it on rollback. {@code usedAddresses}
 * holds one element per (transaction, owned address) pair, so the store can
 * keep use counts and release an address only when its last use is rolled back.
 */
public final class AccountModifier implements Modifier {
    private final List<String> usedAddresses;
    private final Set<String> newlyUsed;
    private final List<TxHistoryEntry> history;
    private final Map<Hash, Long> confirmations;
    private final long balanceDeltaMinor;

    private AccountModifier(Builder b) {
        this.usedAddresses = List.copyOf(b.usedAddresses);
        this.newlyUsed = Set.copyOf(b.newlyUsed);
        this.history = List.copyOf(b.history);
        this.confirmations = Map.copyOf(b.confirmations);
        this.balanceDeltaMinor = b.balanceDeltaMinor;
    }

    public static Builder builder() { return new Builder(); }

    public static AccountModifier empty() { return builder().build(); }

    public static final class Builder {
        private final List<String> usedAddresses = new ArrayList<>();
        private final Set<String> newlyUsed = new LinkedHashSet<>();
        private final List<TxHistoryEntry> history = new ArrayList<>();
        private final Map<Hash, Long> confirmations = new LinkedHashMap<>();
        private long balanceDeltaMinor;

        public Builder useAddress(String address, boolean firstUse) {
            usedAddresses.add(address);
            if (firstUse) newlyUsed.add(address);
            return this;
        }

        public Builder history(TxHistoryEntry entry) {
            history.add(entry);
            balanceDeltaMinor = Math.addExact(balanceDeltaMinor, entry.deltaMinor());
            return this;
        }

        public Builder confirm(Hash txId, long difficulty) {
            confirmations.put(txId, difficulty);
            return this;
        }

        public AccountModifier build() {
            return new AccountModifier(this);
        }
    }

    public List<String> usedAddresses() { return usedAddresses; }
    public Set<String> newlyUsed() { return newlyUsed; }
    public List<TxHistoryEntry> history() { return history; }
    public Map<Hash, Long> confirmations() { return confirmations; }
    public long balanceDeltaMinor() { return balanceDeltaMinor; }

    public boolean isEmpty() {
        return usedAddresses.isEmpty() && history.isEmpty() && confirmations.isEmpty();
    }

    @Override
    public String format(SecurityLevel level) {
        StringBuilder sb = new StringBuilder("AccountModifier{txs=")
                .append(history.size())
                .append(", newUsedAddrs=")
                .append(newlyUsed.size());
        if (level == SecurityLevel.SECURE) {
            sb.append(", balanceDelta=").append(balanceDeltaMinor);
            sb.append(", txIds=[");
            for (int i = 0; i < history.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(history.get(i).txId());
            }
            sb.append(']');
        }
        return sb.append('}').toString();
    }

    @Override public String toString() {
        return format(SecurityLevel.PUBLIC);
    }
}
