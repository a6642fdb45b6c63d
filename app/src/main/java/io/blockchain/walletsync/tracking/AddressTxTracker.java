package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.wallet.WalletSecret;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Tracks transactions that pay to, or spend from, addresses derived from the wallet secret.
 *
 * Spent outputs are read from the undo entry, which must be index-aligned with
 * the transaction inputs. Apply and rollback over the same triples produce the
 * same history and address uses, so the store can subtract exactly what it added.
 */
public final class AddressTxTracker implements TxTracker {

    @Override
    public Modifier trackingApplyTxs(WalletSecret key,
                                     Set<String> usedAddresses,
                                     Function<BlockHeader, Optional<Long>> difficultyOf,
                                     Function<BlockHeader, Optional<Instant>> timestampOf,
                                     Function<BlockHeader, Optional<Long>> blockInfoOf,
                                     List<TxWithUndo> txs) {
        AccountModifier.Builder out = AccountModifier.builder();
        Set<String> seen = new LinkedHashSet<>(usedAddresses);
        for (TxWithUndo triple : txs) {
            if (track(key, seen, difficultyOf, timestampOf, triple, out)) {
                blockInfoOf.apply(triple.header())
                        .ifPresent(difficulty -> out.confirm(triple.tx().id(), difficulty));
            }
        }
        return out.build();
    }

    @Override
    public Modifier trackingRollbackTxs(WalletSecret key,
                                        Set<String> usedAddresses,
                                        Function<BlockHeader, Optional<Long>> difficultyOf,
                                        Function<BlockHeader, Optional<Instant>> timestampOf,
                                        List<TxWithUndo> txs) {
        AccountModifier.Builder out = AccountModifier.builder();
        for (TxWithUndo triple : txs) {
            // nothing becomes newly used on rollback
            track(key, null, difficultyOf, timestampOf, triple, out);
        }
        return out.build();
    }

    private static boolean track(WalletSecret key,
                                 Set<String> seen,
                                 Function<BlockHeader, Optional<Long>> difficultyOf,
                                 Function<BlockHeader, Optional<Instant>> timestampOf,
                                 TxWithUndo triple,
                                 AccountModifier.Builder out) {
        Transaction tx = triple.tx();
        List<TxOut> spent = triple.undo().spentOutputs();
        if (spent.size() != tx.inputs().size()) {
            throw new IllegalArgumentException("Undo of tx " + tx.id() + " has " + spent.size()
                    + " entries for " + tx.inputs().size() + " inputs");
        }

        Set<String> touched = new LinkedHashSet<>();
        long delta = 0L;
        for (TxOut in : spent) {
            if (key.owns(in.address())) {
                touched.add(in.address());
                delta = Math.subtractExact(delta, in.amountMinor());
            }
        }
        for (TxOut o : tx.outputs()) {
            if (key.owns(o.address())) {
                touched.add(o.address());
                delta = Math.addExact(delta, o.amountMinor());
            }
        }
        if (touched.isEmpty()) {
            return false;
        }

        for (String address : touched) {
            out.useAddress(address, seen != null && seen.add(address));
        }
        BlockHeader header = triple.header();
        out.history(new TxHistoryEntry(tx.id(), header.hash(),
                difficultyOf.apply(header), timestampOf.apply(header), delta));
        return true;
    }
}
