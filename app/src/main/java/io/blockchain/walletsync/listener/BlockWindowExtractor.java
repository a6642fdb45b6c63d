package io.blockchain.walletsync.listener;

import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.protocol.Block;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxUndo;
import io.blockchain.walletsync.protocol.Undo;
import io.blockchain.walletsync.tracking.TxWithUndo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flattens block windows into ordered (transaction, undo, header) streams.
 */
public final class BlockWindowExtractor {
    private BlockWindowExtractor() {}

    /** Transactions of one block in block order; empty for genesis blocks. */
    public static List<TxWithUndo> extract(Blund blund) {
        Block block = blund.block();
        if (block.isGenesis()) {
            return List.of();
        }
        Undo undo = blund.undo().orElseThrow(() -> new MalformedWindowException("main block without undo: " + block.hash()));
        List<Transaction> txs = block.transactions();
        List<TxUndo> undos = undo.txUndos();
        if (txs.size() != undos.size()) {
            throw new MalformedWindowException("Undo of block " + block.hash() + " has " + undos.size()
                    + " entries for " + txs.size() + " transactions");
        }
        List<TxWithUndo> out = new ArrayList<>(txs.size());
        for (int i = 0; i < txs.size(); i++) {
            out.add(new TxWithUndo(txs.get(i), undos.get(i), block.header()));
        }
        return out;
    }

    /** Oldest block first, block order inside each block. */
    public static List<TxWithUndo> forApply(OldestFirst<Blund> blunds) {
        List<TxWithUndo> out = new ArrayList<>();
        for (Blund blund : blunds.items()) {
            out.addAll(extract(blund));
        }
        return out;
    }

    /** Newest block first, reverse block order inside each block. */
    public static List<TxWithUndo> forRollback(NewestFirst<Blund> blunds) {
        List<TxWithUndo> out = new ArrayList<>();
        for (Blund blund : blunds.items()) {
            List<TxWithUndo> txs = new ArrayList<>(extract(blund));
            Collections.reverse(txs);
            out.addAll(txs);
        }
        return out;
    }

    /** Every block's prevHash must be the hash of the block before it. */
    public static void requireChainLinked(OldestFirst<Blund> blunds) {
        List<Blund> items = blunds.items();
        for (int i = 1; i < items.size(); i++) {
            Blund prev = items.get(i - 1);
            Blund next = items.get(i);
            if (!next.prevHash().equals(prev.hash())) {
                throw new MalformedWindowException("Block " + next.hash() + " does not follow " + prev.hash());
            }
        }
    }
}
