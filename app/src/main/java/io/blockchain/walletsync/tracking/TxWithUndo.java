package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxUndo;

import java.util.Objects;

/** A transaction, its undo entry and the header of the block containing it. */
public final class TxWithUndo {
    private final Transaction tx;
    private final TxUndo undo;
    private final BlockHeader header;

    public TxWithUndo(Transaction tx, TxUndo undo, BlockHeader header) {
        this.tx = Objects.requireNonNull(tx, "tx");
        this.undo = Objects.requireNonNull(undo, "undo");
        this.header = Objects.requireNonNull(header, "header");
    }

    public Transaction tx() { return tx; }
    public TxUndo undo() { return undo; }
    public BlockHeader header() { return header; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TxWithUndo)) return false;
        TxWithUndo other = (TxWithUndo) o;
        return tx.equals(other.tx) && undo.equals(other.undo) && header.equals(other.header);
    }

    @Override public int hashCode() { return Objects.hash(tx, undo, header); }

    @Override public String toString() {
        return "TxWithUndo{tx=" + tx.id() + ", block=" + header.hash() + "}";
    }
}
