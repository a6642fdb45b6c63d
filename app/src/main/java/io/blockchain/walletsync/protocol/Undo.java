package io.blockchain.walletsync.protocol;

import java.util.List;

/** Per-transaction undo entries of one main block, in block transaction order. */
public final class Undo {
    private final List<TxUndo> txUndos;

    public Undo(List<TxUndo> txUndos) {
        this.txUndos = txUndos != null ? List.copyOf(txUndos) : List.of();
    }

    public List<TxUndo> txUndos() { return txUndos; }

    public int size() { return txUndos.size(); }
}
