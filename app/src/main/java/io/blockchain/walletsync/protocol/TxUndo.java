package io.blockchain.walletsync.protocol;

import java.util.List;

/**
 * Rollback information for one transaction: the outputs its inputs consumed,
 * index-aligned with {@link Transaction#inputs()}.
 */
public final class TxUndo {
    private final List<TxOut> spentOutputs;

    public TxUndo(List<TxOut> spentOutputs) {
        this.spentOutputs = spentOutputs != null ? List.copyOf(spentOutputs) : List.of();
    }

    public List<TxOut> spentOutputs() { return spentOutputs; }

    @Override public boolean equals(Object o) {
        return o instanceof TxUndo && spentOutputs.equals(((TxUndo) o).spentOutputs);
    }

    @Override public int hashCode() { return spentOutputs.hashCode(); }

    @Override public String toString() {
        return "TxUndo{spent=" + spentOutputs.size() + "}";
    }
}
