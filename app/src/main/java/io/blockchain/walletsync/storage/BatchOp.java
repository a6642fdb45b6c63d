package io.blockchain.walletsync.storage;

/**
 * Storage writes a block listener hands back to the block pipeline, which
 * commits them together with its own chain-state batch. Wallet state does not
 * share the pipeline's database yet, so listeners only ever return the empty batch.
 */
public final class BatchOp {
    private static final BatchOp EMPTY = new BatchOp();

    private BatchOp() {}

    public static BatchOp empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return this == EMPTY;
    }
}
