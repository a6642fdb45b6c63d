package io.blockchain.walletsync.listener;

import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.storage.BatchOp;

/**
 * Callback of the block-processing pipeline. Each method is called exactly once
 * per event, serially, while the pipeline keeps chain state frozen.
 */
public interface BlockListener {

    /** Blocks appended to the chain; the chain tip is still the parent of the oldest one. */
    BatchOp onApplyBlocks(OldestFirst<Blund> blunds);

    /** Blocks removed from the chain; the chain tip is still the newest one. */
    BatchOp onRollbackBlocks(NewestFirst<Blund> blunds);
}
