package io.blockchain.walletsync.storage;

import io.blockchain.walletsync.protocol.Hash;

/** Read access to the hash of the current chain head. */
public interface ChainTip {
    Hash getTip();
}
