package io.blockchain.walletsync.storage;

import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Hash;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Simple in-memory blund store. Good for tests and the demo node.
 * The tip starts at the configured root hash (the parent of the first stored block).
 */
public final class InMemoryBlundStore implements BlundStore {

    /** Map: blockHash -> Blund */
    private final Map<Hash, Blund> blunds = new HashMap<>();

    /** Current head (best tip) */
    private Hash tip;

    public InMemoryBlundStore(Hash root) {
        this.tip = Objects.requireNonNull(root, "root");
    }

    @Override
    public synchronized void putBlund(Blund blund) {
        if (blund == null) return;
        blunds.put(blund.hash(), blund);
    }

    @Override
    public synchronized Optional<Blund> getBlund(Hash blockHash) {
        if (blockHash == null) return Optional.empty();
        return Optional.ofNullable(blunds.get(blockHash));
    }

    @Override
    public synchronized Hash getTip() {
        return tip;
    }

    @Override
    public synchronized void setTip(Hash blockHash) {
        Objects.requireNonNull(blockHash, "blockHash");
        // the root has no stored block; every other head must be known
        if (!blunds.containsKey(blockHash) && !isRootOfStoredChain(blockHash)) {
            throw new IllegalArgumentException("Unknown head hash (store the block first)");
        }
        tip = blockHash;
    }

    @Override
    public synchronized long size() {
        return blunds.size();
    }

    private boolean isRootOfStoredChain(Hash hash) {
        for (Blund blund : blunds.values()) {
            if (blund.prevHash().equals(hash)) {
                return true;
            }
        }
        return false;
    }
}
