package io.blockchain.walletsync.storage;

import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Hash;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Minimal chain persistence API: blunds by header hash plus the current head.
 */
public interface BlundStore extends ChainTip {

    /** Persist a blund (idempotent). */
    void putBlund(Blund blund);

    Optional<Blund> getBlund(Hash blockHash);

    /** Force the head hash. The block must be stored first. */
    void setTip(Hash blockHash);

    long size();

    /** The {@code depth} newest blocks ending at the current tip. */
    default NewestFirst<Blund> newestBlunds(int depth) {
        if (depth <= 0) {
            throw new IllegalArgumentException("depth must be > 0");
        }
        List<Blund> out = new ArrayList<>(depth);
        Hash cursor = getTip();
        while (out.size() < depth) {
            Optional<Blund> blund = getBlund(cursor);
            if (blund.isEmpty()) break;
            out.add(blund.get());
            cursor = blund.get().prevHash();
        }
        return NewestFirst.of(out);
    }
}
