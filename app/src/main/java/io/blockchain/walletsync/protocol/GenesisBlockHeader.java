package io.blockchain.walletsync.protocol;

import java.nio.ByteBuffer;

/** Epoch boundary header. Carries no transactions and maps to no timestamp. */
public final class GenesisBlockHeader extends BlockHeader {
    private final long epoch;

    public GenesisBlockHeader(Hash prevHash, long epoch) {
        super(prevHash);
        if (epoch < 0) throw new IllegalArgumentException("epoch must be >= 0");
        this.epoch = epoch;
    }

    @Override public long epoch() { return epoch; }

    @Override public boolean isGenesis() { return true; }

    @Override
    public byte[] serialize() {
        ByteBuffer buf = allocate(8);
        buf.put(TAG_GENESIS);
        buf.put(prevHash().bytes());
        buf.putLong(epoch);
        return slice(buf);
    }

    @Override public String toString() {
        return "GenesisBlockHeader{epoch=" + epoch + ", hash=" + hash() + "}";
    }
}
