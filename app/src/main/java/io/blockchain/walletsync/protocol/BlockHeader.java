package io.blockchain.walletsync.protocol;

import java.nio.ByteBuffer;

/**
 * Header of either a genesis (epoch boundary) block or a main block.
 * Only {@link MainBlockHeader} carries transactions, a difficulty and a slot
 * that maps to a wall-clock timestamp.
 *
 * The hash is SHA-256 over {@link #serialize()} and is computed once.
 */
public abstract class BlockHeader {
    static final byte TAG_GENESIS = 0;
    static final byte TAG_MAIN = 1;

    private final Hash prevHash;
    private Hash hash; // lazily computed

    protected BlockHeader(Hash prevHash) {
        if (prevHash == null) throw new IllegalArgumentException("missing prevHash");
        this.prevHash = prevHash;
    }

    public final Hash prevHash() { return prevHash; }

    public final synchronized Hash hash() {
        if (hash == null) {
            hash = Hashes.sha256(serialize());
        }
        return hash;
    }

    /** Epoch this header belongs to. */
    public abstract long epoch();

    public abstract boolean isGenesis();

    /** Deterministic header bytes: tag || prevHash || variant fields. */
    public abstract byte[] serialize();

    protected static ByteBuffer allocate(int variantBytes) {
        return ByteBuffer.allocate(1 + Hash.LENGTH + variantBytes);
    }

    protected static byte[] slice(ByteBuffer b){ b.flip(); byte[] out = new byte[b.remaining()]; b.get(out); return out; }

    @Override public boolean equals(Object o) {
        return o instanceof BlockHeader && hash().equals(((BlockHeader) o).hash());
    }

    @Override public int hashCode() {
        return hash().hashCode();
    }
}
