package io.blockchain.walletsync.protocol;

import java.nio.ByteBuffer;

/**
 * Header of a block that carries transactions.
 * - slot: position used to derive the block timestamp
 * - difficulty: chain difficulty (number of main blocks up to and including this one)
 * - bodyRoot: commitment to the transaction list
 */
public final class MainBlockHeader extends BlockHeader {
    private final SlotId slot;
    private final long difficulty;
    private final Hash bodyRoot;

    public MainBlockHeader(Hash prevHash, SlotId slot, long difficulty, Hash bodyRoot) {
        super(prevHash);
        if (slot == null) throw new IllegalArgumentException("missing slot");
        if (difficulty < 0) throw new IllegalArgumentException("difficulty must be >= 0");
        this.slot = slot;
        this.difficulty = difficulty;
        this.bodyRoot = bodyRoot != null ? bodyRoot : Hash.ZERO;
    }

    public SlotId slot() { return slot; }
    public long difficulty() { return difficulty; }
    public Hash bodyRoot() { return bodyRoot; }

    @Override public long epoch() { return slot.epoch(); }

    @Override public boolean isGenesis() { return false; }

    @Override
    public byte[] serialize() {
        ByteBuffer buf = allocate(8 + 4 + 8 + Hash.LENGTH);
        buf.put(TAG_MAIN);
        buf.put(prevHash().bytes());
        buf.putLong(slot.epoch());
        buf.putInt(slot.localSlot());
        buf.putLong(difficulty);
        buf.put(bodyRoot.bytes());
        return slice(buf);
    }

    @Override public String toString() {
        return "MainBlockHeader{slot=" + slot + ", difficulty=" + difficulty + ", hash=" + hash() + "}";
    }
}
