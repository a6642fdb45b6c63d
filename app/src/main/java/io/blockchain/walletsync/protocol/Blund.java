package io.blockchain.walletsync.protocol;

import java.util.Optional;

/**
 * A block paired with its undo data. Undo exists only for main blocks.
 */
public final class Blund {
    private final Block block;
    private final Undo undo; // null for genesis blocks

    public Blund(Block block, Undo undo) {
        if (block == null) throw new IllegalArgumentException("missing block");
        if (block.isGenesis() && undo != null) {
            throw new IllegalArgumentException("genesis block cannot carry undo data");
        }
        if (!block.isGenesis() && undo == null) {
            throw new IllegalArgumentException("main block requires undo data");
        }
        this.block = block;
        this.undo = undo;
    }

    public static Blund genesis(GenesisBlockHeader header) {
        return new Blund(Block.genesis(header), null);
    }

    public Block block() { return block; }
    public Optional<Undo> undo() { return Optional.ofNullable(undo); }
    public BlockHeader header() { return block.header(); }
    public Hash hash() { return block.hash(); }
    public Hash prevHash() { return block.prevHash(); }

    @Override public String toString() {
        return "Blund{" + block + "}";
    }
}
