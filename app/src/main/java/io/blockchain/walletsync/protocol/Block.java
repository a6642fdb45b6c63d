package io.blockchain.walletsync.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Block = header + list of transactions.
 * Genesis blocks never carry transactions.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;

    public Block(BlockHeader header, List<Transaction> txs) {
        this.header = header;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        basicValidate();
    }

    public static Block genesis(GenesisBlockHeader header) {
        return new Block(header, List.of());
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public Hash hash() { return header.hash(); }
    public Hash prevHash() { return header.prevHash(); }
    public boolean isGenesis() { return header.isGenesis(); }

    /** Root over transaction ids, suitable for {@link MainBlockHeader#bodyRoot()}. */
    public static Hash bodyRootOf(List<Transaction> txs) {
        if (txs == null || txs.isEmpty()) return Hash.ZERO;
        List<byte[]> ids = new ArrayList<>(txs.size());
        int size = 0;
        for (Transaction tx : txs) {
            byte[] id = tx.id().bytes();
            ids.add(id);
            size += id.length;
        }
        byte[] all = new byte[size];
        int pos = 0;
        for (byte[] id : ids) {
            System.arraycopy(id, 0, all, pos, id.length);
            pos += id.length;
        }
        return Hashes.sha256(all);
    }

    private void basicValidate() {
        if (header == null) throw new IllegalArgumentException("missing header");
        if (header.isGenesis() && !transactions.isEmpty()) {
            throw new IllegalArgumentException("genesis block cannot carry transactions");
        }
    }

    @Override public String toString() {
        return "Block{hash=" + header.hash() + ", genesis=" + header.isGenesis() + ", txs=" + transactions.size() + "}";
    }
}
