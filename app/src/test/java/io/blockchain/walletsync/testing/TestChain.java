package io.blockchain.walletsync.testing;

import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.protocol.Block;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.GenesisBlockHeader;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.Hashes;
import io.blockchain.walletsync.protocol.MainBlockHeader;
import io.blockchain.walletsync.protocol.SlotId;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxIn;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.protocol.TxUndo;
import io.blockchain.walletsync.protocol.Undo;
import io.blockchain.walletsync.slotting.SlottingData;
import io.blockchain.walletsync.slotting.StaticSlotting;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Builders for chained blunds used across tests. */
public final class TestChain {
    public static final Instant SYSTEM_START = Instant.parse("2026-01-01T00:00:00Z");
    public static final Duration SLOT = Duration.ofSeconds(20);
    public static final String EXTERNAL = "external-address";

    private TestChain() {}

    public static StaticSlotting slotting() {
        return new StaticSlotting(SYSTEM_START, SlottingData.uniform(SLOT, 100, 10), 0L);
    }

    public static Hash hashOf(String seed) {
        return Hashes.sha256(seed.getBytes(StandardCharsets.UTF_8));
    }

    /** Transaction spending one unrelated output, paying {@code outs}. */
    public static Transaction tx(String seed, TxOut... outs) {
        Transaction.Builder b = Transaction.builder().input(hashOf(seed), 0);
        for (TxOut out : outs) b.output(out);
        return b.build();
    }

    /** Undo entry where every input spent an output of {@link #EXTERNAL}. */
    public static TxUndo externalUndo(Transaction tx) {
        List<TxOut> spent = new ArrayList<>();
        for (TxIn ignored : tx.inputs()) {
            spent.add(new TxOut(EXTERNAL, 0L));
        }
        return new TxUndo(spent);
    }

    public static Blund mainBlund(Hash prev, int localSlot, long difficulty, List<Transaction> txs, List<TxUndo> undos) {
        MainBlockHeader header = new MainBlockHeader(prev, new SlotId(0L, localSlot), difficulty, Block.bodyRootOf(txs));
        return new Blund(new Block(header, txs), new Undo(undos));
    }

    public static Blund mainBlund(Hash prev, int localSlot, long difficulty, List<Transaction> txs) {
        List<TxUndo> undos = new ArrayList<>();
        for (Transaction tx : txs) undos.add(externalUndo(tx));
        return mainBlund(prev, localSlot, difficulty, txs, undos);
    }

    public static Blund genesisBlund(Hash prev, long epoch) {
        return Blund.genesis(new GenesisBlockHeader(prev, epoch));
    }

    /** {@code count} chained main blocks after {@code root}, block i carrying {@code txsPerBlock} unrelated txs. */
    public static OldestFirst<Blund> chain(Hash root, int count, int txsPerBlock) {
        List<Blund> out = new ArrayList<>();
        Hash prev = root;
        for (int i = 1; i <= count; i++) {
            List<Transaction> txs = new ArrayList<>();
            for (int t = 0; t < txsPerBlock; t++) {
                txs.add(tx("block-" + i + "-tx-" + t + "-" + root.hex(), new TxOut(EXTERNAL, 10L + t)));
            }
            Blund blund = mainBlund(prev, i, i, txs);
            out.add(blund);
            prev = blund.hash();
        }
        return OldestFirst.of(out);
    }
}
