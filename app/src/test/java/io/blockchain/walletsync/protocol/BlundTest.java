package io.blockchain.walletsync.protocol;

import io.blockchain.walletsync.testing.TestChain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlundTest {

    @Test
    void genesisCarriesNoTransactionsOrUndo() {
        GenesisBlockHeader header = new GenesisBlockHeader(Hash.ZERO, 3);
        Blund genesis = Blund.genesis(header);

        assertTrue(genesis.header().isGenesis());
        assertTrue(genesis.undo().isEmpty());
        assertTrue(genesis.block().transactions().isEmpty());

        Transaction tx = TestChain.tx("x", new TxOut(TestChain.EXTERNAL, 1));
        assertThrows(IllegalArgumentException.class, () -> new Block(header, List.of(tx)));
        assertThrows(IllegalArgumentException.class, () -> new Blund(Block.genesis(header), new Undo(List.of())));
    }

    @Test
    void mainBlockRequiresUndo() {
        MainBlockHeader header = new MainBlockHeader(Hash.ZERO, new SlotId(0, 1), 1, Hash.ZERO);
        assertThrows(IllegalArgumentException.class, () -> new Blund(new Block(header, List.of()), null));
    }

    @Test
    void headerHashCoversParentAndSlot() {
        MainBlockHeader a = new MainBlockHeader(Hash.ZERO, new SlotId(0, 1), 1, Hash.ZERO);
        MainBlockHeader same = new MainBlockHeader(Hash.ZERO, new SlotId(0, 1), 1, Hash.ZERO);
        MainBlockHeader otherSlot = new MainBlockHeader(Hash.ZERO, new SlotId(0, 2), 1, Hash.ZERO);
        MainBlockHeader otherParent = new MainBlockHeader(TestChain.hashOf("p"), new SlotId(0, 1), 1, Hash.ZERO);

        assertEquals(a.hash(), same.hash());
        assertNotEquals(a.hash(), otherSlot.hash());
        assertNotEquals(a.hash(), otherParent.hash());
        assertNotEquals(a.hash(), new GenesisBlockHeader(Hash.ZERO, 0).hash());
    }

    @Test
    void transactionIdDependsOnOutputs() {
        Transaction one = Transaction.builder().input(Hash.ZERO, 0).output("a", 1).build();
        Transaction two = Transaction.builder().input(Hash.ZERO, 0).output("a", 2).build();

        assertNotEquals(one.id(), two.id());
        assertThrows(IllegalArgumentException.class, () -> Transaction.builder().input(Hash.ZERO, 0).build());
    }
}
