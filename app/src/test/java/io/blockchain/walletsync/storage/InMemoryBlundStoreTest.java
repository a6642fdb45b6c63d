package io.blockchain.walletsync.storage;

import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.testing.TestChain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBlundStoreTest {
    private static final Hash ROOT = TestChain.hashOf("root");

    @Test
    void newestBlundsWalksBackFromTip() {
        InMemoryBlundStore store = new InMemoryBlundStore(ROOT);
        OldestFirst<Blund> chain = TestChain.chain(ROOT, 4, 1);
        chain.items().forEach(store::putBlund);
        store.setTip(chain.newest().hash());

        NewestFirst<Blund> last2 = store.newestBlunds(2);
        assertEquals(List.of(chain.items().get(3), chain.items().get(2)), last2.items());

        // deeper than the stored chain stops at the root
        assertEquals(4, store.newestBlunds(10).size());
    }

    @Test
    void tipMayMoveBackToRootButNotToUnknownBlocks() {
        InMemoryBlundStore store = new InMemoryBlundStore(ROOT);
        OldestFirst<Blund> chain = TestChain.chain(ROOT, 2, 0);
        chain.items().forEach(store::putBlund);

        store.setTip(chain.newest().hash());
        store.setTip(ROOT);
        assertEquals(ROOT, store.getTip());
        assertThrows(IllegalArgumentException.class, () -> store.setTip(TestChain.hashOf("unknown")));
        assertEquals(2, store.size());
    }
}
