package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.logging.SecurityLevel;
import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.protocol.TxUndo;
import io.blockchain.walletsync.testing.TestChain;
import io.blockchain.walletsync.wallet.InMemoryKeyStore;
import io.blockchain.walletsync.wallet.WalletId;
import io.blockchain.walletsync.wallet.WalletSecret;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class AddressTxTrackerTest {
    private static final Function<BlockHeader, Optional<Long>> NO_DIFFICULTY = h -> Optional.empty();
    private static final Function<BlockHeader, Optional<Instant>> NO_TIME = h -> Optional.empty();
    private static final Instant T0 = Instant.parse("2026-02-01T00:00:00Z");

    private final AddressTxTracker tracker = new AddressTxTracker();
    private WalletSecret key;
    private BlockHeader header;

    @BeforeEach
    void setUp() {
        key = new InMemoryKeyStore().generate(WalletId.of("tracked"));
        header = TestChain.mainBlund(TestChain.hashOf("parent"), 4, 17, List.of()).header();
    }

    @Test
    void ignoresTransactionsThatNeverTouchTheWallet() {
        Transaction tx = TestChain.tx("foreign", new TxOut(TestChain.EXTERNAL, 5));

        AccountModifier m = (AccountModifier) tracker.trackingApplyTxs(key, Set.of(), NO_DIFFICULTY, NO_TIME,
                h -> Optional.of(1L), List.of(new TxWithUndo(tx, TestChain.externalUndo(tx), header)));

        assertTrue(m.isEmpty());
        assertEquals(0, m.balanceDeltaMinor());
    }

    @Test
    void incomingPaymentBecomesHistoryWithHeaderData() {
        Transaction tx = TestChain.tx("incoming", new TxOut(key.address(0), 40), new TxOut(TestChain.EXTERNAL, 3));

        AccountModifier m = (AccountModifier) tracker.trackingApplyTxs(key, Set.of(),
                h -> Optional.of(17L), h -> Optional.of(T0), h -> Optional.of(17L),
                List.of(new TxWithUndo(tx, TestChain.externalUndo(tx), header)));

        assertEquals(1, m.history().size());
        TxHistoryEntry entry = m.history().get(0);
        assertEquals(tx.id(), entry.txId());
        assertEquals(header.hash(), entry.blockHash());
        assertEquals(Optional.of(17L), entry.difficulty());
        assertEquals(Optional.of(T0), entry.timestamp());
        assertEquals(40, entry.deltaMinor());
        assertEquals(40, m.balanceDeltaMinor());
        assertEquals(Long.valueOf(17), m.confirmations().get(tx.id()));
        assertEquals(Set.of(key.address(0)), m.newlyUsed());
    }

    @Test
    void spendingIsDetectedFromUndoEntries() {
        Transaction tx = Transaction.builder()
                .input(TestChain.hashOf("prev"), 0)
                .input(TestChain.hashOf("prev"), 1)
                .output(TestChain.EXTERNAL, 70)
                .output(key.address(1), 25)
                .build();
        TxUndo undo = new TxUndo(List.of(new TxOut(key.address(0), 60), new TxOut(TestChain.EXTERNAL, 40)));

        AccountModifier m = (AccountModifier) tracker.trackingApplyTxs(key, Set.of(key.address(0)),
                NO_DIFFICULTY, NO_TIME, h -> Optional.empty(), List.of(new TxWithUndo(tx, undo, header)));

        assertEquals(-35, m.balanceDeltaMinor());
        assertEquals(List.of(key.address(0), key.address(1)), m.usedAddresses());
        assertEquals(Set.of(key.address(1)), m.newlyUsed());
        assertTrue(m.confirmations().isEmpty());
    }

    @Test
    void addressIsNewlyUsedOnlyOncePerCall() {
        Transaction first = TestChain.tx("first", new TxOut(key.address(2), 1));
        Transaction second = TestChain.tx("second", new TxOut(key.address(2), 2));

        AccountModifier m = (AccountModifier) tracker.trackingApplyTxs(key, Set.of(), NO_DIFFICULTY, NO_TIME,
                h -> Optional.empty(), List.of(
                        new TxWithUndo(first, TestChain.externalUndo(first), header),
                        new TxWithUndo(second, TestChain.externalUndo(second), header)));

        assertEquals(List.of(key.address(2), key.address(2)), m.usedAddresses());
        assertEquals(Set.of(key.address(2)), m.newlyUsed());
    }

    @Test
    void rollbackMirrorsApplyWithoutNewlyUsedAddresses() {
        Transaction tx = TestChain.tx("mirror", new TxOut(key.address(0), 9));
        List<TxWithUndo> txs = List.of(new TxWithUndo(tx, TestChain.externalUndo(tx), header));

        AccountModifier applied = (AccountModifier) tracker.trackingApplyTxs(key, Set.of(), NO_DIFFICULTY, NO_TIME,
                h -> Optional.of(3L), txs);
        AccountModifier rolledBack = (AccountModifier) tracker.trackingRollbackTxs(key, Set.of(key.address(0)),
                NO_DIFFICULTY, NO_TIME, txs);

        assertEquals(applied.history(), rolledBack.history());
        assertEquals(applied.usedAddresses(), rolledBack.usedAddresses());
        assertEquals(applied.balanceDeltaMinor(), rolledBack.balanceDeltaMinor());
        assertTrue(rolledBack.newlyUsed().isEmpty());
        assertTrue(rolledBack.confirmations().isEmpty());
    }

    @Test
    void rejectsUndoNotAlignedWithInputs() {
        Transaction tx = TestChain.tx("misaligned", new TxOut(key.address(0), 1));
        TxUndo undo = new TxUndo(List.of());

        assertThrows(IllegalArgumentException.class, () -> tracker.trackingApplyTxs(key, Set.of(),
                NO_DIFFICULTY, NO_TIME, h -> Optional.empty(), List.of(new TxWithUndo(tx, undo, header))));
    }

    @Test
    void publicRenderingHidesAmountsAndIds() {
        Transaction tx = TestChain.tx("render", new TxOut(key.address(0), 12345));
        Blund blund = TestChain.mainBlund(TestChain.hashOf("p"), 1, 1, List.of(tx));
        AccountModifier m = (AccountModifier) tracker.trackingApplyTxs(key, Set.of(), NO_DIFFICULTY, NO_TIME,
                h -> Optional.empty(),
                List.of(new TxWithUndo(tx, blund.undo().orElseThrow().txUndos().get(0), blund.header())));

        String pub = m.format(SecurityLevel.PUBLIC);
        String secure = m.format(SecurityLevel.SECURE);
        assertFalse(pub.contains("12345"));
        assertFalse(pub.contains(tx.id().toString()));
        assertTrue(secure.contains("12345"));
        assertTrue(secure.contains(tx.id().toString()));
    }
}
