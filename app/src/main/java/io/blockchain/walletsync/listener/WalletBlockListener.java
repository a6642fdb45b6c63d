package io.blockchain.walletsync.listener;

import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.config.WalletSyncConfig;
import io.blockchain.walletsync.logging.SafeLog;
import io.blockchain.walletsync.metrics.SyncMetrics;
import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.MainBlockHeader;
import io.blockchain.walletsync.reporting.ErrorReporter;
import io.blockchain.walletsync.slotting.Slotting;
import io.blockchain.walletsync.slotting.SlottingData;
import io.blockchain.walletsync.storage.BatchOp;
import io.blockchain.walletsync.storage.ChainTip;
import io.blockchain.walletsync.tracking.Modifier;
import io.blockchain.walletsync.tracking.TxTracker;
import io.blockchain.walletsync.tracking.TxWithUndo;
import io.blockchain.walletsync.wallet.CustomAddressType;
import io.blockchain.walletsync.wallet.KeyStore;
import io.blockchain.walletsync.wallet.WalletId;
import io.blockchain.walletsync.wallet.WalletSecret;
import io.blockchain.walletsync.wallet.WalletStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static io.blockchain.walletsync.logging.SafeLog.safe;
import static io.blockchain.walletsync.logging.SafeLog.secretOnly;

/**
 * Keeps every tracked wallet in step with the chain as blocks are applied or rolled back.
 *
 * Per call: flatten the window into a transaction stream, read the current
 * chain tip once, then visit wallets one by one. A wallet is touched only when
 * its sync tip equals the current tip, and a failing wallet never stops the
 * others. Both entry points must be called under the pipeline's block lock.
 */
public final class WalletBlockListener implements BlockListener, AutoCloseable {
    public static final String LOGGER_NAME = "wallet.blistener";

    private static final SafeLog LOG = SafeLog.named(LOGGER_NAME);

    private final ChainTip chainTip;
    private final Slotting slotting;
    private final WalletStore walletStore;
    private final KeyStore keyStore;
    private final TxTracker tracker;
    private final TipGuard guard;
    private final ErrorIsolator isolator;
    private final TimeoutWatchdog watchdog;

    public WalletBlockListener(ChainTip chainTip,
                               Slotting slotting,
                               WalletStore walletStore,
                               KeyStore keyStore,
                               TxTracker tracker,
                               ErrorReporter reporter,
                               WalletSyncConfig config) {
        this(chainTip, slotting, walletStore, keyStore, tracker, reporter,
                new TimeoutWatchdog(slotting, config.watchdogDivisor, config.repeatWatchdogWarnings));
    }

    public WalletBlockListener(ChainTip chainTip,
                               Slotting slotting,
                               WalletStore walletStore,
                               KeyStore keyStore,
                               TxTracker tracker,
                               ErrorReporter reporter,
                               TimeoutWatchdog watchdog) {
        this.chainTip = Objects.requireNonNull(chainTip, "chainTip");
        this.slotting = Objects.requireNonNull(slotting, "slotting");
        this.walletStore = Objects.requireNonNull(walletStore, "walletStore");
        this.keyStore = Objects.requireNonNull(keyStore, "keyStore");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.guard = new TipGuard(walletStore, LOG);
        this.isolator = new ErrorIsolator(Objects.requireNonNull(reporter, "reporter"), LOG);
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
    }

    // Wallet writes go straight to the wallet store, so the returned batch stays
    // empty until the wallet state shares the pipeline's database. A malformed
    // window is logged and dropped so chain processing never fails here.
    @Override
    public BatchOp onApplyBlocks(OldestFirst<Blund> blunds) {
        try {
            applyBlocks(blunds);
        } catch (MalformedWindowException e) {
            LOG.warning(sl -> "Wallets not synced, apply window rejected: " + e.getMessage());
        }
        return BatchOp.empty();
    }

    @Override
    public BatchOp onRollbackBlocks(NewestFirst<Blund> blunds) {
        try {
            rollbackBlocks(blunds);
        } catch (MalformedWindowException e) {
            LOG.warning(sl -> "Wallets not synced, rollback window rejected: " + e.getMessage());
        }
        return BatchOp.empty();
    }

    /** @throws MalformedWindowException when the window is not chain-linked or its undo is misaligned */
    public SyncReport applyBlocks(OldestFirst<Blund> blunds) {
        Objects.requireNonNull(blunds, "blunds");
        return SyncMetrics.recordListenerCall(SyncPhase.APPLY.label(),
                () -> watchdog.watch(SyncPhase.APPLY, () -> syncApply(blunds)));
    }

    /** @throws MalformedWindowException when the window is not chain-linked or its undo is misaligned */
    public SyncReport rollbackBlocks(NewestFirst<Blund> blunds) {
        Objects.requireNonNull(blunds, "blunds");
        return SyncMetrics.recordListenerCall(SyncPhase.ROLLBACK.label(),
                () -> watchdog.watch(SyncPhase.ROLLBACK, () -> syncRollback(blunds)));
    }

    private SyncReport syncApply(OldestFirst<Blund> blunds) {
        BlockWindowExtractor.requireChainLinked(blunds);
        List<TxWithUndo> txs = BlockWindowExtractor.forApply(blunds);
        Hash newTip = blunds.newest().hash();
        Hash currentTip = chainTip.getTip();

        List<WalletSyncResult> results = new ArrayList<>();
        for (WalletId wallet : walletStore.getWalletAddresses()) {
            results.add(isolator.isolate(wallet, SyncPhase.APPLY, () -> guard.guard(currentTip, wallet, () -> {
                Function<BlockHeader, Optional<Instant>> timestampOf = headerTimestamps();
                Set<String> used = walletStore.getCustomAddresses(CustomAddressType.USED);
                WalletSecret key = keyStore.getSecretKeyById(wallet);
                Modifier modifier = tracker.trackingApplyTxs(key, used,
                        WalletBlockListener::difficultyOf, timestampOf, WalletBlockListener::blockInfoOf, txs);
                walletStore.applyModifierToWallet(wallet, newTip, modifier);
                logSynced(SyncPhase.APPLY, blunds.size(), wallet, modifier);
            })));
        }
        return finish(new SyncReport(SyncPhase.APPLY, blunds.size(), newTip, results));
    }

    private SyncReport syncRollback(NewestFirst<Blund> blunds) {
        BlockWindowExtractor.requireChainLinked(blunds.toOldestFirst());
        List<TxWithUndo> txs = BlockWindowExtractor.forRollback(blunds);
        Hash newTip = blunds.oldest().prevHash();
        Hash currentTip = chainTip.getTip();

        List<WalletSyncResult> results = new ArrayList<>();
        for (WalletId wallet : walletStore.getWalletAddresses()) {
            results.add(isolator.isolate(wallet, SyncPhase.ROLLBACK, () -> guard.guard(currentTip, wallet, () -> {
                WalletSecret key = keyStore.getSecretKeyById(wallet);
                Function<BlockHeader, Optional<Instant>> timestampOf = headerTimestamps();
                Set<String> used = walletStore.getCustomAddresses(CustomAddressType.USED);
                Modifier modifier = tracker.trackingRollbackTxs(key, used,
                        WalletBlockListener::difficultyOf, timestampOf, txs);
                walletStore.rollbackModifierFromWallet(wallet, newTip, modifier);
                logSynced(SyncPhase.ROLLBACK, blunds.size(), wallet, modifier);
            })));
        }
        return finish(new SyncReport(SyncPhase.ROLLBACK, blunds.size(), newTip, results));
    }

    private static SyncReport finish(SyncReport report) {
        for (WalletSyncResult result : report.results()) {
            SyncMetrics.recordOutcome(report.phase().label(), result.outcome().metricTag());
        }
        return report;
    }

    /** Header to slot start time; genesis headers and unknown epochs map to nothing. */
    private Function<BlockHeader, Optional<Instant>> headerTimestamps() {
        Instant systemStart = slotting.getSystemStart();
        SlottingData data = slotting.getSlottingData();
        return header -> {
            if (header instanceof MainBlockHeader main) {
                return data.slotStart(systemStart, main.slot());
            }
            return Optional.empty();
        };
    }

    static Optional<Long> difficultyOf(BlockHeader header) {
        if (header instanceof MainBlockHeader main) {
            return Optional.of(main.difficulty());
        }
        return Optional.empty();
    }

    /** Confirmation info for pending transactions. Genesis blocks confirm nothing. */
    static Optional<Long> blockInfoOf(BlockHeader header) {
        if (header.isGenesis()) {
            return Optional.empty();
        }
        return Optional.of(((MainBlockHeader) header).difficulty());
    }

    private static void logSynced(SyncPhase phase, int blocks, WalletId wallet, Modifier modifier) {
        LOG.info(sl -> phase.pastTense() + " " + blocks + " block(s) to wallet " + secretOnly(sl, wallet)
                + ", " + safe(sl, modifier));
    }

    @Override
    public void close() {
        watchdog.close();
    }
}
