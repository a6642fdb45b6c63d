package io.blockchain.walletsync;

import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.config.WalletSyncConfig;
import io.blockchain.walletsync.listener.SyncReport;
import io.blockchain.walletsync.listener.WalletBlockListener;
import io.blockchain.walletsync.logging.SafeLog;
import io.blockchain.walletsync.metrics.SyncMetrics;
import io.blockchain.walletsync.protocol.Block;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.GenesisBlockHeader;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.MainBlockHeader;
import io.blockchain.walletsync.protocol.SlotId;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.protocol.TxUndo;
import io.blockchain.walletsync.protocol.Undo;
import io.blockchain.walletsync.reporting.ErrorReporter;
import io.blockchain.walletsync.reporting.JsonLinesErrorReporter;
import io.blockchain.walletsync.slotting.SlottingData;
import io.blockchain.walletsync.slotting.StaticSlotting;
import io.blockchain.walletsync.storage.InMemoryBlundStore;
import io.blockchain.walletsync.tracking.AddressTxTracker;
import io.blockchain.walletsync.wallet.InMemoryKeyStore;
import io.blockchain.walletsync.wallet.InMemoryWalletStore;
import io.blockchain.walletsync.wallet.WalletId;
import io.blockchain.walletsync.wallet.WalletSecret;
import io.blockchain.walletsync.wallet.WalletSyncState;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        WalletSyncConfig config = WalletSyncConfig.load(options.configFile());
        LOG.info("Using " + config);
        if (config.secureLogFile != null) {
            installSecureLog(config.secureLogFile);
        }
        ErrorReporter reporter = config.errorReportFile != null
                ? new JsonLinesErrorReporter(config.errorReportFile)
                : ErrorReporter.NONE;

        StaticSlotting slotting = new StaticSlotting(
                Instant.parse("2026-01-01T00:00:00Z"),
                SlottingData.uniform(Duration.ofSeconds(20), 100, 10),
                0L);
        InMemoryBlundStore chain = new InMemoryBlundStore(Hash.ZERO);
        InMemoryKeyStore keys = new InMemoryKeyStore();
        InMemoryWalletStore wallets = new InMemoryWalletStore();

        try (WalletBlockListener listener = new WalletBlockListener(
                chain, slotting, wallets, keys, new AddressTxTracker(), reporter, config)) {
            runDemoFlow(chain, keys, wallets, listener);
        }
        System.out.println(SyncMetrics.scrapeMetrics());
    }

    /**
     * Registers one wallet per sync state, applies a four-block window and rolls it back.
     */
    static void runDemoFlow(InMemoryBlundStore chain,
                            InMemoryKeyStore keys,
                            InMemoryWalletStore wallets,
                            WalletBlockListener listener) {
        WalletId alice = WalletId.of("alice");
        WalletId bob = WalletId.of("bob");
        WalletSecret aliceKey = keys.generate(alice);
        WalletSecret bobKey = keys.generate(bob);

        Hash root = chain.getTip();
        for (WalletId id : List.of(alice, bob, WalletId.of("carol-no-key"))) {
            wallets.addWallet(id);
            wallets.setWalletSyncTip(id, WalletSyncState.syncedWith(root));
        }
        wallets.addWallet(WalletId.of("dave-not-synced"));
        wallets.setWalletSyncTip(WalletId.of("dave-not-synced"), WalletSyncState.NOT_SYNCED);
        wallets.addWallet(WalletId.of("erin-no-record"));
        wallets.addWallet(WalletId.of("frank-behind"));
        wallets.setWalletSyncTip(WalletId.of("frank-behind"), WalletSyncState.syncedWith(Hash.fromHex("ff".repeat(32))));

        OldestFirst<Blund> window = demoWindow(root, aliceKey.address(0), bobKey.address(0));
        for (Blund blund : window.items()) {
            chain.putBlund(blund);
        }

        SyncReport applied = listener.applyBlocks(window);
        chain.setTip(window.newest().hash());
        LOG.info(applied.toString());
        LOG.info("alice after apply: " + wallets.snapshot(alice));
        LOG.info("bob after apply: " + wallets.snapshot(bob));

        NewestFirst<Blund> rollback = chain.newestBlunds(window.size());
        SyncReport rolledBack = listener.rollbackBlocks(rollback);
        chain.setTip(rollback.oldest().prevHash());
        LOG.info(rolledBack.toString());
        LOG.info("alice after rollback: " + wallets.snapshot(alice));
        LOG.info("bob after rollback: " + wallets.snapshot(bob));
    }

    /** Genesis block followed by three main blocks moving funds from alice to bob. */
    static OldestFirst<Blund> demoWindow(Hash root, String aliceAddr, String bobAddr) {
        List<Blund> out = new ArrayList<>();
        GenesisBlockHeader genesis = new GenesisBlockHeader(root, 0L);
        out.add(Blund.genesis(genesis));

        Transaction coinbase = Transaction.builder()
                .input(Hash.ZERO, 0)
                .output(aliceAddr, 1_000L)
                .build();
        Transaction pay = Transaction.builder()
                .input(coinbase.id(), 0)
                .output(bobAddr, 300L)
                .output(aliceAddr, 690L)
                .build();
        Transaction payBack = Transaction.builder()
                .input(pay.id(), 0)
                .output(aliceAddr, 295L)
                .build();

        Hash prev = genesis.hash();
        List<List<Transaction>> bodies = List.of(List.of(coinbase), List.of(pay), List.of(payBack));
        List<List<TxUndo>> undos = List.of(
                List.of(new TxUndo(List.of(new TxOut("00".repeat(20), 1_000L)))),
                List.of(new TxUndo(List.of(new TxOut(aliceAddr, 1_000L)))),
                List.of(new TxUndo(List.of(new TxOut(bobAddr, 300L)))));
        for (int i = 0; i < bodies.size(); i++) {
            List<Transaction> txs = bodies.get(i);
            MainBlockHeader header = new MainBlockHeader(prev, new SlotId(0L, i + 1), i + 1L, Block.bodyRootOf(txs));
            out.add(new Blund(new Block(header, txs), new Undo(undos.get(i))));
            prev = header.hash();
        }
        return OldestFirst.of(out);
    }

    private static void installSecureLog(Path file) throws IOException {
        FileHandler handler = new FileHandler(file.toString(), true);
        handler.setFormatter(new SimpleFormatter());
        SafeLog.addSecureHandler(handler);
        LOG.info("Secure log -> " + file);
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path configFile
    ) {
        static CliOptions parse(String[] args) {
            Path configFile = envPath("WALLET_SYNC_CONFIG", Path.of("./wallet-sync.json"));
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--config=")) {
                        String value = arg.substring("--config=".length());
                        if (value.isBlank()) {
                            showHelp = true;
                            error = "--config requires a file path";
                        } else {
                            configFile = Path.of(value);
                        }
                    } else {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }
            return new CliOptions(showHelp, error, configFile);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
                    Usage: wallet-sync [options]
                      --config=<file>   JSON settings (default ./wallet-sync.json, env WALLET_SYNC_CONFIG)
                      -h, --help        Show this help
                    """);
        }

        private static Path envPath(String name, Path fallback) {
            String value = System.getenv(name);
            return value == null || value.isBlank() ? fallback : Path.of(value);
        }
    }
}
