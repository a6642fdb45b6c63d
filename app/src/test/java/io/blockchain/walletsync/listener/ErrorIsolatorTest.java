package io.blockchain.walletsync.listener;

import io.blockchain.walletsync.listener.WalletSyncResult.Outcome;
import io.blockchain.walletsync.logging.SafeLog;
import io.blockchain.walletsync.reporting.ErrorReporter;
import io.blockchain.walletsync.reporting.FailureReport;
import io.blockchain.walletsync.testing.CapturingHandler;
import io.blockchain.walletsync.wallet.WalletId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class ErrorIsolatorTest {
    private static final WalletId WALLET = WalletId.of("secret-wallet");

    private final SafeLog log = SafeLog.named("test.isolator");
    private final List<FailureReport> reports = new ArrayList<>();
    private CapturingHandler publicLogs;
    private CapturingHandler secureLogs;

    @BeforeEach
    void setUp() {
        publicLogs = CapturingHandler.attach(log.publicLogger());
        secureLogs = CapturingHandler.attach(log.secureLogger());
    }

    @AfterEach
    void tearDown() {
        publicLogs.detach();
        secureLogs.detach();
    }

    @Test
    void passesThroughTaskOutcome() {
        ErrorIsolator isolator = new ErrorIsolator(reports::add, log);

        WalletSyncResult result = isolator.isolate(WALLET, SyncPhase.APPLY, () -> Outcome.SKIPPED_NOT_SYNCED);

        assertEquals(Outcome.SKIPPED_NOT_SYNCED, result.outcome());
        assertTrue(result.failure().isEmpty());
        assertTrue(reports.isEmpty());
        assertTrue(publicLogs.messages().isEmpty());
    }

    @Test
    void failureBecomesResultReportAndWarning() {
        ErrorIsolator isolator = new ErrorIsolator(reports::add, log);

        WalletSyncResult result = isolator.isolate(WALLET, SyncPhase.ROLLBACK, () -> {
            throw new IllegalStateException("store offline");
        });

        assertEquals(Outcome.FAILED, result.outcome());
        assertTrue(result.failure().orElseThrow().contains("store offline"));

        assertEquals(1, reports.size());
        FailureReport report = reports.get(0);
        assertFalse(report.message().contains("secret-wallet"));
        assertTrue(report.message().contains("rollback"));
        assertEquals(IllegalStateException.class.getName(), report.exceptionType());
        assertEquals("store offline", report.exceptionMessage());

        String publicWarning = publicLogs.messages(Level.WARNING).get(0);
        assertTrue(publicWarning.contains("rollback"));
        assertTrue(publicWarning.contains("store offline"));
        assertFalse(publicWarning.contains("secret-wallet"));
        assertTrue(secureLogs.messages(Level.WARNING).get(0).contains("secret-wallet"));
    }

    @Test
    void checkedExceptionsAreIsolatedToo() {
        ErrorIsolator isolator = new ErrorIsolator(ErrorReporter.NONE, log);

        WalletSyncResult result = isolator.isolate(WALLET, SyncPhase.APPLY, () -> {
            throw new IOException("disk");
        });

        assertEquals(Outcome.FAILED, result.outcome());
    }

    @Test
    void brokenReporterDoesNotEscape() {
        ErrorReporter broken = report -> {
            throw new IOException("sink down");
        };
        ErrorIsolator isolator = new ErrorIsolator(broken, log);

        WalletSyncResult result = assertDoesNotThrow(() -> isolator.isolate(WALLET, SyncPhase.APPLY, () -> {
            throw new IllegalArgumentException("bad");
        }));

        assertEquals(Outcome.FAILED, result.outcome());
        assertEquals(1, publicLogs.messages(Level.WARNING).size());
    }

    @Test
    void interruptedTaskRestoresInterruptFlag() {
        ErrorIsolator isolator = new ErrorIsolator(ErrorReporter.NONE, log);
        try {
            WalletSyncResult result = isolator.isolate(WALLET, SyncPhase.APPLY, () -> {
                throw new InterruptedException("stop");
            });
            assertEquals(Outcome.FAILED, result.outcome());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
