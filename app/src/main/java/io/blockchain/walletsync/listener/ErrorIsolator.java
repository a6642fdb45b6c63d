package io.blockchain.walletsync.listener;

import io.blockchain.walletsync.listener.WalletSyncResult.Outcome;
import io.blockchain.walletsync.logging.SafeLog;
import io.blockchain.walletsync.logging.SecurityLevel;
import io.blockchain.walletsync.reporting.ErrorReporter;
import io.blockchain.walletsync.reporting.FailureReport;
import io.blockchain.walletsync.wallet.WalletId;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.blockchain.walletsync.logging.SafeLog.secretOnly;

/**
 * Runs one wallet's sync task and turns any failure into a FAILED result.
 * Failures are reported (public rendering only) and logged; they never reach the caller.
 * Only {@link VirtualMachineError}s propagate.
 */
public final class ErrorIsolator {
    private static final Logger LOG = Logger.getLogger(ErrorIsolator.class.getName());

    @FunctionalInterface
    public interface WalletTask {
        Outcome run() throws Exception;
    }

    private final ErrorReporter reporter;
    private final SafeLog log;

    public ErrorIsolator(ErrorReporter reporter, SafeLog log) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.log = Objects.requireNonNull(log, "log");
    }

    public WalletSyncResult isolate(WalletId wallet, SyncPhase phase, WalletTask task) {
        try {
            return WalletSyncResult.of(wallet, task.run());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            report(prefix(SecurityLevel.PUBLIC, wallet, phase), e);
            log.warning(sl -> prefix(sl, wallet, phase) + e);
            return WalletSyncResult.failed(wallet, e.toString());
        }
    }

    private void report(String message, Throwable failure) {
        try {
            reporter.tryReport(FailureReport.of(message, failure));
        } catch (Exception reportFailure) {
            LOG.log(Level.FINE, "Error reporter rejected wallet sync failure", reportFailure);
        }
    }

    private static String prefix(SecurityLevel sl, WalletId wallet, SyncPhase phase) {
        return "Failed to sync wallet " + secretOnly(sl, wallet) + " in BListener (" + phase.label() + "): ";
    }
}
