package io.blockchain.walletsync.reporting;

/**
 * Sink for failures that operators should see. Callers treat reporting as best effort.
 */
public interface ErrorReporter {

    /** Discards every report. */
    ErrorReporter NONE = report -> { };

    void tryReport(FailureReport report) throws Exception;
}
