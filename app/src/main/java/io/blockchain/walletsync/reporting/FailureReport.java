package io.blockchain.walletsync.reporting;

import java.time.Instant;
import java.util.Objects;

/**
 * Failure description that is safe to send off the node: no wallet ids, no keys.
 */
public final class FailureReport {
    private final Instant time;
    private final String message;
    private final String exceptionType;
    private final String exceptionMessage;

    public FailureReport(Instant time, String message, String exceptionType, String exceptionMessage) {
        this.time = Objects.requireNonNull(time, "time");
        this.message = Objects.requireNonNull(message, "message");
        this.exceptionType = exceptionType;
        this.exceptionMessage = exceptionMessage;
    }

    public static FailureReport of(String message, Throwable failure) {
        return new FailureReport(Instant.now(), message,
                failure == null ? null : failure.getClass().getName(),
                failure == null ? null : failure.getMessage());
    }

    public Instant time() { return time; }
    public String message() { return message; }
    public String exceptionType() { return exceptionType; }
    public String exceptionMessage() { return exceptionMessage; }

    @Override public String toString() {
        return message + (exceptionType == null ? "" : " (" + exceptionType + ": " + exceptionMessage + ")");
    }
}
