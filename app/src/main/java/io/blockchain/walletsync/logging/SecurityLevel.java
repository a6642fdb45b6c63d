package io.blockchain.walletsync.logging;

/**
 * Which sink a log message is rendered for.
 * SECURE sinks may show wallet identifiers and amounts, PUBLIC sinks must not.
 */
public enum SecurityLevel {
    SECURE,
    PUBLIC
}
