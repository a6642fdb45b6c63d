package io.blockchain.walletsync.logging;

/** Value that renders itself differently for secure and public sinks. */
public interface SafeFormattable {
    String format(SecurityLevel level);
}
