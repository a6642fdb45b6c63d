package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.logging.SafeFormattable;

/**
 * Wallet state delta computed by a {@link TxTracker}. The block listener only
 * passes it from the tracker to the wallet store and logs its summary.
 */
public interface Modifier extends SafeFormattable {
}
