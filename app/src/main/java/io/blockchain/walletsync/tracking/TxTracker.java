package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.wallet.WalletSecret;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes wallet deltas from transaction streams.
 */
public interface TxTracker {

    /**
     * Delta for transactions applied in order.
     *
     * @param usedAddresses addresses already marked used in the wallet store
     * @param difficultyOf  chain difficulty of a header
     * @param timestampOf   wall-clock time of a header, empty for genesis headers
     * @param blockInfoOf   confirmation info for pending transactions, empty for genesis headers
     */
    Modifier trackingApplyTxs(WalletSecret key,
                              Set<String> usedAddresses,
                              Function<BlockHeader, Optional<Long>> difficultyOf,
                              Function<BlockHeader, Optional<Instant>> timestampOf,
                              Function<BlockHeader, Optional<Long>> blockInfoOf,
                              List<TxWithUndo> txs);

    /** Delta for transactions rolled back, newest first. */
    Modifier trackingRollbackTxs(WalletSecret key,
                                 Set<String> usedAddresses,
                                 Function<BlockHeader, Optional<Long>> difficultyOf,
                                 Function<BlockHeader, Optional<Instant>> timestampOf,
                                 List<TxWithUndo> txs);
}
