package io.blockchain.walletsync.wallet;

/** Address sets the wallet store keeps across all wallets. */
public enum CustomAddressType {
    /** Addresses that appeared in a confirmed transaction. */
    USED
}
