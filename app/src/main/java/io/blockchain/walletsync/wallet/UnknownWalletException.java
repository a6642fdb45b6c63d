package io.blockchain.walletsync.wallet;

public class UnknownWalletException extends RuntimeException {
    private final WalletId walletId;

    public UnknownWalletException(WalletId walletId) {
        super("Unknown wallet");
        this.walletId = walletId;
    }

    /** Not part of the message so the message stays safe for public logs. */
    public WalletId walletId() {
        return walletId;
    }
}
