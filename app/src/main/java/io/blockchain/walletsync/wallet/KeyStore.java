package io.blockchain.walletsync.wallet;

/** Lookup of wallet key material. */
public interface KeyStore {

    /** @throws UnknownWalletException when no key is stored for {@code walletId} */
    WalletSecret getSecretKeyById(WalletId walletId);
}
