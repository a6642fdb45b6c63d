package io.blockchain.walletsync.wallet;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps generated EC key pairs in memory. Not persistent.
 */
public final class InMemoryKeyStore implements KeyStore {
    private static final int KEY_SIZE = 256;
    private static final int DEFAULT_ADDRESS_COUNT = 4;

    private final Map<WalletId, WalletSecret> secrets = new HashMap<>();

    public synchronized WalletSecret generate(WalletId walletId) {
        return generate(walletId, DEFAULT_ADDRESS_COUNT);
    }

    public synchronized WalletSecret generate(WalletId walletId, int addressCount) {
        Objects.requireNonNull(walletId, "walletId");
        if (secrets.containsKey(walletId)) {
            throw new IllegalArgumentException("Wallet key already exists");
        }
        WalletSecret secret = new WalletSecret(walletId, newKeyPair(), addressCount);
        secrets.put(walletId, secret);
        return secret;
    }

    public synchronized void remove(WalletId walletId) {
        secrets.remove(walletId);
    }

    @Override
    public synchronized WalletSecret getSecretKeyById(WalletId walletId) {
        WalletSecret secret = secrets.get(walletId);
        if (secret == null) {
            throw new UnknownWalletException(walletId);
        }
        return secret;
    }

    private static KeyPair newKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(KEY_SIZE);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("EC key generation not available", e);
        }
    }
}
