package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.protocol.Hashes;

import java.nio.ByteBuffer;
import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Key material of one wallet plus the addresses derived from it.
 * Address i = first 20 bytes of SHA-256(publicKey || i), hex encoded.
 */
public final class WalletSecret {
    private final WalletId walletId;
    private final KeyPair keyPair;
    private final Set<String> addresses;

    public WalletSecret(WalletId walletId, KeyPair keyPair, int addressCount) {
        this.walletId = Objects.requireNonNull(walletId, "walletId");
        this.keyPair = Objects.requireNonNull(keyPair, "keyPair");
        if (addressCount <= 0) {
            throw new IllegalArgumentException("addressCount must be > 0");
        }
        Set<String> derived = new LinkedHashSet<>();
        for (int i = 0; i < addressCount; i++) {
            derived.add(deriveAddress(keyPair.getPublic(), i));
        }
        this.addresses = Collections.unmodifiableSet(derived);
    }

    public static String deriveAddress(PublicKey pub, int index) {
        byte[] encoded = pub.getEncoded();
        ByteBuffer buf = ByteBuffer.allocate(encoded.length + 4);
        buf.put(encoded);
        buf.putInt(index);
        return Hashes.sha256(buf.array()).hex().substring(0, 40);
    }

    public WalletId walletId() { return walletId; }
    public PublicKey publicKey() { return keyPair.getPublic(); }

    /** Derived addresses in derivation order. */
    public Set<String> addresses() { return addresses; }

    public String address(int index) {
        int i = 0;
        for (String address : addresses) {
            if (i++ == index) return address;
        }
        throw new IndexOutOfBoundsException("address index " + index);
    }

    public boolean owns(String address) {
        return addresses.contains(address);
    }

    @Override public String toString() {
        return "WalletSecret{<redacted>}";
    }
}
