package io.blockchain.walletsync.protocol;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}

    public static Hash sha256(byte[] in){
        try {
            return new Hash(MessageDigest.getInstance("SHA-256").digest(in));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
