package io.blockchain.walletsync.protocol;

import java.util.Arrays;

/**
 * 32-byte digest used for header hashes and transaction ids.
 */
public final class Hash {
    public static final int LENGTH = 32;
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Hash fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Hash hex must be 64 characters");
        }
        byte[] out = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            out[i] = (byte) Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
        }
        return new Hash(out);
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return toHex(bytes); }
    public String shortHex() { return hex().substring(0, 8); }

    private static String toHex(byte[] b){
        final char[] HEX="0123456789abcdef".toCharArray();
        char[] out=new char[b.length*2];
        for(int i=0,j=0;i<b.length;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return shortHex(); }
}
