package io.civicledger.core.protocol;

import java.util.Arrays;

/**
 * A 32-byte SHA-256 digest. Blocks only ever hold digests of citizen content,
 * so a raw description cannot be passed where a {@code Digest} is expected.
 */
public final class Digest {
    public static final int LENGTH = 32;
    public static final Digest ZERO = new Digest(new byte[LENGTH]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    public Digest(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Digest must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Digest fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Digest hex must be 64 characters");
        }
        byte[] out = new byte[LENGTH];
        for (int i = 0; i < hex.length(); i += 2) {
            int hi = Character.digit(hex.charAt(i), 16);
            int lo = Character.digit(hex.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Digest hex must be hexadecimal: " + hex);
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return new Digest(out);
    }

    public byte[] bytes() { return bytes.clone(); }

    public String hex() {
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    @Override public boolean equals(Object o){ return o instanceof Digest && Arrays.equals(bytes, ((Digest)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Digest(" + hex().substring(0, 8) + "…)"; }
}
