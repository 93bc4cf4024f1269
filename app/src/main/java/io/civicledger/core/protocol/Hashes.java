package io.civicledger.core.protocol;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers shared by block sealing and report privacy hashing.
 */
public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Privacy hash of a single opaque string (citizen description, evidence reference).
     * Only the returned digest may ever be placed in a block.
     */
    public static Digest digest(String rawText) {
        if (rawText == null) throw new IllegalArgumentException("rawText must not be null");
        return new Digest(sha256(rawText.getBytes(StandardCharsets.UTF_8)));
    }

    /** Digest of an already canonical byte encoding. */
    public static Digest digest(byte[] canonical) {
        return new Digest(sha256(canonical));
    }
}
