package com.project.capsule.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers used for key fingerprints.
 */
public final class HashingUtils {
    private static final ThreadLocal<MessageDigest> SHA256 = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    });

    private HashingUtils() {
    }

    public static byte[] sha256(byte[]... inputs) {
        MessageDigest digest = SHA256.get();
        digest.reset();
        for (byte[] input : inputs) {
            digest.update(input);
        }
        return digest.digest();
    }

    public static String toHex(byte[] input) {
        return "0x" + HexFormat.of().formatHex(input);
    }
}
