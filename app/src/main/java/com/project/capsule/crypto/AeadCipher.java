package com.project.capsule.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-256-GCM with a detached tag.
 *
 * <p>Failures are reported as {@link GeneralSecurityException}; the capsule engine and the
 * decryption path translate them into their own error kinds.</p>
 */
public final class AeadCipher {

    public static final int KEY_BYTES = 32;
    public static final int NONCE_BYTES = 12;
    public static final int TAG_BYTES = 16;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private AeadCipher() {
    }

    public static byte[] newNonce(SecureRandom random) {
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        return nonce;
    }

    public static Sealed seal(byte[] key, byte[] nonce, byte[] plaintext, byte[] associatedData)
            throws GeneralSecurityException {
        Cipher cipher = init(Cipher.ENCRYPT_MODE, key, nonce, associatedData);
        byte[] output = cipher.doFinal(plaintext);
        int split = output.length - TAG_BYTES;
        return new Sealed(Arrays.copyOfRange(output, 0, split), Arrays.copyOfRange(output, split, output.length));
    }

    /**
     * @throws AEADBadTagException if the ciphertext, tag or associated data was altered.
     */
    public static byte[] open(byte[] key, byte[] nonce, byte[] ciphertext, byte[] tag, byte[] associatedData)
            throws GeneralSecurityException {
        if (tag.length != TAG_BYTES) {
            throw new AEADBadTagException(
                    "Authentication tag must be " + TAG_BYTES + " bytes, got " + tag.length);
        }
        Cipher cipher = init(Cipher.DECRYPT_MODE, key, nonce, associatedData);
        byte[] input = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
        System.arraycopy(tag, 0, input, ciphertext.length, tag.length);
        return cipher.doFinal(input);
    }

    private static Cipher init(int mode, byte[] key, byte[] nonce, byte[] associatedData)
            throws GeneralSecurityException {
        if (key.length != KEY_BYTES) {
            throw new InvalidKeyException("AES key must be " + KEY_BYTES + " bytes");
        }
        if (nonce.length != NONCE_BYTES) {
            throw new InvalidAlgorithmParameterException("GCM nonce must be " + NONCE_BYTES + " bytes");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BYTES * 8, nonce));
        cipher.updateAAD(associatedData);
        return cipher;
    }

    /**
     * Ciphertext and tag, split.
     */
    public record Sealed(byte[] ciphertext, byte[] tag) {
    }
}
