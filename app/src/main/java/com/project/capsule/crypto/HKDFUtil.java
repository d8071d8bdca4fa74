package com.project.capsule.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

import java.nio.charset.StandardCharsets;

/**
 * HKDF-SHA256 key derivation.
 */
public final class HKDFUtil {

    private static final byte[] CAPSULE_KEY_INFO =
            "QTC-CAPSULE-AES-256-GCM-KEY-v1".getBytes(StandardCharsets.UTF_8);

    private HKDFUtil() {
    }

    /**
     * Derive a key using HKDF-SHA256.
     *
     * @param inputKeyMaterial The input key material
     * @param salt Optional salt (can be null)
     * @param info Optional context/application specific information (can be null)
     * @param outputLength Desired output length in bytes
     * @return Derived key
     */
    public static byte[] deriveKey(byte[] inputKeyMaterial, byte[] salt, byte[] info, int outputLength) {
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(inputKeyMaterial, salt, info));

        byte[] output = new byte[outputLength];
        hkdf.generateBytes(output, 0, outputLength);
        return output;
    }

    /**
     * Derive the per-capsule AES key from the ML-KEM shared secret.
     */
    public static byte[] deriveCapsuleKey(byte[] sharedSecret) {
        return deriveKey(sharedSecret, null, CAPSULE_KEY_INFO, AeadCipher.KEY_BYTES);
    }
}
