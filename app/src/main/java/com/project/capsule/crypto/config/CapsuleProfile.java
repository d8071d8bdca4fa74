package com.project.capsule.crypto.config;

import org.bouncycastle.pqc.crypto.mldsa.MLDSAParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMParameters;

/**
 * Catalog of supported algorithm suites for time capsules.
 *
 * <p>Each profile fixes the key-encapsulation mechanism and the signature scheme, together
 * with the encoded sizes the key store and decryption path validate against.</p>
 */
public enum CapsuleProfile {
    ML_KEM_768_ML_DSA_65(
            "ML-KEM-768",
            "ML-DSA-65",
            MLKEMParameters.ml_kem_768,
            MLDSAParameters.ml_dsa_65,
            new Sizes(1184, 2400, 1088, 1952, 4032, 3309)
    );

    private final String kemAlgorithm;
    private final String signatureAlgorithm;
    private final MLKEMParameters kemParameters;
    private final MLDSAParameters signatureParameters;
    private final Sizes sizes;

    CapsuleProfile(String kemAlgorithm,
                   String signatureAlgorithm,
                   MLKEMParameters kemParameters,
                   MLDSAParameters signatureParameters,
                   Sizes sizes) {
        this.kemAlgorithm = kemAlgorithm;
        this.signatureAlgorithm = signatureAlgorithm;
        this.kemParameters = kemParameters;
        this.signatureParameters = signatureParameters;
        this.sizes = sizes;
    }

    public String kemAlgorithm() {
        return kemAlgorithm;
    }

    public String signatureAlgorithm() {
        return signatureAlgorithm;
    }

    public MLKEMParameters kemParameters() {
        return kemParameters;
    }

    public MLDSAParameters signatureParameters() {
        return signatureParameters;
    }

    public Sizes sizes() {
        return sizes;
    }

    /**
     * Encoded lengths in bytes.
     */
    public record Sizes(
            int kemPublicKey,
            int kemPrivateKey,
            int encapsulation,
            int signaturePublicKey,
            int signaturePrivateKey,
            int signature
    ) {
    }
}
