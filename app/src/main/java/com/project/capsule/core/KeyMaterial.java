package com.project.capsule.core;

import com.project.capsule.crypto.HashingUtils;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAPublicKeyParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPublicKeyParameters;

import java.util.Objects;

/**
 * The encapsulation pair and the signing pair owned by the key store.
 * Private halves never leave the core.
 */
public record KeyMaterial(
        MLKEMPublicKeyParameters encapsulationPublicKey,
        MLKEMPrivateKeyParameters encapsulationPrivateKey,
        MLDSAPublicKeyParameters signingPublicKey,
        MLDSAPrivateKeyParameters signingPrivateKey
) {

    public KeyMaterial {
        Objects.requireNonNull(encapsulationPublicKey, "encapsulationPublicKey must not be null");
        Objects.requireNonNull(encapsulationPrivateKey, "encapsulationPrivateKey must not be null");
        Objects.requireNonNull(signingPublicKey, "signingPublicKey must not be null");
        Objects.requireNonNull(signingPrivateKey, "signingPrivateKey must not be null");
    }

    /**
     * Short SHA-256 fingerprint over both public keys, suitable for display.
     */
    public String fingerprint() {
        byte[] digest = HashingUtils.sha256(
                encapsulationPublicKey.getEncoded(),
                signingPublicKey.getEncoded()
        );
        return HashingUtils.toHex(digest).substring(0, 2 + 16);
    }

    @Override
    public String toString() {
        return "KeyMaterial[fingerprint=" + fingerprint() + "]";
    }
}
