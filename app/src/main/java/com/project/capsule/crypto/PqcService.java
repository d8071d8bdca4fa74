package com.project.capsule.crypto;

import com.project.capsule.core.CapsuleException.DecapsulationException;
import com.project.capsule.core.CapsuleException.EncapsulationException;
import com.project.capsule.core.CapsuleException.KeyCorruptionException;
import com.project.capsule.core.CapsuleException.KeyGenerationException;
import com.project.capsule.core.CapsuleException.SigningException;
import com.project.capsule.core.KeyMaterial;
import com.project.capsule.crypto.config.CapsuleProfile;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.SecretWithEncapsulation;
import org.bouncycastle.crypto.params.ParametersWithRandom;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAPublicKeyParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSASigner;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMExtractor;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPublicKeyParameters;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * High-level façade over the post-quantum primitives used by time capsules.
 *
 * <ul>
 *     <li><strong>generateKeyMaterial</strong>: ML-KEM encapsulation pair plus ML-DSA signing pair.</li>
 *     <li><strong>encapsulate/decapsulate</strong>: establish the per-capsule shared secret.</li>
 *     <li><strong>sign/verify</strong>: authenticate the capsule record.</li>
 *     <li><strong>decode*</strong>: rebuild key parameters from stored encodings, checking sizes.</li>
 * </ul>
 *
 * <p>Every BouncyCastle failure is translated here into a typed {@code CapsuleException}.</p>
 */
public class PqcService {

    private static final byte[] PAIR_CHECK_MESSAGE =
            "QTC-KEYPAIR-CONSISTENCY-CHECK".getBytes(StandardCharsets.UTF_8);

    private final CapsuleProfile profile;
    private final SecureRandom random;

    public PqcService(CapsuleProfile profile) {
        this(profile, new SecureRandom());
    }

    public PqcService(CapsuleProfile profile, SecureRandom random) {
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public CapsuleProfile profile() {
        return profile;
    }

    /**
     * Generate a fresh encapsulation pair and a fresh signing pair.
     */
    public KeyMaterial generateKeyMaterial() {
        try {
            MLKEMKeyPairGenerator kemGenerator = new MLKEMKeyPairGenerator();
            kemGenerator.init(new MLKEMKeyGenerationParameters(random, profile.kemParameters()));
            AsymmetricCipherKeyPair kemPair = kemGenerator.generateKeyPair();

            MLDSAKeyPairGenerator signatureGenerator = new MLDSAKeyPairGenerator();
            signatureGenerator.init(new MLDSAKeyGenerationParameters(random, profile.signatureParameters()));
            AsymmetricCipherKeyPair signaturePair = signatureGenerator.generateKeyPair();

            return new KeyMaterial(
                    (MLKEMPublicKeyParameters) kemPair.getPublic(),
                    (MLKEMPrivateKeyParameters) kemPair.getPrivate(),
                    (MLDSAPublicKeyParameters) signaturePair.getPublic(),
                    (MLDSAPrivateKeyParameters) signaturePair.getPrivate()
            );
        } catch (RuntimeException e) {
            ErrorLogger.logError("PqcService.generateKeyMaterial", "Key pair generation failed", e);
            throw new KeyGenerationException("Failed to generate " + profile.kemAlgorithm() + "/"
                    + profile.signatureAlgorithm() + " key pairs", e);
        }
    }

    /**
     * Encapsulate a random shared secret against the encapsulation public key.
     */
    public EncapsulationResult encapsulate(MLKEMPublicKeyParameters publicKey) {
        Objects.requireNonNull(publicKey, "publicKey must not be null");
        try {
            SecretWithEncapsulation result = new MLKEMGenerator(random).generateEncapsulated(publicKey);
            return new EncapsulationResult(result.getSecret(), result.getEncapsulation());
        } catch (RuntimeException e) {
            ErrorLogger.logError("PqcService.encapsulate", "Encapsulation failed", e);
            throw new EncapsulationException(profile.kemAlgorithm() + " encapsulation failed", e);
        }
    }

    /**
     * Recover the shared secret from an encapsulated key.
     */
    public byte[] decapsulate(MLKEMPrivateKeyParameters privateKey, byte[] encapsulation) {
        Objects.requireNonNull(privateKey, "privateKey must not be null");
        Objects.requireNonNull(encapsulation, "encapsulation must not be null");
        if (encapsulation.length != profile.sizes().encapsulation()) {
            throw new DecapsulationException(String.format(
                    "Encapsulated key has invalid length: expected %d bytes, got %d",
                    profile.sizes().encapsulation(), encapsulation.length));
        }
        try {
            return new MLKEMExtractor(privateKey).extractSecret(encapsulation);
        } catch (RuntimeException e) {
            ErrorLogger.logError("PqcService.decapsulate", "Decapsulation failed", e);
            throw new DecapsulationException(profile.kemAlgorithm() + " decapsulation failed", e);
        }
    }

    public byte[] sign(MLDSAPrivateKeyParameters privateKey, byte[] message) {
        Objects.requireNonNull(privateKey, "privateKey must not be null");
        Objects.requireNonNull(message, "message must not be null");
        try {
            MLDSASigner signer = new MLDSASigner();
            signer.init(true, new ParametersWithRandom(privateKey, random));
            signer.update(message, 0, message.length);
            return signer.generateSignature();
        } catch (Exception e) {
            ErrorLogger.logError("PqcService.sign", "Signing failed", e);
            throw new SigningException(profile.signatureAlgorithm() + " signing failed", e);
        }
    }

    /**
     * @return {@code true} only if {@code signature} was produced over {@code message} by the
     * private half of {@code publicKey}. Malformed signatures verify as {@code false}.
     */
    public boolean verify(MLDSAPublicKeyParameters publicKey, byte[] message, byte[] signature) {
        Objects.requireNonNull(publicKey, "publicKey must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(signature, "signature must not be null");
        if (signature.length != profile.sizes().signature()) {
            return false;
        }
        try {
            MLDSASigner verifier = new MLDSASigner();
            verifier.init(false, publicKey);
            verifier.update(message, 0, message.length);
            return verifier.verifySignature(signature);
        } catch (RuntimeException e) {
            ErrorLogger.logWarning("PqcService.verify",
                    "Signature rejected by primitive: " + e.getClass().getSimpleName());
            return false;
        }
    }

    // ----- Key decoding -----

    public MLKEMPublicKeyParameters decodeEncapsulationPublicKey(byte[] encoded) {
        checkLength(encoded, profile.sizes().kemPublicKey(), profile.kemAlgorithm() + " public key");
        try {
            return new MLKEMPublicKeyParameters(profile.kemParameters(), encoded);
        } catch (RuntimeException e) {
            throw new KeyCorruptionException("Malformed " + profile.kemAlgorithm() + " public key", e);
        }
    }

    public MLKEMPrivateKeyParameters decodeEncapsulationPrivateKey(byte[] encoded) {
        checkLength(encoded, profile.sizes().kemPrivateKey(), profile.kemAlgorithm() + " private key");
        try {
            return new MLKEMPrivateKeyParameters(profile.kemParameters(), encoded);
        } catch (RuntimeException e) {
            throw new KeyCorruptionException("Malformed " + profile.kemAlgorithm() + " private key", e);
        }
    }

    public MLDSAPublicKeyParameters decodeSigningPublicKey(byte[] encoded) {
        checkLength(encoded, profile.sizes().signaturePublicKey(), profile.signatureAlgorithm() + " public key");
        try {
            return new MLDSAPublicKeyParameters(profile.signatureParameters(), encoded);
        } catch (RuntimeException e) {
            throw new KeyCorruptionException("Malformed " + profile.signatureAlgorithm() + " public key", e);
        }
    }

    /**
     * The full private encoding only round-trips when rebuilt against its public key.
     */
    public MLDSAPrivateKeyParameters decodeSigningPrivateKey(byte[] encoded, MLDSAPublicKeyParameters publicKey) {
        Objects.requireNonNull(publicKey, "publicKey must not be null");
        checkLength(encoded, profile.sizes().signaturePrivateKey(), profile.signatureAlgorithm() + " private key");
        try {
            return new MLDSAPrivateKeyParameters(profile.signatureParameters(), encoded, publicKey);
        } catch (RuntimeException e) {
            throw new KeyCorruptionException("Malformed " + profile.signatureAlgorithm() + " private key", e);
        }
    }

    /**
     * Confirm that each private half matches its public half by running one encapsulation and
     * one signature through the pair.
     *
     * @throws KeyCorruptionException if either pair is inconsistent.
     */
    public void checkConsistency(KeyMaterial keys) {
        boolean kemMatches;
        boolean signatureMatches;
        try {
            EncapsulationResult probe = encapsulate(keys.encapsulationPublicKey());
            byte[] recovered = new MLKEMExtractor(keys.encapsulationPrivateKey()).extractSecret(probe.encapsulation());
            kemMatches = MessageDigest.isEqual(probe.sharedSecret(), recovered);
            Arrays.fill(recovered, (byte) 0);
            probe.destroy();

            byte[] signature = sign(keys.signingPrivateKey(), PAIR_CHECK_MESSAGE);
            signatureMatches = verify(keys.signingPublicKey(), PAIR_CHECK_MESSAGE, signature);
        } catch (RuntimeException e) {
            throw new KeyCorruptionException("Stored key material is unusable", e);
        }
        if (!kemMatches) {
            throw new KeyCorruptionException(profile.kemAlgorithm() + " private key does not match its public key");
        }
        if (!signatureMatches) {
            throw new KeyCorruptionException(profile.signatureAlgorithm() + " private key does not match its public key");
        }
    }

    private static void checkLength(byte[] encoded, int expected, String what) {
        if (encoded == null || encoded.length != expected) {
            throw new KeyCorruptionException(String.format("%s has invalid length: expected %d bytes, got %d",
                    what, expected, encoded == null ? 0 : encoded.length));
        }
    }

    /**
     * Encapsulation output: {@code sharedSecret} stays in memory, {@code encapsulation} is stored.
     */
    public record EncapsulationResult(byte[] sharedSecret, byte[] encapsulation) {

        public void destroy() {
            Arrays.fill(sharedSecret, (byte) 0);
        }
    }
}
