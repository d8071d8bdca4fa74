package com.project.capsule.core;

import com.project.capsule.core.CapsuleException.EncapsulationException;
import com.project.capsule.crypto.AeadCipher;
import com.project.capsule.crypto.ErrorLogger;
import com.project.capsule.crypto.HKDFUtil;
import com.project.capsule.crypto.PqcService;
import com.project.capsule.io.CapsuleCodec;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Objects;

/**
 * Builds new capsules: encapsulate a fresh shared secret, encrypt the message under a key
 * derived from it, then sign the full record.
 *
 * <p>Nothing is persisted here. The caller appends the returned capsule to the store, so a
 * failure at any step leaves no trace.</p>
 */
public class CapsuleEngine {

    private final PqcService pqcService;
    private final SecureRandom random;

    public CapsuleEngine(PqcService pqcService) {
        this(pqcService, new SecureRandom());
    }

    public CapsuleEngine(PqcService pqcService, SecureRandom random) {
        this.pqcService = Objects.requireNonNull(pqcService, "pqcService must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * @param message    non-blank text to seal.
     * @param unlockDate first UTC day on which the capsule may be decrypted; past dates are allowed.
     * @param keys       key material from the key store.
     * @param now        creation time; stored with millisecond precision.
     */
    public Capsule createCapsule(String message, LocalDate unlockDate, KeyMaterial keys, Instant now) {
        InputValidator.validateMessage(message);
        InputValidator.validateUnlockDate(unlockDate);
        Objects.requireNonNull(keys, "keys must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Instant createdAt = now.truncatedTo(ChronoUnit.MILLIS);
        PqcService.EncapsulationResult encapsulation = pqcService.encapsulate(keys.encapsulationPublicKey());
        byte[] symmetricKey = HKDFUtil.deriveCapsuleKey(encapsulation.sharedSecret());
        encapsulation.destroy();

        byte[] nonce = AeadCipher.newNonce(random);
        AeadCipher.Sealed sealed;
        try {
            sealed = AeadCipher.seal(
                    symmetricKey,
                    nonce,
                    message.getBytes(StandardCharsets.UTF_8),
                    CapsuleCodec.associatedData(createdAt, unlockDate)
            );
        } catch (GeneralSecurityException e) {
            ErrorLogger.logError("CapsuleEngine.createCapsule", "AES-GCM encryption failed", e);
            throw new EncapsulationException("Failed to encrypt message under the encapsulated key", e);
        } finally {
            Arrays.fill(symmetricKey, (byte) 0);
        }

        Capsule unsigned = new Capsule(
                createdAt,
                unlockDate,
                encapsulation.encapsulation(),
                nonce,
                sealed.ciphertext(),
                sealed.tag(),
                new byte[0]
        );
        byte[] signature = pqcService.sign(keys.signingPrivateKey(), CapsuleCodec.signingPayload(unsigned));

        return new Capsule(
                createdAt,
                unlockDate,
                unsigned.encapsulatedKey(),
                unsigned.nonce(),
                unsigned.ciphertext(),
                unsigned.authenticationTag(),
                signature
        );
    }
}
