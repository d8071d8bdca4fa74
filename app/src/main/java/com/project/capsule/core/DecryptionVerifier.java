package com.project.capsule.core;

import com.project.capsule.core.CapsuleException.SignatureInvalidException;
import com.project.capsule.core.CapsuleException.TagMismatchException;
import com.project.capsule.core.CapsuleException.TimeLockedException;
import com.project.capsule.crypto.AeadCipher;
import com.project.capsule.crypto.ErrorLogger;
import com.project.capsule.crypto.HKDFUtil;
import com.project.capsule.crypto.PqcService;
import com.project.capsule.io.CapsuleCodec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Opens and authenticates stored capsules.
 *
 * <p>Order of checks: time-lock, then signature, then decapsulation, then AEAD decryption.
 * A locked capsule is rejected before its ciphertext is touched, and a capsule with a bad
 * signature is never decrypted.</p>
 */
public class DecryptionVerifier {

    private final PqcService pqcService;

    public DecryptionVerifier(PqcService pqcService) {
        this.pqcService = Objects.requireNonNull(pqcService, "pqcService must not be null");
    }

    /**
     * @throws TimeLockedException        if {@code now} is before the unlock date.
     * @throws SignatureInvalidException  if the signature does not cover the stored fields.
     * @throws CapsuleException.DecapsulationException if the encapsulated key is malformed.
     * @throws TagMismatchException       if AEAD authentication fails.
     */
    public PlainResult decrypt(Capsule capsule, KeyMaterial keys, Instant now) {
        requireUnlocked(capsule, now);
        Objects.requireNonNull(keys, "keys must not be null");
        if (!signatureMatches(capsule, keys)) {
            ErrorLogger.logWarning("DecryptionVerifier.decrypt",
                    "Signature check failed for capsule created at " + capsule.createdAt());
            throw new SignatureInvalidException("Capsule signature is invalid; the capsule may have been tampered with");
        }

        byte[] sharedSecret = pqcService.decapsulate(keys.encapsulationPrivateKey(), capsule.encapsulatedKey());
        byte[] symmetricKey = HKDFUtil.deriveCapsuleKey(sharedSecret);
        Arrays.fill(sharedSecret, (byte) 0);

        byte[] plaintext;
        try {
            plaintext = AeadCipher.open(
                    symmetricKey,
                    capsule.nonce(),
                    capsule.ciphertext(),
                    capsule.authenticationTag(),
                    CapsuleCodec.associatedData(capsule.createdAt(), capsule.unlockDate())
            );
        } catch (GeneralSecurityException e) {
            ErrorLogger.logError("DecryptionVerifier.decrypt", "AES-GCM authentication failed", e);
            throw new TagMismatchException("Capsule ciphertext failed authentication", e);
        } finally {
            Arrays.fill(symmetricKey, (byte) 0);
        }

        try {
            String message = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(plaintext))
                    .toString();
            return new PlainResult(message, capsule.createdAt(), capsule.unlockDate());
        } catch (CharacterCodingException e) {
            throw new TagMismatchException("Decrypted payload is not valid UTF-8 text", e);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    /**
     * Check authenticity without decrypting. Honors the time-lock exactly like {@link #decrypt}.
     *
     * @return {@code verified = false} with a reason when the signature does not match.
     * @throws TimeLockedException if {@code now} is before the unlock date.
     */
    public VerifyResult verify(Capsule capsule, KeyMaterial keys, Instant now) {
        requireUnlocked(capsule, now);
        Objects.requireNonNull(keys, "keys must not be null");
        if (signatureMatches(capsule, keys)) {
            return new VerifyResult(true, "Signature verified: capsule is authentic",
                    capsule.createdAt(), capsule.unlockDate());
        }
        return new VerifyResult(false, "Signature verification failed: capsule may have been tampered with",
                capsule.createdAt(), capsule.unlockDate());
    }

    /**
     * @throws TimeLockedException if {@code now} is before the unlock date.
     */
    public void requireUnlocked(Capsule capsule, Instant now) {
        if (TimeLockGuard.status(capsule, now) == LockStatus.LOCKED) {
            throw new TimeLockedException(capsule.unlockDate());
        }
    }

    private boolean signatureMatches(Capsule capsule, KeyMaterial keys) {
        return pqcService.verify(keys.signingPublicKey(), CapsuleCodec.signingPayload(capsule), capsule.signature());
    }
}
