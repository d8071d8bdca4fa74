package com.project.capsule.core;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Immutable persisted time capsule.
 *
 * <p>Byte arrays are copied on the way in and on the way out, so a capsule never changes
 * after construction.</p>
 *
 * @param createdAt         creation instant (UTC), bound into the AEAD associated data.
 * @param unlockDate        first calendar day (UTC) on which decryption is allowed.
 * @param encapsulatedKey   ML-KEM ciphertext carrying the per-capsule shared secret.
 * @param nonce             AES-GCM nonce, fresh per capsule.
 * @param ciphertext        AES-GCM ciphertext without the tag.
 * @param authenticationTag AES-GCM tag.
 * @param signature         ML-DSA signature over all of the above.
 */
public record Capsule(
        Instant createdAt,
        LocalDate unlockDate,
        byte[] encapsulatedKey,
        byte[] nonce,
        byte[] ciphertext,
        byte[] authenticationTag,
        byte[] signature
) {

    public Capsule {
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(unlockDate, "unlockDate must not be null");
        encapsulatedKey = Objects.requireNonNull(encapsulatedKey, "encapsulatedKey must not be null").clone();
        nonce = Objects.requireNonNull(nonce, "nonce must not be null").clone();
        ciphertext = Objects.requireNonNull(ciphertext, "ciphertext must not be null").clone();
        authenticationTag = Objects.requireNonNull(authenticationTag, "authenticationTag must not be null").clone();
        signature = Objects.requireNonNull(signature, "signature must not be null").clone();
    }

    @Override
    public byte[] encapsulatedKey() {
        return encapsulatedKey.clone();
    }

    @Override
    public byte[] nonce() {
        return nonce.clone();
    }

    @Override
    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    @Override
    public byte[] authenticationTag() {
        return authenticationTag.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }
}
