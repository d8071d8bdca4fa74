package com.project.capsule.core;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Outcome of an authenticity check that never reveals plaintext.
 *
 * @param verified   whether the signature matches the stored fields under the signing key.
 * @param reason     human-readable explanation.
 * @param createdAt  creation instant as stored.
 * @param unlockDate unlock date as stored.
 */
public record VerifyResult(boolean verified, String reason, Instant createdAt, LocalDate unlockDate) {
}
