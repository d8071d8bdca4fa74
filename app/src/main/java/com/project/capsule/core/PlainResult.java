package com.project.capsule.core;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Transient output of a successful decryption.
 */
public record PlainResult(String plaintext, Instant createdAt, LocalDate unlockDate) {
}
