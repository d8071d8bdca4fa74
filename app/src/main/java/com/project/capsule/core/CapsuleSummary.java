package com.project.capsule.core;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Public view of a stored capsule. Carries no key or ciphertext material.
 *
 * @param index      0-based store index.
 * @param createdAt  creation instant.
 * @param unlockDate unlock date.
 * @param status     time-lock status computed against the caller's clock.
 */
public record CapsuleSummary(int index, Instant createdAt, LocalDate unlockDate, LockStatus status) {
}
