package com.project.capsule.core;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Sole authority for time-lock decisions.
 *
 * <p>A capsule becomes unlockable at 00:00 UTC on its unlock date. The comparison is made
 * against the clock value the caller supplies; it is advisory and not cryptographically
 * enforced.</p>
 */
public final class TimeLockGuard {

    private TimeLockGuard() {
    }

    public static LockStatus status(Capsule capsule, Instant now) {
        Objects.requireNonNull(capsule, "capsule must not be null");
        return status(capsule.unlockDate(), now);
    }

    public static LockStatus status(LocalDate unlockDate, Instant now) {
        Objects.requireNonNull(unlockDate, "unlockDate must not be null");
        Objects.requireNonNull(now, "now must not be null");
        return today(now).isBefore(unlockDate) ? LockStatus.LOCKED : LockStatus.UNLOCKABLE;
    }

    /**
     * Whole days until the unlock date, or zero once unlockable.
     */
    public static long daysRemaining(LocalDate unlockDate, Instant now) {
        if (status(unlockDate, now) == LockStatus.UNLOCKABLE) {
            return 0;
        }
        return ChronoUnit.DAYS.between(today(now), unlockDate);
    }

    private static LocalDate today(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC);
    }
}
