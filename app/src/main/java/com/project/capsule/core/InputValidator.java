package com.project.capsule.core;

import com.project.capsule.core.CapsuleException.ValidationException;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Input validation for capsule creation. Runs before any cryptographic work.
 */
public final class InputValidator {

    /** Upper bound on the UTF-8 size of a capsule message. */
    public static final int MAX_MESSAGE_BYTES = 1024 * 1024;

    private static final DateTimeFormatter UNLOCK_DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final int UNLOCK_MIN_YEAR = 1;
    private static final int UNLOCK_MAX_YEAR = 9999;

    private InputValidator() {
    }

    /**
     * @throws ValidationException if the message is null, blank or too large.
     */
    public static void validateMessage(String message) {
        if (message == null) {
            throw new ValidationException("Message must not be null");
        }
        if (message.isBlank()) {
            throw new ValidationException("Message must not be empty");
        }
        int size = message.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_MESSAGE_BYTES) {
            throw new ValidationException(String.format(
                    "Message is too large: %d bytes exceeds maximum of %d", size, MAX_MESSAGE_BYTES));
        }
    }

    /**
     * Parse an unlock date in strict ISO-8601 form ({@code YYYY-MM-DD}). Dates in the past are
     * accepted; such capsules are unlockable immediately.
     *
     * @throws ValidationException if the value is missing, malformed or out of range.
     */
    public static LocalDate parseUnlockDate(String unlockDate) {
        if (unlockDate == null || unlockDate.isBlank()) {
            throw new ValidationException("Unlock date must not be empty");
        }
        String trimmed = unlockDate.trim();
        LocalDate date;
        try {
            date = LocalDate.parse(trimmed, UNLOCK_DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new ValidationException(
                    String.format("Invalid unlock date '%s': expected YYYY-MM-DD", trimmed), e);
        }
        validateUnlockDate(date);
        return date;
    }

    /**
     * @throws ValidationException if the date is null or outside the supported year range.
     */
    public static void validateUnlockDate(LocalDate date) {
        if (date == null) {
            throw new ValidationException("Unlock date must not be null");
        }
        int year = date.getYear();
        if (year < UNLOCK_MIN_YEAR || year > UNLOCK_MAX_YEAR) {
            throw new ValidationException(String.format(
                    "Unlock date year %d must be in range [%d, %d]", year, UNLOCK_MIN_YEAR, UNLOCK_MAX_YEAR));
        }
    }

    public static boolean isValidUnlockDate(String unlockDate) {
        try {
            parseUnlockDate(unlockDate);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }
}
