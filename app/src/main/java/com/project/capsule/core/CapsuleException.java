package com.project.capsule.core;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Base type for every failure the capsule core reports.
 *
 * <p>The set of subclasses is closed: each corresponds to exactly one {@link ErrorKind}, and
 * primitive or I/O failures are translated into one of them where they occur so callers can
 * render a distinct message per kind.</p>
 */
public abstract class CapsuleException extends RuntimeException {

    /**
     * Kinds of failure surfaced to collaborators.
     */
    public enum ErrorKind {
        KEY_GENERATION,
        KEYS_NOT_FOUND,
        KEY_CORRUPTION,
        STORAGE,
        VALIDATION,
        ENCAPSULATION,
        SIGNING,
        TIME_LOCKED,
        SIGNATURE_INVALID,
        DECAPSULATION,
        TAG_MISMATCH,
        INDEX_OUT_OF_RANGE
    }

    private final ErrorKind kind;

    protected CapsuleException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CapsuleException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static class KeyGenerationException extends CapsuleException {
        public KeyGenerationException(String message, Throwable cause) {
            super(ErrorKind.KEY_GENERATION, message, cause);
        }
    }

    public static class KeysNotFoundException extends CapsuleException {
        public KeysNotFoundException(String message) {
            super(ErrorKind.KEYS_NOT_FOUND, message);
        }
    }

    public static class KeyCorruptionException extends CapsuleException {
        public KeyCorruptionException(String message) {
            super(ErrorKind.KEY_CORRUPTION, message);
        }

        public KeyCorruptionException(String message, Throwable cause) {
            super(ErrorKind.KEY_CORRUPTION, message, cause);
        }
    }

    public static class StorageException extends CapsuleException {
        public StorageException(String message) {
            super(ErrorKind.STORAGE, message);
        }

        public StorageException(String message, Throwable cause) {
            super(ErrorKind.STORAGE, message, cause);
        }
    }

    public static class ValidationException extends CapsuleException {
        public ValidationException(String message) {
            super(ErrorKind.VALIDATION, message);
        }

        public ValidationException(String message, Throwable cause) {
            super(ErrorKind.VALIDATION, message, cause);
        }
    }

    public static class EncapsulationException extends CapsuleException {
        public EncapsulationException(String message, Throwable cause) {
            super(ErrorKind.ENCAPSULATION, message, cause);
        }
    }

    public static class SigningException extends CapsuleException {
        public SigningException(String message, Throwable cause) {
            super(ErrorKind.SIGNING, message, cause);
        }
    }

    /**
     * Raised before any cryptographic work when the capsule's unlock date has not been reached.
     */
    public static class TimeLockedException extends CapsuleException {
        private final LocalDate unlockDate;

        public TimeLockedException(LocalDate unlockDate) {
            super(ErrorKind.TIME_LOCKED, "Capsule is locked until " + unlockDate);
            this.unlockDate = Objects.requireNonNull(unlockDate, "unlockDate must not be null");
        }

        public LocalDate unlockDate() {
            return unlockDate;
        }
    }

    public static class SignatureInvalidException extends CapsuleException {
        public SignatureInvalidException(String message) {
            super(ErrorKind.SIGNATURE_INVALID, message);
        }
    }

    public static class DecapsulationException extends CapsuleException {
        public DecapsulationException(String message) {
            super(ErrorKind.DECAPSULATION, message);
        }

        public DecapsulationException(String message, Throwable cause) {
            super(ErrorKind.DECAPSULATION, message, cause);
        }
    }

    public static class TagMismatchException extends CapsuleException {
        public TagMismatchException(String message, Throwable cause) {
            super(ErrorKind.TAG_MISMATCH, message, cause);
        }
    }

    public static class IndexOutOfRangeException extends CapsuleException {
        private final int index;
        private final int size;

        public IndexOutOfRangeException(int index, int size) {
            super(ErrorKind.INDEX_OUT_OF_RANGE,
                    String.format("Capsule index %d out of range (store holds %d capsules)", index, size));
            this.index = index;
            this.size = size;
        }

        public int index() {
            return index;
        }

        public int size() {
            return size;
        }
    }
}
