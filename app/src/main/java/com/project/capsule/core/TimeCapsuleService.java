package com.project.capsule.core;

import com.project.capsule.crypto.ErrorLogger;
import com.project.capsule.io.CapsuleStore;
import com.project.capsule.io.KeyStore;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Entry point for collaborators (CLI, GUI, API layers).
 *
 * <p>Indices are 0-based store indices; any 1-based numbering belongs to the caller. The
 * caller also supplies the clock value. Key generation and capsule creation hold the write
 * lock; listing, decryption and verification share the read lock.</p>
 */
public class TimeCapsuleService {

    private final KeyStore keyStore;
    private final CapsuleStore capsuleStore;
    private final CapsuleEngine engine;
    private final DecryptionVerifier verifier;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public TimeCapsuleService(KeyStore keyStore,
                              CapsuleStore capsuleStore,
                              CapsuleEngine engine,
                              DecryptionVerifier verifier) {
        this.keyStore = Objects.requireNonNull(keyStore, "keyStore must not be null");
        this.capsuleStore = Objects.requireNonNull(capsuleStore, "capsuleStore must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.verifier = Objects.requireNonNull(verifier, "verifier must not be null");
    }

    /**
     * Generate and persist a new key set, replacing the old one.
     *
     * @return fingerprint of the new public keys.
     */
    public String generateKeys() {
        lock.writeLock().lock();
        try {
            if (capsuleStore.size() > 0 && keyStore.hasKeys()) {
                ErrorLogger.logWarning("TimeCapsuleService.generateKeys", "Replacing keys; "
                        + capsuleStore.size() + " existing capsules will no longer be decryptable");
            }
            return keyStore.generateKeys().fingerprint();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Validate, seal and append a new capsule.
     *
     * @param unlockDate ISO-8601 date ({@code YYYY-MM-DD}).
     */
    public CapsuleSummary createCapsule(String message, String unlockDate, Instant now) {
        InputValidator.validateMessage(message);
        LocalDate date = InputValidator.parseUnlockDate(unlockDate);
        return createCapsule(message, date, now);
    }

    public CapsuleSummary createCapsule(String message, LocalDate unlockDate, Instant now) {
        InputValidator.validateMessage(message);
        InputValidator.validateUnlockDate(unlockDate);
        Objects.requireNonNull(now, "now must not be null");

        lock.writeLock().lock();
        try {
            KeyMaterial keys = keyStore.loadKeys();
            Capsule capsule = engine.createCapsule(message, unlockDate, keys, now);
            int index = capsuleStore.append(capsule);
            ErrorLogger.logInfo("TimeCapsuleService.createCapsule",
                    "Created capsule " + index + " unlocking on " + unlockDate);
            return summarize(index, capsule, now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * All capsules in creation order with their status at {@code now}.
     */
    public List<CapsuleSummary> listCapsules(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        lock.readLock().lock();
        try {
            List<Capsule> capsules = capsuleStore.list();
            List<CapsuleSummary> summaries = new ArrayList<>(capsules.size());
            for (int i = 0; i < capsules.size(); i++) {
                summaries.add(summarize(i, capsules.get(i), now));
            }
            return List.copyOf(summaries);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The time-lock is checked before the keys are loaded, so a locked capsule reports
     * {@link CapsuleException.TimeLockedException} even when no keys exist.
     */
    public PlainResult decryptCapsule(int index, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        lock.readLock().lock();
        try {
            Capsule capsule = capsuleStore.get(index);
            verifier.requireUnlocked(capsule, now);
            return verifier.decrypt(capsule, keyStore.loadKeys(), now);
        } finally {
            lock.readLock().unlock();
        }
    }

    public VerifyResult verifyCapsule(int index, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        lock.readLock().lock();
        try {
            Capsule capsule = capsuleStore.get(index);
            verifier.requireUnlocked(capsule, now);
            return verifier.verify(capsule, keyStore.loadKeys(), now);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capsuleCount() {
        lock.readLock().lock();
        try {
            return capsuleStore.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static CapsuleSummary summarize(int index, Capsule capsule, Instant now) {
        return new CapsuleSummary(index, capsule.createdAt(), capsule.unlockDate(), TimeLockGuard.status(capsule, now));
    }
}
