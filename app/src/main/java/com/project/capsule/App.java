package com.project.capsule;

import com.project.capsule.config.CapsuleConfig;
import com.project.capsule.core.CapsuleEngine;
import com.project.capsule.core.CapsuleException;
import com.project.capsule.core.CapsuleException.TimeLockedException;
import com.project.capsule.core.CapsuleSummary;
import com.project.capsule.core.DecryptionVerifier;
import com.project.capsule.core.LockStatus;
import com.project.capsule.core.PlainResult;
import com.project.capsule.core.TimeCapsuleService;
import com.project.capsule.core.TimeLockGuard;
import com.project.capsule.core.VerifyResult;
import com.project.capsule.crypto.ErrorLogger;
import com.project.capsule.crypto.PqcService;
import com.project.capsule.crypto.config.CapsuleProfile;
import com.project.capsule.io.CapsuleStore;
import com.project.capsule.io.KeyStore;

import java.io.PrintStream;
import java.time.Instant;
import java.util.List;

/**
 * Command-line front end for the time capsule.
 *
 * <p>Usage: {@code java App <command> [args]}</p>
 * <ul>
 *     <li>{@code generate-keys}</li>
 *     <li>{@code create <message> <YYYY-MM-DD>}</li>
 *     <li>{@code list}</li>
 *     <li>{@code decrypt <n>}</li>
 *     <li>{@code verify <n>}</li>
 * </ul>
 * Capsule numbers are 1-based here and translated to store indices before reaching the core.
 */
public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private final TimeCapsuleService service;
    private final PrintStream out;
    private final PrintStream err;

    App(TimeCapsuleService service, PrintStream out, PrintStream err) {
        this.service = service;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        CapsuleConfig config = CapsuleConfig.fromEnvironment();
        ErrorLogger.configure(config.errorLog().orElse(null));
        int status;
        try {
            status = run(args, config, Instant.now(), System.out, System.err);
        } catch (CapsuleException e) {
            System.err.println("Error: " + e.getMessage());
            status = EXIT_FAILURE;
        }
        ErrorLogger.close();
        System.exit(status);
    }

    /**
     * Wire the core from {@code config} and execute one command.
     */
    static int run(String[] args, CapsuleConfig config, Instant now, PrintStream out, PrintStream err) {
        if (args.length == 0 || "help".equals(args[0])) {
            printUsage(args.length == 0 ? err : out);
            return args.length == 0 ? EXIT_USAGE : EXIT_OK;
        }
        return new App(buildService(config), out, err).execute(args, now);
    }

    static TimeCapsuleService buildService(CapsuleConfig config) {
        PqcService pqcService = new PqcService(CapsuleProfile.ML_KEM_768_ML_DSA_65);
        KeyStore keyStore = new KeyStore(config.keysDirectory(), pqcService, config.keySecret());
        CapsuleStore capsuleStore = CapsuleStore.open(config.capsulesDirectory());
        return new TimeCapsuleService(
                keyStore,
                capsuleStore,
                new CapsuleEngine(pqcService),
                new DecryptionVerifier(pqcService)
        );
    }

    int execute(String[] args, Instant now) {
        String command = args[0];
        try {
            switch (command) {
                case "generate-keys":
                    return generateKeys(args);
                case "create":
                    return create(args, now);
                case "list":
                    return list(args, now);
                case "decrypt":
                    return decrypt(args, now);
                case "verify":
                    return verify(args, now);
                default:
                    err.println("Unknown command: " + command);
                    printUsage(err);
                    return EXIT_USAGE;
            }
        } catch (CapsuleException e) {
            err.println(describe(e));
            return EXIT_FAILURE;
        }
    }

    private int generateKeys(String[] args) {
        if (args.length != 1) {
            return usage("generate-keys takes no arguments");
        }
        CapsuleProfile profile = CapsuleProfile.ML_KEM_768_ML_DSA_65;
        out.println("Generating " + profile.kemAlgorithm() + " + " + profile.signatureAlgorithm() + " key pairs...");
        String fingerprint = service.generateKeys();
        out.println("✓ Keys generated and saved (fingerprint " + fingerprint + ")");
        return EXIT_OK;
    }

    private int create(String[] args, Instant now) {
        if (args.length != 3) {
            return usage("create expects <message> <YYYY-MM-DD>");
        }
        CapsuleSummary summary = service.createCapsule(args[1], args[2], now);
        out.printf("✓ Capsule #%d created (unlock date: %s)%n", toDisplayNumber(summary.index()), summary.unlockDate());
        if (summary.status() == LockStatus.UNLOCKABLE) {
            out.println("ℹ Unlock date is today or in the past; the capsule can be opened immediately.");
        } else {
            out.printf("Locked for %d more day(s)%n", TimeLockGuard.daysRemaining(summary.unlockDate(), now));
        }
        return EXIT_OK;
    }

    private int list(String[] args, Instant now) {
        if (args.length != 1) {
            return usage("list takes no arguments");
        }
        List<CapsuleSummary> capsules = service.listCapsules(now);
        if (capsules.isEmpty()) {
            out.println("No capsules found.");
            return EXIT_OK;
        }
        out.println("Capsules:");
        for (CapsuleSummary summary : capsules) {
            out.printf("%d. created %s - unlock %s (%s)%n",
                    toDisplayNumber(summary.index()),
                    summary.createdAt(),
                    summary.unlockDate(),
                    summary.status() == LockStatus.LOCKED ? "locked" : "unlocked");
        }
        return EXIT_OK;
    }

    private int decrypt(String[] args, Instant now) {
        if (args.length != 2) {
            return usage("decrypt expects <n>");
        }
        PlainResult result = service.decryptCapsule(toStoreIndex(args[1]), now);
        out.println("✓ Decryption successful, signature verified");
        out.println("Created:    " + result.createdAt());
        out.println("Unlock date: " + result.unlockDate());
        out.println("Message:    " + result.plaintext());
        return EXIT_OK;
    }

    private int verify(String[] args, Instant now) {
        if (args.length != 2) {
            return usage("verify expects <n>");
        }
        VerifyResult result = service.verifyCapsule(toStoreIndex(args[1]), now);
        out.println((result.verified() ? "✓ " : "✗ ") + result.reason());
        out.println("Created:    " + result.createdAt());
        out.println("Unlock date: " + result.unlockDate());
        return result.verified() ? EXIT_OK : EXIT_FAILURE;
    }

    /**
     * Translate a 1-based capsule number typed by the user into a 0-based store index.
     *
     * @throws CapsuleException.ValidationException if the value is not a positive integer.
     */
    static int toStoreIndex(String displayNumber) {
        int number;
        try {
            number = Integer.parseInt(displayNumber.trim());
        } catch (NumberFormatException e) {
            throw new CapsuleException.ValidationException("Capsule number must be an integer: " + displayNumber, e);
        }
        if (number < 1) {
            throw new CapsuleException.ValidationException("Capsule number must be 1 or greater: " + number);
        }
        return number - 1;
    }

    static int toDisplayNumber(int storeIndex) {
        return storeIndex + 1;
    }

    static String describe(CapsuleException e) {
        switch (e.kind()) {
            case TIME_LOCKED:
                return "Too early: capsule is locked until " + ((TimeLockedException) e).unlockDate();
            case SIGNATURE_INVALID:
            case TAG_MISMATCH:
                return "Tampered: " + e.getMessage();
            case KEYS_NOT_FOUND:
                return "No keys: " + e.getMessage();
            case KEY_CORRUPTION:
                return "Key files unusable: " + e.getMessage();
            case INDEX_OUT_OF_RANGE:
                CapsuleException.IndexOutOfRangeException range = (CapsuleException.IndexOutOfRangeException) e;
                return String.format("No such capsule #%d (there are %d)",
                        toDisplayNumber(range.index()), range.size());
            case VALIDATION:
                return "Invalid input: " + e.getMessage();
            default:
                return "Error: " + e.getMessage();
        }
    }

    private int usage(String problem) {
        err.println(problem);
        printUsage(err);
        return EXIT_USAGE;
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: App <command> [args]");
        stream.println("  generate-keys                 generate and store a new key set");
        stream.println("  create <message> <YYYY-MM-DD> seal a message until the given date (UTC)");
        stream.println("  list                          list capsules in creation order");
        stream.println("  decrypt <n>                   open capsule number n");
        stream.println("  verify <n>                    check capsule number n is authentic");
        stream.println("Environment: CAPSULE_HOME, CAPSULE_KEY_SECRET, CAPSULE_ERROR_LOG");
    }
}
