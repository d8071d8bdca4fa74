package com.project.capsule;

import com.project.capsule.config.CapsuleConfig;
import com.project.capsule.core.CapsuleException;
import com.project.capsule.core.CapsuleException.IndexOutOfRangeException;
import com.project.capsule.core.CapsuleException.TimeLockedException;
import com.project.capsule.core.CapsuleException.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command-line behaviour against a temporary data directory.
 */
@DisplayName("App")
class AppTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T12:00:00Z");
    private static final Instant LOCKED_NOW = Instant.parse("2024-06-01T00:00:00Z");
    private static final Instant UNLOCKED_NOW = Instant.parse("2035-01-02T00:00:00Z");

    @TempDir
    Path home;

    private CapsuleConfig config;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        config = new CapsuleConfig(home, Optional.empty(), Optional.empty());
        resetStreams();
    }

    private void resetStreams() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(Instant now, String... args) {
        resetStreams();
        return App.run(args, config,
                now,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        @DisplayName("Full session: generate, create, list, decrypt, verify")
        void fullSession() {
            assertEquals(App.EXIT_OK, run(CREATED, "generate-keys"));
            assertTrue(stdout().contains("Keys generated"));
            assertTrue(Files.exists(home.resolve("keys").resolve("encapsulation-key.json")));

            assertEquals(App.EXIT_OK, run(CREATED, "create", "Hello, future world!", "2035-01-01"));
            assertTrue(stdout().contains("Capsule #1 created"), stdout());
            assertTrue(Files.exists(home.resolve("capsules").resolve("capsule-000000.json")));

            assertEquals(App.EXIT_OK, run(LOCKED_NOW, "list"));
            assertTrue(stdout().contains("1. created"), stdout());
            assertTrue(stdout().contains("(locked)"), stdout());

            assertEquals(App.EXIT_FAILURE, run(LOCKED_NOW, "decrypt", "1"));
            assertTrue(stderr().contains("Too early"), stderr());
            assertTrue(stderr().contains("2035-01-01"), stderr());

            assertEquals(App.EXIT_OK, run(UNLOCKED_NOW, "decrypt", "1"));
            assertTrue(stdout().contains("Hello, future world!"), stdout());

            assertEquals(App.EXIT_OK, run(UNLOCKED_NOW, "verify", "1"));
            assertTrue(stdout().contains("Signature verified"), stdout());
        }

        @Test
        @DisplayName("Past unlock dates are reported as immediately unlockable")
        void pastUnlockDate() {
            run(CREATED, "generate-keys");
            assertEquals(App.EXIT_OK, run(CREATED, "create", "already open", "2020-01-01"));
            assertTrue(stdout().contains("can be opened immediately"), stdout());
        }

        @Test
        @DisplayName("Empty store lists nothing")
        void emptyList() {
            assertEquals(App.EXIT_OK, run(CREATED, "list"));
            assertTrue(stdout().contains("No capsules found."));
        }

        @Test
        @DisplayName("Missing keys and unknown capsule numbers are failures")
        void failures() {
            assertEquals(App.EXIT_FAILURE, run(CREATED, "create", "hi", "2035-01-01"));
            assertTrue(stderr().contains("No keys"), stderr());

            assertEquals(App.EXIT_FAILURE, run(CREATED, "decrypt", "3"));
            assertTrue(stderr().contains("No such capsule #3 (there are 0)"), stderr());

            assertEquals(App.EXIT_FAILURE, run(CREATED, "decrypt", "zero"));
            assertTrue(stderr().contains("Invalid input"), stderr());
        }

        @Test
        @DisplayName("Usage errors")
        void usage() {
            assertEquals(App.EXIT_USAGE, run(CREATED));
            assertTrue(stderr().contains("Usage"));
            assertEquals(App.EXIT_OK, run(CREATED, "help"));
            assertTrue(stdout().contains("Usage"));
            assertEquals(App.EXIT_USAGE, run(CREATED, "frobnicate"));
            assertEquals(App.EXIT_USAGE, run(CREATED, "create", "only-message"));
            assertEquals(App.EXIT_USAGE, run(CREATED, "decrypt"));
        }
    }

    @Nested
    @DisplayName("Capsule numbering")
    class Numbering {

        @Test
        @DisplayName("Displayed numbers are 1-based")
        void oneBased() {
            assertEquals(0, App.toStoreIndex("1"));
            assertEquals(41, App.toStoreIndex(" 42 "));
            assertEquals(1, App.toDisplayNumber(0));
        }

        @Test
        @DisplayName("Zero, negative and non-numeric values are rejected")
        void rejected() {
            assertThrows(ValidationException.class, () -> App.toStoreIndex("0"));
            assertThrows(ValidationException.class, () -> App.toStoreIndex("-1"));
            assertThrows(ValidationException.class, () -> App.toStoreIndex("one"));
        }

        @Test
        @DisplayName("Error descriptions use 1-based numbers")
        void describe() {
            CapsuleException outOfRange = new IndexOutOfRangeException(4, 2);
            assertEquals("No such capsule #5 (there are 2)", App.describe(outOfRange));
            assertTrue(App.describe(new TimeLockedException(LocalDate.parse("2035-01-01"))).startsWith("Too early"));
        }
    }
}
