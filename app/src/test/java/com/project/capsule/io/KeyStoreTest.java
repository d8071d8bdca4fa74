package com.project.capsule.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.capsule.core.CapsuleException.KeyCorruptionException;
import com.project.capsule.core.CapsuleException.KeysNotFoundException;
import com.project.capsule.core.CapsuleException.StorageException;
import com.project.capsule.core.KeyMaterial;
import com.project.capsule.crypto.PqcService;
import com.project.capsule.crypto.config.CapsuleProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyStore")
class KeyStoreTest {

    private static final PqcService PQC = new PqcService(CapsuleProfile.ML_KEM_768_ML_DSA_65);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private KeyStore plainStore() {
        return new KeyStore(dir, PQC, Optional.empty());
    }

    private static void assertSameKeys(KeyMaterial expected, KeyMaterial actual) {
        assertArrayEquals(expected.encapsulationPublicKey().getEncoded(), actual.encapsulationPublicKey().getEncoded());
        assertArrayEquals(expected.encapsulationPrivateKey().getEncoded(), actual.encapsulationPrivateKey().getEncoded());
        assertArrayEquals(expected.signingPublicKey().getEncoded(), actual.signingPublicKey().getEncoded());
        assertEquals(expected.fingerprint(), actual.fingerprint());

        byte[] message = "key store".getBytes(StandardCharsets.UTF_8);
        assertTrue(PQC.verify(expected.signingPublicKey(), message, PQC.sign(actual.signingPrivateKey(), message)));
    }

    private void editArtifact(String fileName, String field, String value) throws IOException {
        Path path = dir.resolve(fileName);
        ObjectNode node = (ObjectNode) MAPPER.readTree(path.toFile());
        node.put(field, value);
        MAPPER.writeValue(path.toFile(), node);
    }

    @Nested
    @DisplayName("Unencrypted artifacts")
    class Unencrypted {

        @Test
        @DisplayName("Generated keys load back in a fresh store")
        void generateThenLoad() {
            KeyMaterial generated = plainStore().generateKeys();

            assertTrue(Files.exists(dir.resolve(KeyStore.ENCAPSULATION_FILE)));
            assertTrue(Files.exists(dir.resolve(KeyStore.SIGNING_FILE)));
            assertSameKeys(generated, plainStore().loadKeys());
        }

        @Test
        @DisplayName("Artifacts describe their purpose and algorithm")
        void artifactShape() throws IOException {
            plainStore().generateKeys();
            String encapsulation = Files.readString(dir.resolve(KeyStore.ENCAPSULATION_FILE), StandardCharsets.UTF_8);
            String signing = Files.readString(dir.resolve(KeyStore.SIGNING_FILE), StandardCharsets.UTF_8);

            assertTrue(encapsulation.contains("\"ML-KEM-768\""));
            assertTrue(encapsulation.contains("\"encapsulation\""));
            assertTrue(encapsulation.contains("\"privateKey\""));
            assertFalse(encapsulation.contains("sealedPrivateKey"));
            assertTrue(signing.contains("\"ML-DSA-65\""));
            assertTrue(signing.contains("\"signing\""));
        }

        @Test
        @DisplayName("Regenerating replaces the stored keys")
        void regenerate() {
            KeyStore store = plainStore();
            KeyMaterial first = store.generateKeys();
            KeyMaterial second = store.generateKeys();

            assertNotEquals(first.fingerprint(), second.fingerprint());
            assertSameKeys(second, plainStore().loadKeys());
        }

        @Test
        @DisplayName("A failed regeneration leaves the previous encapsulation key and no temporary files")
        void failedRegenerationRollsBack() throws IOException {
            KeyStore store = plainStore();
            store.generateKeys();
            byte[] previousEncapsulation = Files.readAllBytes(dir.resolve(KeyStore.ENCAPSULATION_FILE));

            Path signing = dir.resolve(KeyStore.SIGNING_FILE);
            Files.delete(signing);
            Files.createDirectory(signing);
            Files.writeString(signing.resolve("blocker"), "x");

            assertThrows(StorageException.class, store::generateKeys);

            assertArrayEquals(previousEncapsulation, Files.readAllBytes(dir.resolve(KeyStore.ENCAPSULATION_FILE)));
            try (Stream<Path> files = Files.list(dir)) {
                assertTrue(files.noneMatch(path -> path.getFileName().toString().endsWith(".tmp")));
            }
            assertThrows(StorageException.class, store::loadKeys);
        }

        @Test
        @DisplayName("No artifacts means no keys")
        void missingKeys() {
            KeyStore store = plainStore();
            assertFalse(store.hasKeys());
            assertThrows(KeysNotFoundException.class, store::loadKeys);
        }

        @Test
        @DisplayName("A single missing artifact means no keys")
        void incompleteKeys() throws IOException {
            plainStore().generateKeys();
            Files.delete(dir.resolve(KeyStore.SIGNING_FILE));

            KeyStore store = plainStore();
            assertFalse(store.hasKeys());
            assertThrows(KeysNotFoundException.class, store::loadKeys);
        }
    }

    @Nested
    @DisplayName("Corrupted artifacts")
    class Corrupted {

        @Test
        @DisplayName("Unparseable JSON")
        void invalidJson() throws IOException {
            plainStore().generateKeys();
            Files.writeString(dir.resolve(KeyStore.ENCAPSULATION_FILE), "{ broken", StandardCharsets.UTF_8);

            assertThrows(KeyCorruptionException.class, () -> plainStore().loadKeys());
        }

        @Test
        @DisplayName("Truncated public key")
        void truncatedKey() throws IOException {
            KeyMaterial keys = plainStore().generateKeys();
            byte[] truncated = Arrays.copyOf(keys.signingPublicKey().getEncoded(), 100);
            editArtifact(KeyStore.SIGNING_FILE, "publicKey", Base64.getEncoder().encodeToString(truncated));

            assertThrows(KeyCorruptionException.class, () -> plainStore().loadKeys());
        }

        @Test
        @DisplayName("Malformed Base64")
        void malformedBase64() throws IOException {
            plainStore().generateKeys();
            editArtifact(KeyStore.ENCAPSULATION_FILE, "privateKey", "@@not-base64@@");

            assertThrows(KeyCorruptionException.class, () -> plainStore().loadKeys());
        }

        @Test
        @DisplayName("Unexpected algorithm or purpose")
        void wrongAlgorithm() throws IOException {
            plainStore().generateKeys();
            editArtifact(KeyStore.ENCAPSULATION_FILE, "algorithm", "ML-KEM-512");
            assertThrows(KeyCorruptionException.class, () -> plainStore().loadKeys());

            plainStore().generateKeys();
            editArtifact(KeyStore.SIGNING_FILE, "purpose", "encapsulation");
            assertThrows(KeyCorruptionException.class, () -> plainStore().loadKeys());
        }

        @Test
        @DisplayName("Public key that does not belong to the private key")
        void mismatchedPair() throws IOException {
            plainStore().generateKeys();
            KeyMaterial other = PQC.generateKeyMaterial();
            editArtifact(KeyStore.ENCAPSULATION_FILE, "publicKey",
                    Base64.getEncoder().encodeToString(other.encapsulationPublicKey().getEncoded()));

            assertThrows(KeyCorruptionException.class, () -> plainStore().loadKeys());
        }
    }

    @Nested
    @DisplayName("Passphrase-protected artifacts")
    class Protected {

        private KeyStore storeWith(String secret) {
            return new KeyStore(dir, PQC, Optional.ofNullable(secret));
        }

        @Test
        @DisplayName("Private keys are not stored in the clear")
        void sealedOnDisk() throws IOException {
            KeyMaterial keys = storeWith("correct horse").generateKeys();
            String content = Files.readString(dir.resolve(KeyStore.SIGNING_FILE), StandardCharsets.UTF_8);

            assertTrue(content.contains("sealedPrivateKey"));
            assertTrue(content.contains("PBKDF2WithHmacSHA256"));
            assertFalse(content.contains("\"privateKey\""));
            assertFalse(content.contains(Base64.getEncoder().encodeToString(keys.signingPrivateKey().getEncoded())));
        }

        @Test
        @DisplayName("Same passphrase loads the keys")
        void samePassphrase() {
            KeyMaterial generated = storeWith("correct horse").generateKeys();
            assertSameKeys(generated, storeWith("correct horse").loadKeys());
        }

        @Test
        @DisplayName("Wrong or missing passphrase is key corruption")
        void wrongPassphrase() {
            storeWith("correct horse").generateKeys();

            assertThrows(KeyCorruptionException.class, () -> storeWith("battery staple").loadKeys());
            assertThrows(KeyCorruptionException.class, () -> storeWith(null).loadKeys());
        }

        @Test
        @DisplayName("Blank passphrase counts as none")
        void blankPassphrase() throws IOException {
            storeWith("   ").generateKeys();
            String content = Files.readString(dir.resolve(KeyStore.ENCAPSULATION_FILE), StandardCharsets.UTF_8);
            assertTrue(content.contains("\"privateKey\""));
        }
    }
}
