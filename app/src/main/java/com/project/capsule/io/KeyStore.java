package com.project.capsule.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.capsule.core.CapsuleException;
import com.project.capsule.core.CapsuleException.KeyCorruptionException;
import com.project.capsule.core.CapsuleException.KeysNotFoundException;
import com.project.capsule.core.CapsuleException.StorageException;
import com.project.capsule.core.KeyMaterial;
import com.project.capsule.crypto.ErrorLogger;
import com.project.capsule.crypto.PqcService;
import com.project.capsule.crypto.config.CapsuleProfile;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAPublicKeyParameters;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Generates, persists and loads the encapsulation and signing key pairs.
 *
 * <p>Each pair is stored as its own JSON artifact ({@value #ENCAPSULATION_FILE},
 * {@value #SIGNING_FILE}). When a passphrase is configured the private half is sealed with
 * AES-GCM under a PBKDF2-derived key; otherwise it is written in the clear and a warning is
 * logged.</p>
 *
 * <p>Generating keys overwrites the previous pair. Capsules created under the old pair can no
 * longer be decrypted.</p>
 */
public class KeyStore {

    public static final String ENCAPSULATION_FILE = "encapsulation-key.json";
    public static final String SIGNING_FILE = "signing-key.json";

    private static final String FORMAT_MAGIC = "QTC-KEYPAIR";
    private static final int FORMAT_VERSION = 1;
    private static final String PURPOSE_ENCAPSULATION = "encapsulation";
    private static final String PURPOSE_SIGNING = "signing";
    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final int SALT_BYTES = 16;
    private static final int IV_BYTES = 12;
    private static final int GCM_TAG_BITS = 128;
    private static final int PBKDF2_ITERATIONS = 200_000;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path directory;
    private final PqcService pqcService;
    private final Optional<String> secret;
    private KeyMaterial cached;

    public KeyStore(Path directory, PqcService pqcService, Optional<String> secret) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.pqcService = Objects.requireNonNull(pqcService, "pqcService must not be null");
        this.secret = secret == null ? Optional.empty() : secret.filter(value -> !value.isBlank());
    }

    /**
     * Generate both pairs and persist them, replacing any existing pair.
     *
     * @throws CapsuleException.KeyGenerationException if a primitive cannot produce a pair.
     * @throws StorageException if the artifacts cannot be written.
     */
    public synchronized KeyMaterial generateKeys() {
        KeyMaterial keys = pqcService.generateKeyMaterial();
        CapsuleProfile profile = pqcService.profile();

        KeyFile encapsulation = seal(PURPOSE_ENCAPSULATION, profile.kemAlgorithm(),
                keys.encapsulationPublicKey().getEncoded(), keys.encapsulationPrivateKey().getEncoded());
        KeyFile signing = seal(PURPOSE_SIGNING, profile.signatureAlgorithm(),
                keys.signingPublicKey().getEncoded(), keys.signingPrivateKey().getEncoded());

        Path encapsulationPath = directory.resolve(ENCAPSULATION_FILE);
        Path encapsulationTemp = null;
        Path signingTemp = null;
        byte[] previousEncapsulation = null;
        boolean encapsulationReplaced = false;
        try {
            Files.createDirectories(directory);
            if (Files.exists(encapsulationPath)) {
                previousEncapsulation = Files.readAllBytes(encapsulationPath);
            }
            encapsulationTemp = writeTemp(encapsulation);
            signingTemp = writeTemp(signing);
            moveIntoPlace(encapsulationTemp, encapsulationPath);
            encapsulationReplaced = true;
            moveIntoPlace(signingTemp, directory.resolve(SIGNING_FILE));
        } catch (IOException e) {
            // Both artifacts must come from the same generation.
            if (encapsulationReplaced) {
                restore(encapsulationPath, previousEncapsulation);
            }
            cached = null;
            ErrorLogger.logError("KeyStore.generateKeys", "Failed to persist key pairs to " + directory, e);
            throw new StorageException("Failed to persist key pairs to " + directory, e);
        } finally {
            deleteQuietly(encapsulationTemp);
            deleteQuietly(signingTemp);
        }

        if (secret.isEmpty()) {
            ErrorLogger.logWarning("KeyStore.generateKeys",
                    "CAPSULE_KEY_SECRET is not set; private keys are stored unencrypted in " + directory);
        }
        ErrorLogger.logInfo("KeyStore.generateKeys", "Generated key pairs " + keys.fingerprint());
        cached = keys;
        return keys;
    }

    /**
     * Load the persisted pairs, using the in-memory copy when one exists.
     *
     * @throws KeysNotFoundException if either artifact is missing.
     * @throws KeyCorruptionException if an artifact does not decode to valid, matching key material.
     * @throws StorageException if an artifact exists but cannot be read.
     */
    public synchronized KeyMaterial loadKeys() {
        if (cached != null) {
            return cached;
        }
        Path encapsulationPath = directory.resolve(ENCAPSULATION_FILE);
        Path signingPath = directory.resolve(SIGNING_FILE);
        boolean hasEncapsulation = Files.exists(encapsulationPath);
        boolean hasSigning = Files.exists(signingPath);
        if (!hasEncapsulation && !hasSigning) {
            throw new KeysNotFoundException("No keys found in " + directory + ". Generate keys first.");
        }
        if (!hasEncapsulation || !hasSigning) {
            throw new KeysNotFoundException("Incomplete key set in " + directory + ": missing "
                    + (hasEncapsulation ? SIGNING_FILE : ENCAPSULATION_FILE) + ". Regenerate keys.");
        }

        CapsuleProfile profile = pqcService.profile();
        KeyFile encapsulation = read(encapsulationPath, PURPOSE_ENCAPSULATION, profile.kemAlgorithm());
        KeyFile signing = read(signingPath, PURPOSE_SIGNING, profile.signatureAlgorithm());

        MLDSAPublicKeyParameters signingPublicKey = pqcService.decodeSigningPublicKey(decode(signing.publicKey, SIGNING_FILE));
        KeyMaterial keys = new KeyMaterial(
                pqcService.decodeEncapsulationPublicKey(decode(encapsulation.publicKey, ENCAPSULATION_FILE)),
                pqcService.decodeEncapsulationPrivateKey(unseal(encapsulation, ENCAPSULATION_FILE)),
                signingPublicKey,
                pqcService.decodeSigningPrivateKey(unseal(signing, SIGNING_FILE), signingPublicKey)
        );
        pqcService.checkConsistency(keys);
        cached = keys;
        return keys;
    }

    public synchronized boolean hasKeys() {
        return cached != null
                || (Files.exists(directory.resolve(ENCAPSULATION_FILE)) && Files.exists(directory.resolve(SIGNING_FILE)));
    }

    public Path directory() {
        return directory;
    }

    // ----- Artifact helpers -----

    private KeyFile seal(String purpose, String algorithm, byte[] publicKey, byte[] privateKey) {
        KeyFile file = new KeyFile();
        file.format = FORMAT_MAGIC;
        file.version = FORMAT_VERSION;
        file.purpose = purpose;
        file.algorithm = algorithm;
        file.createdAt = Instant.now().toString();
        file.publicKey = ByteEncoding.toBase64(publicKey);
        if (secret.isEmpty()) {
            file.privateKey = ByteEncoding.toBase64(privateKey);
            return file;
        }
        try {
            file.sealedPrivateKey = encryptPayload(privateKey, secret.get().toCharArray());
            return file;
        } catch (GeneralSecurityException e) {
            ErrorLogger.logError("KeyStore.seal", "Failed to encrypt " + purpose + " private key", e);
            throw new StorageException("Failed to encrypt " + purpose + " private key", e);
        }
    }

    private Path writeTemp(KeyFile file) throws IOException {
        Path temp = Files.createTempFile(directory, file.purpose + "-", ".tmp");
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), file);
        return temp;
    }

    private static void restore(Path target, byte[] previous) {
        try {
            if (previous == null) {
                Files.deleteIfExists(target);
            } else {
                Files.write(target, previous);
            }
        } catch (IOException e) {
            ErrorLogger.logError("KeyStore.restore", "Could not restore " + target.getFileName()
                    + "; regenerate keys before creating capsules", e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            ErrorLogger.logWarning("KeyStore.generateKeys", "Could not remove temporary file " + temp);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static KeyFile read(Path path, String expectedPurpose, String expectedAlgorithm) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ErrorLogger.logError("KeyStore.read", "Failed to read " + path, e);
            throw new StorageException("Failed to read key artifact " + path.getFileName(), e);
        }
        KeyFile file;
        try {
            file = MAPPER.readValue(content, KeyFile.class);
        } catch (IOException e) {
            ErrorLogger.logError("KeyStore.read", "Unparseable key artifact " + path.getFileName(), e);
            throw new KeyCorruptionException("Key artifact " + path.getFileName() + " is not valid JSON", e);
        }
        validateKeyFile(file, path.getFileName().toString(), expectedPurpose, expectedAlgorithm);
        return file;
    }

    private static void validateKeyFile(KeyFile file, String name, String expectedPurpose, String expectedAlgorithm) {
        if (file == null) {
            throw new KeyCorruptionException("Key artifact " + name + " is empty");
        }
        if (!FORMAT_MAGIC.equals(file.format)) {
            throw new KeyCorruptionException("Unknown key file format in " + name + ": " + file.format);
        }
        if (file.version != FORMAT_VERSION) {
            throw new KeyCorruptionException("Unsupported key file version in " + name + ": " + file.version
                    + " (expected " + FORMAT_VERSION + ")");
        }
        if (!expectedPurpose.equals(file.purpose)) {
            throw new KeyCorruptionException("Key artifact " + name + " holds a '" + file.purpose
                    + "' key, expected '" + expectedPurpose + "'");
        }
        if (!expectedAlgorithm.equals(file.algorithm)) {
            throw new KeyCorruptionException("Key artifact " + name + " uses " + file.algorithm
                    + ", expected " + expectedAlgorithm);
        }
        if (file.publicKey == null || (file.privateKey == null && file.sealedPrivateKey == null)) {
            throw new KeyCorruptionException("Key artifact " + name + " is missing key material");
        }
    }

    private byte[] unseal(KeyFile file, String name) {
        if (file.sealedPrivateKey == null) {
            return decode(file.privateKey, name);
        }
        if (secret.isEmpty()) {
            throw new KeyCorruptionException("Key artifact " + name
                    + " is encrypted but CAPSULE_KEY_SECRET is not set");
        }
        try {
            return decryptPayload(file.sealedPrivateKey, secret.get().toCharArray());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            ErrorLogger.logError("KeyStore.unseal", "Failed to decrypt private key in " + name, e);
            throw new KeyCorruptionException("Failed to decrypt private key in " + name
                    + " (wrong passphrase or damaged file)", e);
        }
    }

    private static byte[] decode(String base64, String name) {
        try {
            return ByteEncoding.fromBase64(base64);
        } catch (IllegalArgumentException e) {
            throw new KeyCorruptionException("Key artifact " + name + " contains malformed Base64", e);
        }
    }

    private static SealedPrivateKey encryptPayload(byte[] plaintext, char[] secret)
            throws GeneralSecurityException {
        byte[] salt = new byte[SALT_BYTES];
        byte[] iv = new byte[IV_BYTES];
        RANDOM.nextBytes(salt);
        RANDOM.nextBytes(iv);
        SecretKeySpec keySpec = deriveKey(secret, salt, PBKDF2_ITERATIONS);

        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.ENCRYPT_MODE, keySpec, new GCMParameterSpec(GCM_TAG_BITS, iv));

        SealedPrivateKey sealed = new SealedPrivateKey();
        sealed.kdf = KDF;
        sealed.iterations = PBKDF2_ITERATIONS;
        sealed.salt = ByteEncoding.toBase64(salt);
        sealed.iv = ByteEncoding.toBase64(iv);
        sealed.ciphertext = ByteEncoding.toBase64(cipher.doFinal(plaintext));
        return sealed;
    }

    private static byte[] decryptPayload(SealedPrivateKey sealed, char[] secret) throws GeneralSecurityException {
        if (!KDF.equals(sealed.kdf) || sealed.iterations <= 0) {
            throw new GeneralSecurityException("Unsupported key derivation: " + sealed.kdf);
        }
        if (sealed.salt == null || sealed.iv == null || sealed.ciphertext == null) {
            throw new GeneralSecurityException("Sealed private key is incomplete");
        }
        SecretKeySpec keySpec = deriveKey(secret, ByteEncoding.fromBase64(sealed.salt), sealed.iterations);
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.DECRYPT_MODE, keySpec,
                new GCMParameterSpec(GCM_TAG_BITS, ByteEncoding.fromBase64(sealed.iv)));
        return cipher.doFinal(ByteEncoding.fromBase64(sealed.ciphertext));
    }

    private static SecretKeySpec deriveKey(char[] secret, byte[] salt, int iterations) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(secret, salt, iterations, 256);
        try {
            return new SecretKeySpec(SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded(), "AES");
        } finally {
            spec.clearPassword();
        }
    }

    // ----- Serialization payloads -----

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private static final class KeyFile {
        public String format;
        public int version;
        public String purpose;
        public String algorithm;
        public String createdAt;
        public String publicKey;
        public String privateKey;
        public SealedPrivateKey sealedPrivateKey;
    }

    private static final class SealedPrivateKey {
        public String kdf;
        public int iterations;
        public String salt;
        public String iv;
        public String ciphertext;
    }
}
