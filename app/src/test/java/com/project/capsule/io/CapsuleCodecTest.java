package com.project.capsule.io;

import com.project.capsule.core.Capsule;
import com.project.capsule.core.CapsuleException.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CapsuleCodec")
class CapsuleCodecTest {

    private static Capsule sample() {
        return new Capsule(
                Instant.parse("2024-01-01T10:15:30.123Z"),
                LocalDate.parse("2035-01-01"),
                bytes(1088, 1),
                bytes(12, 2),
                bytes(20, 3),
                bytes(16, 4),
                bytes(3309, 5)
        );
    }

    private static byte[] bytes(int length, int seed) {
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = (byte) (seed * 31 + i);
        }
        return out;
    }

    @Nested
    @DisplayName("Record layout")
    class RecordLayout {

        @Test
        @DisplayName("Decoding an encoded capsule restores every field")
        void restoresFields() {
            Capsule original = sample();
            Capsule decoded = CapsuleCodec.decode(CapsuleCodec.encode(original));

            assertEquals(original.createdAt(), decoded.createdAt());
            assertEquals(original.unlockDate(), decoded.unlockDate());
            assertArrayEquals(original.encapsulatedKey(), decoded.encapsulatedKey());
            assertArrayEquals(original.nonce(), decoded.nonce());
            assertArrayEquals(original.ciphertext(), decoded.ciphertext());
            assertArrayEquals(original.authenticationTag(), decoded.authenticationTag());
            assertArrayEquals(original.signature(), decoded.signature());
        }

        @Test
        @DisplayName("Records carry the format marker and ISO dates")
        void recordShape() {
            String json = new String(CapsuleCodec.encode(sample()), StandardCharsets.UTF_8);

            assertTrue(json.contains("\"format\" : \"QTC-CAPSULE\""), json);
            assertTrue(json.contains("\"version\" : 1"), json);
            assertTrue(json.contains("\"createdAt\" : \"2024-01-01T10:15:30.123Z\""), json);
            assertTrue(json.contains("\"unlockDate\" : \"2035-01-01\""), json);
        }

        @Test
        @DisplayName("Invalid JSON is a storage error")
        void invalidJson() {
            assertThrows(StorageException.class,
                    () -> CapsuleCodec.decode("{not json".getBytes(StandardCharsets.UTF_8)));
            assertThrows(StorageException.class,
                    () -> CapsuleCodec.decode("null".getBytes(StandardCharsets.UTF_8)));
        }

        @Test
        @DisplayName("Unknown format or version is a storage error")
        void wrongFormatOrVersion() {
            String json = new String(CapsuleCodec.encode(sample()), StandardCharsets.UTF_8);

            assertThrows(StorageException.class, () -> CapsuleCodec.decode(
                    json.replace("QTC-CAPSULE", "OTHER").getBytes(StandardCharsets.UTF_8)));
            assertThrows(StorageException.class, () -> CapsuleCodec.decode(
                    json.replace("\"version\" : 1", "\"version\" : 2").getBytes(StandardCharsets.UTF_8)));
        }

        @Test
        @DisplayName("Missing fields, bad dates and bad Base64 are storage errors")
        void malformedFields() {
            String json = new String(CapsuleCodec.encode(sample()), StandardCharsets.UTF_8);

            assertThrows(StorageException.class, () -> CapsuleCodec.decode(
                    json.replace("\"nonce\"", "\"ignoredNonce\"").getBytes(StandardCharsets.UTF_8)));
            assertThrows(StorageException.class, () -> CapsuleCodec.decode(
                    json.replace("2035-01-01", "2035-01-32").getBytes(StandardCharsets.UTF_8)));
            assertThrows(StorageException.class, () -> CapsuleCodec.decode(
                    json.replace("\"nonce\" : \"", "\"nonce\" : \"!!").getBytes(StandardCharsets.UTF_8)));
        }
    }

    @Nested
    @DisplayName("Signing payload")
    class SigningPayload {

        @Test
        @DisplayName("Payload is deterministic")
        void deterministic() {
            assertArrayEquals(CapsuleCodec.signingPayload(sample()), CapsuleCodec.signingPayload(sample()));
        }

        @Test
        @DisplayName("Every covered field changes the payload")
        void coversEveryField() {
            Capsule base = sample();
            byte[] reference = CapsuleCodec.signingPayload(base);

            Capsule[] variants = {
                    new Capsule(base.createdAt().plusMillis(1), base.unlockDate(), base.encapsulatedKey(),
                            base.nonce(), base.ciphertext(), base.authenticationTag(), base.signature()),
                    new Capsule(base.createdAt(), base.unlockDate().plusDays(1), base.encapsulatedKey(),
                            base.nonce(), base.ciphertext(), base.authenticationTag(), base.signature()),
                    new Capsule(base.createdAt(), base.unlockDate(), bytes(1088, 9),
                            base.nonce(), base.ciphertext(), base.authenticationTag(), base.signature()),
                    new Capsule(base.createdAt(), base.unlockDate(), base.encapsulatedKey(),
                            bytes(12, 9), base.ciphertext(), base.authenticationTag(), base.signature()),
                    new Capsule(base.createdAt(), base.unlockDate(), base.encapsulatedKey(),
                            base.nonce(), bytes(20, 9), base.authenticationTag(), base.signature()),
                    new Capsule(base.createdAt(), base.unlockDate(), base.encapsulatedKey(),
                            base.nonce(), base.ciphertext(), bytes(16, 9), base.signature())
            };
            for (Capsule variant : variants) {
                assertFalse(java.util.Arrays.equals(reference, CapsuleCodec.signingPayload(variant)));
            }
        }

        @Test
        @DisplayName("The signature itself is not covered")
        void signatureExcluded() {
            Capsule base = sample();
            Capsule resigned = new Capsule(base.createdAt(), base.unlockDate(), base.encapsulatedKey(),
                    base.nonce(), base.ciphertext(), base.authenticationTag(), new byte[0]);
            assertArrayEquals(CapsuleCodec.signingPayload(base), CapsuleCodec.signingPayload(resigned));
        }

        @Test
        @DisplayName("Length prefixes keep adjacent fields apart")
        void lengthPrefixed() {
            Capsule base = sample();
            byte[] ct = base.ciphertext();
            byte[] tag = base.authenticationTag();
            byte[] shiftedCt = java.util.Arrays.copyOf(ct, ct.length + 1);
            shiftedCt[ct.length] = tag[0];
            byte[] shiftedTag = java.util.Arrays.copyOfRange(tag, 1, tag.length);

            Capsule shifted = new Capsule(base.createdAt(), base.unlockDate(), base.encapsulatedKey(),
                    base.nonce(), shiftedCt, shiftedTag, base.signature());
            assertFalse(java.util.Arrays.equals(CapsuleCodec.signingPayload(base), CapsuleCodec.signingPayload(shifted)));
        }

        @Test
        @DisplayName("Associated data binds both dates")
        void associatedData() {
            Instant created = Instant.parse("2024-01-01T00:00:00Z");
            byte[] reference = CapsuleCodec.associatedData(created, LocalDate.parse("2035-01-01"));

            assertFalse(java.util.Arrays.equals(reference,
                    CapsuleCodec.associatedData(created, LocalDate.parse("2035-01-02"))));
            assertFalse(java.util.Arrays.equals(reference,
                    CapsuleCodec.associatedData(created.plusSeconds(1), LocalDate.parse("2035-01-01"))));
        }
    }
}
