package com.project.capsule.io;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.project.capsule.core.Capsule;
import com.project.capsule.core.CapsuleException.StorageException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Stable layouts for capsule records.
 *
 * <p>Records are stored as JSON: byte fields in Base64, {@code createdAt} as an ISO-8601
 * instant and {@code unlockDate} as an ISO-8601 date. The signature input and the AEAD
 * associated data use a binary layout in which every field is preceded by its length as a
 * 4-byte big-endian integer.</p>
 */
public final class CapsuleCodec {

    static final String FORMAT_MAGIC = "QTC-CAPSULE";
    static final int FORMAT_VERSION = 1;

    private static final byte[] SIGNATURE_DOMAIN = "QTC-CAPSULE-SIGNATURE-v1".getBytes(StandardCharsets.UTF_8);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private CapsuleCodec() {
    }

    // ----- Record layout -----

    public static byte[] encode(Capsule capsule) {
        try {
            return MAPPER.writeValueAsBytes(CapsuleRecord.from(capsule));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize capsule record", e);
        }
    }

    /**
     * @throws StorageException if the bytes are not a well-formed capsule record.
     */
    public static Capsule decode(byte[] data) {
        CapsuleRecord record;
        try {
            record = MAPPER.readValue(data, CapsuleRecord.class);
        } catch (IOException e) {
            throw new StorageException("Capsule record is not valid JSON", e);
        }
        if (record == null) {
            throw new StorageException("Capsule record is empty");
        }
        if (!FORMAT_MAGIC.equals(record.format())) {
            throw new StorageException("Unknown capsule record format: " + record.format());
        }
        if (record.version() != FORMAT_VERSION) {
            throw new StorageException("Unsupported capsule record version: " + record.version()
                    + " (expected " + FORMAT_VERSION + ")");
        }
        return record.toCapsule();
    }

    // ----- Canonical binary layouts -----

    /**
     * The byte sequence the capsule signature covers.
     */
    public static byte[] signingPayload(Capsule capsule) {
        return concatenate(
                SIGNATURE_DOMAIN,
                capsule.encapsulatedKey(),
                capsule.nonce(),
                capsule.ciphertext(),
                capsule.authenticationTag(),
                canonical(capsule.createdAt()),
                canonical(capsule.unlockDate())
        );
    }

    /**
     * Associated data binding the creation time and unlock date into the AEAD tag.
     */
    public static byte[] associatedData(Instant createdAt, LocalDate unlockDate) {
        return concatenate(canonical(createdAt), canonical(unlockDate));
    }

    static byte[] canonical(Instant instant) {
        return instant.toString().getBytes(StandardCharsets.UTF_8);
    }

    static byte[] canonical(LocalDate date) {
        return date.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] concatenate(byte[]... fields) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] field : fields) {
            out.writeBytes(ByteBuffer.allocate(Integer.BYTES).putInt(field.length).array());
            out.writeBytes(field);
        }
        return out.toByteArray();
    }

    // ----- Serialization payload -----

    @JsonPropertyOrder({"format", "version", "createdAt", "unlockDate", "encapsulatedKey", "nonce",
            "ciphertext", "authenticationTag", "signature"})
    private record CapsuleRecord(
            String format,
            int version,
            String createdAt,
            String unlockDate,
            String encapsulatedKey,
            String nonce,
            String ciphertext,
            String authenticationTag,
            String signature
    ) {
        static CapsuleRecord from(Capsule capsule) {
            return new CapsuleRecord(
                    FORMAT_MAGIC,
                    FORMAT_VERSION,
                    capsule.createdAt().toString(),
                    capsule.unlockDate().toString(),
                    ByteEncoding.toBase64(capsule.encapsulatedKey()),
                    ByteEncoding.toBase64(capsule.nonce()),
                    ByteEncoding.toBase64(capsule.ciphertext()),
                    ByteEncoding.toBase64(capsule.authenticationTag()),
                    ByteEncoding.toBase64(capsule.signature())
            );
        }

        Capsule toCapsule() {
            try {
                return new Capsule(
                        Instant.parse(required(createdAt, "createdAt")),
                        LocalDate.parse(required(unlockDate, "unlockDate")),
                        ByteEncoding.fromBase64(required(encapsulatedKey, "encapsulatedKey")),
                        ByteEncoding.fromBase64(required(nonce, "nonce")),
                        ByteEncoding.fromBase64(required(ciphertext, "ciphertext")),
                        ByteEncoding.fromBase64(required(authenticationTag, "authenticationTag")),
                        ByteEncoding.fromBase64(required(signature, "signature"))
                );
            } catch (DateTimeParseException e) {
                throw new StorageException("Capsule record has a malformed date: " + e.getParsedString(), e);
            } catch (IllegalArgumentException e) {
                throw new StorageException("Capsule record has a malformed byte field", e);
            }
        }

        private static String required(String value, String field) {
            if (value == null) {
                throw new StorageException("Capsule record is missing field '" + field + "'");
            }
            return value;
        }
    }
}
