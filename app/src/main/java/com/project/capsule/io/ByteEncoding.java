package com.project.capsule.io;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

public final class ByteEncoding {

    private ByteEncoding() {
    }

    public static String toBase64(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not valid Base64.
     */
    public static byte[] fromBase64(String value) {
        return Base64.getDecoder().decode(value.getBytes(StandardCharsets.UTF_8));
    }
}
