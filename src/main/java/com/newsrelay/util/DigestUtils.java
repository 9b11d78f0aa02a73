package com.newsrelay.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

public final class DigestUtils {

    private static final HexFormat HEX = HexFormat.of();

    private DigestUtils() {
        // utility class
    }

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes of {@code input}.
     */
    public static String sha256Hex(String input) {
        Objects.requireNonNull(input, "Input must not be null");
        return HEX.formatHex(sha256(input.getBytes(StandardCharsets.UTF_8)));
    }

    public static byte[] sha256(byte[] data) {
        Objects.requireNonNull(data, "Input must not be null");
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String toHex(byte[] data) {
        return HEX.formatHex(data);
    }
}
