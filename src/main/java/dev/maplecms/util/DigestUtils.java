package dev.maplecms.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 helpers. Refresh tokens are stored only as their digest.
 */
public final class DigestUtils {

    private static final HexFormat HEX = HexFormat.of();

    private DigestUtils() {
    }

    /**
     * @return lowercase hex SHA-256 of the UTF-8 bytes of {@code input}
     */
    public static String sha256Hex(String input) {
        Objects.requireNonNull(input, "Input must not be null");
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
