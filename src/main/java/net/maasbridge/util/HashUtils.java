package net.maasbridge.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers used for entity tags on rendered resource bodies.
 *
 * @author William Callahan
 */
public final class HashUtils {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes the SHA-256 digest of UTF-8 text as lowercase hex.
     *
     * @param data text to hash
     * @return 64 character hex string
     * @throws IllegalStateException if the JVM has no SHA-256 provider
     *
     * @example
     * <pre>{@code
     * String hex = HashUtils.sha256Hex("{\"system_id\":\"abc123\"}");
     * }</pre>
     */
    public static String sha256Hex(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return bytesToHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Builds a strong entity tag (quoted) for a rendered body.
     *
     * @param body rendered response text
     * @return quoted tag, e.g. {@code "9f86d081884c7d65"}
     */
    public static String entityTag(String body) {
        return "\"" + sha256Hex(body).substring(0, 32) + "\"";
    }

    private static String bytesToHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
