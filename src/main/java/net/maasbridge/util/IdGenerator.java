package net.maasbridge.util;

import java.security.SecureRandom;

/**
 * Minimal NanoId-style generator (URL-safe) used for request correlation ids.
 */
public final class IdGenerator {
    // Base62 alphabet: digits + lowercase + uppercase
    private static final char[] DEFAULT_ALPHABET =
            "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();
    private static final int DEFAULT_SIZE = 12;

    // Single SecureRandom instance; thread-safe for concurrent use
    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {}

    /** 12-char request id */
    public static String requestId() {
        return generate(DEFAULT_SIZE);
    }

    /** NanoId with size */
    public static String generate(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        char[] id = new char[size];
        for (int i = 0; i < size; i++) {
            id[i] = DEFAULT_ALPHABET[RANDOM.nextInt(DEFAULT_ALPHABET.length)];
        }
        return new String(id);
    }
}
