package net.panotour.util;

import java.security.SecureRandom;

/**
 * Panorama identifier generator.
 * Format: {@code pano_{epochMillis}_{7 base-36 chars}}; the time component orders ids,
 * the random suffix separates ids minted within the same millisecond.
 */
public final class IdGenerator {

    public static final String PANORAMA_PREFIX = "pano_";

    // Base36 alphabet: digits + lowercase
    private static final char[] BASE36_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int PANORAMA_SUFFIX_SIZE = 7;

    // Single SecureRandom instance; thread-safe for concurrent use
    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {}

    /** New panorama id using the current wall clock. */
    public static String panoramaId() {
        return panoramaId(System.currentTimeMillis());
    }

    /** Panorama id for a given epoch-millisecond timestamp. */
    public static String panoramaId(long epochMillis) {
        return PANORAMA_PREFIX + epochMillis + "_" + randomSuffix(PANORAMA_SUFFIX_SIZE);
    }

    /** Random string drawn uniformly from the base-36 alphabet. */
    public static String randomSuffix(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        char[] id = new char[size];
        for (int i = 0; i < size; i++) {
            id[i] = BASE36_ALPHABET[RANDOM.nextInt(BASE36_ALPHABET.length)];
        }
        return new String(id);
    }
}
