package com.hashkit.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic sample inputs for benchmarks and demos.
 */
public class SampleDataGenerator {

    private static final String[] ROOTS = {
        "stop", "listen", "evil", "act", "night", "dusty", "state", "heart", "below", "elbow"
    };

    private SampleDataGenerator() {
    }

    /**
     * Integers with a skewed distribution: small values are much more frequent.
     *
     * @param size Number of values
     * @param distinct Upper bound on distinct values
     * @param seed Random seed
     */
    public static int[] skewedIntegers(int size, int distinct, long seed) {
        if (size < 0 || distinct <= 0) {
            throw new IllegalArgumentException("size must be >= 0 and distinct > 0");
        }
        Random random = new Random(seed);
        int[] values = new int[size];
        for (int i = 0; i < size; i++) {
            // Product of two uniforms favours small values
            values[i] = (int) (random.nextDouble() * random.nextDouble() * distinct);
        }
        return values;
    }

    /**
     * Lowercase words built by shuffling a fixed set of roots, so many of them
     * are anagrams of each other.
     */
    public static List<String> anagramWords(int size, long seed) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        Random random = new Random(seed);
        List<String> words = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            char[] chars = ROOTS[random.nextInt(ROOTS.length)].toCharArray();
            for (int j = chars.length - 1; j > 0; j--) {
                int k = random.nextInt(j + 1);
                char tmp = chars[j];
                chars[j] = chars[k];
                chars[k] = tmp;
            }
            words.add(new String(chars));
        }
        return words;
    }
}
