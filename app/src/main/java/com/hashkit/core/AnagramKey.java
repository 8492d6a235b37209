package com.hashkit.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Canonical signatures for anagram grouping.
 * Two strings share a signature exactly when one is a permutation of the other.
 */
public class AnagramKey {

    /** Size of the count-vector alphabet ('a' to 'z'). */
    public static final int ALPHABET_SIZE = 26;

    private AnagramKey() {
    }

    /**
     * Signature built by sorting the string's code points.
     * Works for any characters.
     */
    public static String sortedKey(String s) {
        Objects.requireNonNull(s, "s");
        int[] codePoints = s.codePoints().sorted().toArray();
        return new String(codePoints, 0, codePoints.length);
    }

    /**
     * Signature built by tallying a fixed 26-slot count vector.
     *
     * @throws IllegalArgumentException If the string contains anything but 'a' to 'z'
     */
    public static CountKey countKey(String s) {
        Objects.requireNonNull(s, "s");
        int[] counts = new int[ALPHABET_SIZE];
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 'a' || c > 'z') {
                throw new IllegalArgumentException(
                    "Count key supports lowercase a-z only, found '" + c + "' at index " + i);
            }
            counts[c - 'a']++;
        }
        return new CountKey(counts);
    }

    /**
     * Immutable character-count vector usable as a map key.
     */
    public static final class CountKey {
        private final int[] counts;
        private final int hash;

        CountKey(int[] counts) {
            this.counts = counts;
            this.hash = Arrays.hashCode(counts);
        }

        public int getCount(char c) {
            if (c < 'a' || c > 'z') {
                return 0;
            }
            return counts[c - 'a'];
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CountKey)) return false;
            return Arrays.equals(counts, ((CountKey) o).counts);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < ALPHABET_SIZE; i++) {
                if (counts[i] > 0) {
                    sb.append((char) ('a' + i)).append(counts[i]);
                }
            }
            return sb.toString();
        }
    }
}
