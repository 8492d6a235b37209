package com.hashkit.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Character-multiset equality between two strings.
 */
public class AnagramChecker {

    private AnagramChecker() {
    }

    /**
     * Check whether two strings contain exactly the same characters,
     * in any order. Characters are compared as Unicode code points.
     */
    public static boolean isAnagram(String s, String t) {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(t, "t");

        if (s.length() != t.length()) {
            return false;
        }

        Map<Integer, Integer> counts = new HashMap<>();
        s.codePoints().forEach(cp -> counts.merge(cp, 1, Integer::sum));

        int[] codePoints = t.codePoints().toArray();
        for (int cp : codePoints) {
            Integer remaining = counts.get(cp);
            if (remaining == null) {
                return false;
            }
            if (remaining == 1) {
                counts.remove(cp);
            } else {
                counts.put(cp, remaining - 1);
            }
        }
        return counts.isEmpty();
    }
}
