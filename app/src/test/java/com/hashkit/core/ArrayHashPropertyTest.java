package com.hashkit.core;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based tests for the array algorithms using jqwik.
 */
class ArrayHashPropertyTest {

    @Property
    void pairSumReturnsOrderedIndicesHittingTarget(
            @ForAll @Size(min = 2, max = 50) List<@IntRange(min = -1000, max = 1000) Integer> values,
            @ForAll @IntRange(min = 0, max = 1000) int first,
            @ForAll @IntRange(min = 0, max = 1000) int offset) {
        int n = values.size();
        int i = first % n;
        int j = (i + 1 + offset % (n - 1)) % n;
        int target = values.get(i) + values.get(j);
        int[] nums = toArray(values);

        int[] pair = PairSumFinder.findPair(nums, target);

        assertEquals(2, pair.length);
        assertTrue(pair[0] < pair[1]);
        assertEquals(target, nums[pair[0]] + nums[pair[1]]);
    }

    @Property
    void anagramCheckMatchesSortedComparison(
            @ForAll @StringLength(max = 8) @CharRange(from = 'a', to = 'c') String s,
            @ForAll @StringLength(max = 8) @CharRange(from = 'a', to = 'c') String t) {
        boolean expected = AnagramKey.sortedKey(s).equals(AnagramKey.sortedKey(t));
        assertEquals(expected, AnagramChecker.isAnagram(s, t));
        assertEquals(AnagramChecker.isAnagram(s, t), AnagramChecker.isAnagram(t, s));
    }

    @Property
    void shuffledStringIsAnagram(
            @ForAll @StringLength(max = 30) @CharRange(from = 'a', to = 'z') @Chars({'é', 'ß', '#', ' '}) String s,
            @ForAll long seed) {
        List<Integer> codePoints = new ArrayList<>();
        s.codePoints().forEach(codePoints::add);
        Collections.shuffle(codePoints, new Random(seed));

        StringBuilder shuffled = new StringBuilder();
        codePoints.forEach(shuffled::appendCodePoint);

        assertTrue(AnagramChecker.isAnagram(s, shuffled.toString()));
    }

    @Property
    void productMatchesBruteForce(
            @ForAll @Size(min = 2, max = 12) List<@IntRange(min = -20, max = 20) Integer> values) {
        int[] nums = toArray(values);

        int[] output = ProductExceptSelf.compute(nums);

        for (int i = 0; i < nums.length; i++) {
            int expected = 1;
            for (int j = 0; j < nums.length; j++) {
                if (j != i) expected *= nums[j];
            }
            assertEquals(expected, output[i], "Product at index " + i);
        }
    }

    @Property
    void longestRunIgnoresOrderAndDuplicates(
            @ForAll @Size(max = 60) List<@IntRange(min = -50, max = 50) Integer> values,
            @ForAll long seed) {
        List<Integer> reordered = new ArrayList<>(values);
        reordered.addAll(values.subList(0, values.size() / 2));
        Collections.shuffle(reordered, new Random(seed));

        int length = ConsecutiveRuns.longestLength(toArray(values));

        assertEquals(length, ConsecutiveRuns.longestLength(toArray(reordered)));
        assertEquals(bruteForceLongestRun(values), length);
    }

    private static int bruteForceLongestRun(List<Integer> values) {
        int best = 0;
        int current = 0;
        Integer previous = null;
        for (int value : new TreeSet<>(values)) {
            current = (previous != null && value == previous + 1) ? current + 1 : 1;
            best = Math.max(best, current);
            previous = value;
        }
        return best;
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
