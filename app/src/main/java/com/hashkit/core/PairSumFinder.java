package com.hashkit.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Finds two indices whose values add up to a target using complement lookup.
 */
public class PairSumFinder {

    private static final int[] NO_PAIR = new int[0];

    private PairSumFinder() {
    }

    /**
     * Find indices {@code i < j} such that {@code nums[i] + nums[j] == target}.
     *
     * <p>The array is scanned once; each value is checked against the indices
     * seen so far, so the returned pair is the one with the smallest {@code j}.
     *
     * @param nums Input values
     * @param target Required sum
     * @return Two-element array {@code {i, j}}, or an empty array if no pair exists
     */
    public static int[] findPair(int[] nums, int target) {
        Objects.requireNonNull(nums, "nums");

        Map<Integer, Integer> indexByValue = new HashMap<>();
        for (int j = 0; j < nums.length; j++) {
            long complement = (long) target - nums[j];
            if (complement >= Integer.MIN_VALUE && complement <= Integer.MAX_VALUE) {
                Integer i = indexByValue.get((int) complement);
                if (i != null) {
                    return new int[]{i, j};
                }
            }
            // Keep the earliest index for repeated values
            indexByValue.putIfAbsent(nums[j], j);
        }
        return NO_PAIR.clone();
    }
}
