package com.hashkit.core;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Longest run of consecutive integers in an unordered array.
 */
public class ConsecutiveRuns {

    private ConsecutiveRuns() {
    }

    /**
     * Length of the longest run of consecutive integers.
     *
     * @param nums Input values in any order, duplicates allowed
     * @return Run length, 0 for an empty array
     */
    public static int longestLength(int[] nums) {
        return longestRun(nums).getLength();
    }

    /**
     * Find the longest run of consecutive integers in expected O(n) time.
     *
     * <p>Only values whose predecessor is absent are extended, so every
     * distinct value is visited at most twice in total. Among runs of equal
     * length the one with the smallest start is returned.
     *
     * @param nums Input values in any order, duplicates allowed
     * @return Longest run, or {@link ConsecutiveRun#EMPTY} for an empty array
     */
    public static ConsecutiveRun longestRun(int[] nums) {
        Objects.requireNonNull(nums, "nums");

        Set<Integer> values = new HashSet<>();
        for (int num : nums) {
            values.add(num);
        }

        ConsecutiveRun best = ConsecutiveRun.EMPTY;
        for (int value : values) {
            if (value != Integer.MIN_VALUE && values.contains(value - 1)) {
                continue; // not a run start
            }

            int current = value;
            int length = 1;
            while (current != Integer.MAX_VALUE && values.contains(current + 1)) {
                current++;
                length++;
            }

            if (length > best.getLength()
                    || (length == best.getLength() && value < best.getStart())) {
                best = new ConsecutiveRun(value, length);
            }
        }
        return best;
    }
}
