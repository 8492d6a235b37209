package com.hashkit.core;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Detects repeated values in an integer array.
 */
public class DuplicateDetector {

    private DuplicateDetector() {
    }

    /**
     * Check whether any value appears more than once.
     *
     * @param nums Input values
     * @return true on the first repeated value, false if all values are distinct
     */
    public static boolean containsDuplicate(int[] nums) {
        Objects.requireNonNull(nums, "nums");

        Set<Integer> seen = new HashSet<>();
        for (int num : nums) {
            if (!seen.add(num)) {
                return true;
            }
        }
        return false;
    }
}
