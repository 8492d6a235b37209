package com.hashkit.core;

import java.util.Objects;

/**
 * Product of all other elements for each position, computed without division.
 */
public class ProductExceptSelf {

    private ProductExceptSelf() {
    }

    /**
     * Build the product-except-self array.
     *
     * <p>First pass stores the product of all strictly preceding elements in
     * each slot; second pass multiplies in the product of all strictly
     * following elements. No storage besides the output array is used.
     *
     * @param nums Input values; products are expected to fit in an int
     * @return Array where element {@code i} is the product of every element except {@code nums[i]}
     */
    public static int[] compute(int[] nums) {
        Objects.requireNonNull(nums, "nums");

        int n = nums.length;
        int[] output = new int[n];

        int leftProduct = 1;
        for (int i = 0; i < n; i++) {
            output[i] = leftProduct;
            leftProduct *= nums[i];
        }

        int rightProduct = 1;
        for (int i = n - 1; i >= 0; i--) {
            output[i] *= rightProduct;
            rightProduct *= nums[i];
        }

        return output;
    }
}
