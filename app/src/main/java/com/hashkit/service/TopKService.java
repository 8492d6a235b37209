package com.hashkit.service;

import java.util.List;

/**
 * Service for selecting the most frequent values of an array.
 */
public interface TopKService {

    /**
     * Select the {@code k} most frequent values.
     *
     * <p>Results are ordered by descending count; values with equal counts
     * keep the order of their first occurrence. A {@code k} larger than the
     * number of distinct values returns all of them.
     *
     * @param nums Input values
     * @param k Number of values to return
     * @return Up to {@code k} values
     * @throws IllegalArgumentException If {@code k} is negative
     */
    List<Integer> topKFrequent(int[] nums, int k);

    /**
     * Get service name.
     */
    String getServiceName();
}
