package com.hashkit.service;

import com.hashkit.core.FrequencyEntry;

import java.util.List;
import java.util.Map;

/**
 * Service for tallying value occurrences.
 */
public interface FrequencyService {

    /**
     * Count occurrences of each distinct value.
     *
     * @param values Input values
     * @return Value to count, iterating in order of first occurrence
     */
    Map<Integer, Integer> computeFrequencies(int[] values);

    /**
     * Count occurrences and record where each value first appears.
     *
     * @param values Input values
     * @return One entry per distinct value, in order of first occurrence
     */
    List<FrequencyEntry> computeEntries(int[] values);

    /**
     * Get service name.
     */
    String getServiceName();
}
