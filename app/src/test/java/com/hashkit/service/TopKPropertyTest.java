package com.hashkit.service;

import com.hashkit.service.counting.BucketTopKService;
import com.hashkit.service.counting.HashFrequencyService;
import com.hashkit.service.sorting.HeapTopKService;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based tests for top-K selection using jqwik.
 */
class TopKPropertyTest {

    private final TopKService bucket = new BucketTopKService();
    private final TopKService heap = new HeapTopKService();
    private final FrequencyService frequencies = new HashFrequencyService();

    @Property
    void strategiesAgree(
            @ForAll @Size(max = 80) List<@IntRange(min = -10, max = 10) Integer> values,
            @ForAll @IntRange(min = 0, max = 25) int k) {
        int[] nums = toArray(values);
        assertEquals(bucket.topKFrequent(nums, k), heap.topKFrequent(nums, k));
    }

    @Property
    void selectsValuesWithHighestCounts(
            @ForAll @Size(min = 1, max = 80) List<@IntRange(min = -10, max = 10) Integer> values,
            @ForAll @IntRange(min = 1, max = 25) int k) {
        int[] nums = toArray(values);
        Map<Integer, Integer> counts = frequencies.computeFrequencies(nums);

        List<Integer> result = bucket.topKFrequent(nums, k);

        assertEquals(Math.min(k, counts.size()), result.size());
        assertEquals(result.size(), new HashSet<>(result).size(), "No value repeated");

        int weakestSelected = result.stream().mapToInt(counts::get).min().orElse(0);
        for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
            if (!result.contains(e.getKey())) {
                assertTrue(e.getValue() <= weakestSelected,
                    "Unselected value " + e.getKey() + " is more frequent than a selected one");
            }
        }
    }

    @Property(maxDiscardRatio = 100)
    void uniqueAnswerIsPermutationInvariant(
            @ForAll @Size(min = 1, max = 80) List<@IntRange(min = -10, max = 10) Integer> values,
            @ForAll @IntRange(min = 1, max = 25) int k,
            @ForAll long seed) {
        int[] nums = toArray(values);
        List<Integer> sortedCounts = new ArrayList<>(frequencies.computeFrequencies(nums).values());
        sortedCounts.sort(Collections.reverseOrder());

        // Only unique answers are order independent
        Assume.that(k >= sortedCounts.size() || sortedCounts.get(k - 1) > sortedCounts.get(k));

        List<Integer> shuffled = new ArrayList<>(values);
        Collections.shuffle(shuffled, new Random(seed));

        assertEquals(new HashSet<>(bucket.topKFrequent(nums, k)),
            new HashSet<>(heap.topKFrequent(toArray(shuffled), k)));
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
