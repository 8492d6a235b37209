package com.hashkit.service.sorting;

import com.hashkit.core.FrequencyEntry;
import com.hashkit.service.FrequencyService;
import com.hashkit.service.TopKService;
import com.hashkit.service.counting.HashFrequencyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Top-K selection with a min-heap bounded to {@code k} entries.
 */
public class HeapTopKService implements TopKService {

    private static final Logger logger = LoggerFactory.getLogger(HeapTopKService.class);

    private final FrequencyService frequencyService;

    public HeapTopKService() {
        this(new HashFrequencyService());
    }

    public HeapTopKService(FrequencyService frequencyService) {
        this.frequencyService = frequencyService;
    }

    @Override
    public List<Integer> topKFrequent(int[] nums, int k) {
        Objects.requireNonNull(nums, "nums");
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        if (k == 0 || nums.length == 0) {
            return Collections.emptyList();
        }

        List<FrequencyEntry> entries = frequencyService.computeEntries(nums);

        // Head is the weakest entry kept so far
        PriorityQueue<FrequencyEntry> heap = new PriorityQueue<>(Math.min(k, entries.size()) + 1);
        for (FrequencyEntry entry : entries) {
            heap.offer(entry);
            if (heap.size() > k) {
                heap.poll();
            }
        }

        List<Integer> result = new ArrayList<>(heap.size());
        while (!heap.isEmpty()) {
            result.add(heap.poll().getValue());
        }
        Collections.reverse(result);

        logger.debug("Top {} of {} distinct values: {}", k, entries.size(), result);
        return result;
    }

    @Override
    public String getServiceName() {
        return "Heap Top-K";
    }
}
