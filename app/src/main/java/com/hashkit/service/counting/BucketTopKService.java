package com.hashkit.service.counting;

import com.hashkit.core.FrequencyEntry;
import com.hashkit.service.FrequencyService;
import com.hashkit.service.TopKService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Top-K selection by bucket sort over counts.
 * Counts lie in [0, n], so buckets indexed by count avoid a general sort.
 */
public class BucketTopKService implements TopKService {

    private static final Logger logger = LoggerFactory.getLogger(BucketTopKService.class);

    private final FrequencyService frequencyService;

    public BucketTopKService() {
        this(new HashFrequencyService());
    }

    public BucketTopKService(FrequencyService frequencyService) {
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

        // Entries arrive in first-occurrence order, so each bucket is too
        List<List<Integer>> buckets = new ArrayList<>(nums.length + 1);
        for (int i = 0; i <= nums.length; i++) {
            buckets.add(null);
        }
        for (FrequencyEntry entry : entries) {
            List<Integer> bucket = buckets.get(entry.getCount());
            if (bucket == null) {
                bucket = new ArrayList<>();
                buckets.set(entry.getCount(), bucket);
            }
            bucket.add(entry.getValue());
        }

        int limit = Math.min(k, entries.size());
        List<Integer> result = new ArrayList<>(limit);
        for (int count = nums.length; count > 0 && result.size() < limit; count--) {
            List<Integer> bucket = buckets.get(count);
            if (bucket == null) continue;

            for (int value : bucket) {
                result.add(value);
                if (result.size() == limit) break;
            }
        }

        logger.debug("Top {} of {} distinct values: {}", k, entries.size(), result);
        return result;
    }

    @Override
    public String getServiceName() {
        return "Bucket Top-K";
    }
}
