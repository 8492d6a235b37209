package com.hashkit.service.counting;

import com.hashkit.core.FrequencyEntry;
import com.hashkit.service.FrequencyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hash-map based frequency tally preserving first-occurrence order.
 */
public class HashFrequencyService implements FrequencyService {

    private static final Logger logger = LoggerFactory.getLogger(HashFrequencyService.class);

    @Override
    public Map<Integer, Integer> computeFrequencies(int[] values) {
        Objects.requireNonNull(values, "values");

        Map<Integer, Integer> frequencies = new LinkedHashMap<>();
        for (int value : values) {
            frequencies.merge(value, 1, Integer::sum);
        }
        logger.debug("Tallied {} values into {} distinct", values.length, frequencies.size());
        return frequencies;
    }

    @Override
    public List<FrequencyEntry> computeEntries(int[] values) {
        Objects.requireNonNull(values, "values");

        // value -> {count, firstIndex}
        Map<Integer, int[]> tally = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            int index = i;
            tally.computeIfAbsent(values[i], v -> new int[]{0, index})[0]++;
        }

        List<FrequencyEntry> entries = new ArrayList<>(tally.size());
        for (Map.Entry<Integer, int[]> e : tally.entrySet()) {
            entries.add(new FrequencyEntry(e.getKey(), e.getValue()[0], e.getValue()[1]));
        }
        logger.debug("Built {} frequency entries from {} values", entries.size(), values.length);
        return entries;
    }

    @Override
    public String getServiceName() {
        return "Hash Frequency";
    }
}
