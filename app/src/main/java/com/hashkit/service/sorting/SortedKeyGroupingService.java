package com.hashkit.service.sorting;

import com.hashkit.core.AnagramKey;
import com.hashkit.service.GroupingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Anagram grouping keyed by the string's sorted characters.
 */
public class SortedKeyGroupingService implements GroupingService {

    private static final Logger logger = LoggerFactory.getLogger(SortedKeyGroupingService.class);

    @Override
    public List<List<String>> group(List<String> strings) {
        Objects.requireNonNull(strings, "strings");

        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String s : strings) {
            groups.computeIfAbsent(AnagramKey.sortedKey(s), key -> new ArrayList<>()).add(s);
        }
        logger.debug("Grouped {} strings into {} groups", strings.size(), groups.size());
        return new ArrayList<>(groups.values());
    }

    @Override
    public String getServiceName() {
        return "Sorted-Key Grouping";
    }
}
