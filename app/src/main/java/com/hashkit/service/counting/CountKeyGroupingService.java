package com.hashkit.service.counting;

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
 * Anagram grouping keyed by a 26-slot character-count vector.
 * Accepts lowercase 'a' to 'z' only.
 */
public class CountKeyGroupingService implements GroupingService {

    private static final Logger logger = LoggerFactory.getLogger(CountKeyGroupingService.class);

    @Override
    public List<List<String>> group(List<String> strings) {
        Objects.requireNonNull(strings, "strings");

        Map<AnagramKey.CountKey, List<String>> groups = new LinkedHashMap<>();
        for (String s : strings) {
            groups.computeIfAbsent(AnagramKey.countKey(s), key -> new ArrayList<>()).add(s);
        }
        logger.debug("Grouped {} strings into {} groups", strings.size(), groups.size());
        return new ArrayList<>(groups.values());
    }

    @Override
    public String getServiceName() {
        return "Count-Key Grouping";
    }
}
