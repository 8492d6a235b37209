package com.hashkit.service;

import java.util.List;

/**
 * Service for grouping strings that are anagrams of each other.
 */
public interface GroupingService {

    /**
     * Group strings sharing a canonical signature.
     *
     * <p>Groups are ordered by their first member's position in the input and
     * members keep their input order. The empty string forms its own group.
     *
     * @param strings Input strings
     * @return Groups of anagrams
     */
    List<List<String>> group(List<String> strings);

    /**
     * Get service name.
     */
    String getServiceName();
}
