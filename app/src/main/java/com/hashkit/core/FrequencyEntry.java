package com.hashkit.core;

/**
 * A value with its occurrence count and the position of its first occurrence.
 */
public class FrequencyEntry implements Comparable<FrequencyEntry> {
    private final int value;
    private final int count;
    private final int firstIndex;

    public FrequencyEntry(int value, int count, int firstIndex) {
        this.value = value;
        this.count = count;
        this.firstIndex = firstIndex;
    }

    public int getValue() {
        return value;
    }

    public int getCount() {
        return count;
    }

    public int getFirstIndex() {
        return firstIndex;
    }

    /**
     * Natural order ranks lower counts first; among equal counts the value
     * seen later ranks lower.
     */
    @Override
    public int compareTo(FrequencyEntry other) {
        int cmp = Integer.compare(this.count, other.count);
        if (cmp != 0) return cmp;
        // Tie-breaker: earlier first occurrence ranks higher
        return Integer.compare(other.firstIndex, this.firstIndex);
    }

    @Override
    public String toString() {
        return value + "x" + count;
    }
}
