package com.hashkit.core;

/**
 * A run of consecutive integers {@code start, start + 1, ..., start + length - 1}.
 */
public class ConsecutiveRun {

    public static final ConsecutiveRun EMPTY = new ConsecutiveRun(0, 0);

    private final int start;
    private final int length;

    public ConsecutiveRun(int start, int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Run length must not be negative: " + length);
        }
        this.start = start;
        this.length = length;
    }

    public int getStart() {
        return start;
    }

    public int getLength() {
        return length;
    }

    /**
     * Last value of the run. Undefined for the empty run.
     */
    public int getEnd() {
        return (int) ((long) start + length - 1);
    }

    public boolean isEmpty() {
        return length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConsecutiveRun)) return false;
        ConsecutiveRun other = (ConsecutiveRun) o;
        return start == other.start && length == other.length;
    }

    @Override
    public int hashCode() {
        return 31 * start + length;
    }

    @Override
    public String toString() {
        if (isEmpty()) return "[]";
        return "[" + start + ".." + getEnd() + "]";
    }
}
