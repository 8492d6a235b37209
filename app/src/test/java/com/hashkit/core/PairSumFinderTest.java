package com.hashkit.core;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for pair-sum lookup.
 */
class PairSumFinderTest {

    @Test
    void testAdjacentPair() {
        assertArrayEquals(new int[]{0, 1}, PairSumFinder.findPair(new int[]{3, 4, 5, 6}, 7));
    }

    @Test
    void testNonAdjacentPair() {
        assertArrayEquals(new int[]{0, 2}, PairSumFinder.findPair(new int[]{4, 5, 6}, 10));
    }

    @Test
    void testEqualValues() {
        assertArrayEquals(new int[]{0, 1}, PairSumFinder.findPair(new int[]{5, 5}, 10));
    }

    @Test
    void testValueNotPairedWithItself() {
        // 5 + 5 == 10 but there is only one 5
        assertArrayEquals(new int[]{1, 2}, PairSumFinder.findPair(new int[]{5, 1, 9}, 10));
    }

    @Test
    void testNegativeValues() {
        assertArrayEquals(new int[]{1, 3}, PairSumFinder.findPair(new int[]{1, -3, 8, -5}, -8));
    }

    @Test
    void testNoPair() {
        assertEquals(0, PairSumFinder.findPair(new int[]{1, 2, 3}, 100).length);
        assertEquals(0, PairSumFinder.findPair(new int[0], 0).length);
    }

    @Test
    void testComplementOutsideIntRange() {
        int[] nums = {Integer.MAX_VALUE, -1, 1};
        assertArrayEquals(new int[]{1, 2}, PairSumFinder.findPair(nums, 0));
        assertArrayEquals(new int[]{0, 1}, PairSumFinder.findPair(nums, Integer.MAX_VALUE - 1));
    }
}
