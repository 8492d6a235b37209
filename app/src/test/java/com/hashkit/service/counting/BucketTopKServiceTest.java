package com.hashkit.service.counting;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

/**
 * Unit tests for bucket-sort top-K selection.
 */
class BucketTopKServiceTest {

    private BucketTopKService service;

    @BeforeEach
    void setUp() {
        service = new BucketTopKService();
    }

    @Test
    void testServiceName() {
        assertEquals("Bucket Top-K", service.getServiceName());
    }

    @Test
    void testTopTwo() {
        List<Integer> result = service.topKFrequent(new int[]{1, 2, 2, 3, 3, 3}, 2);

        assertEquals(List.of(3, 2), result);
        assertEquals(Set.of(2, 3), Set.copyOf(result));
    }

    @Test
    void testSingleValue() {
        assertEquals(List.of(7), service.topKFrequent(new int[]{7, 7}, 1));
    }

    @Test
    void testKEqualsDistinctCount() {
        assertEquals(List.of(4, 1, 2), service.topKFrequent(new int[]{1, 4, 2, 4}, 3));
    }

    @Test
    void testKLargerThanDistinctCount() {
        assertEquals(List.of(1, 2), service.topKFrequent(new int[]{1, 2}, 10));
    }

    @Test
    void testTiesKeepFirstOccurrence() {
        assertEquals(List.of(8, 6), service.topKFrequent(new int[]{8, 6, 9, 6, 8, 9}, 2));
    }

    @Test
    void testZeroKAndEmptyInput() {
        assertTrue(service.topKFrequent(new int[]{1, 2, 3}, 0).isEmpty());
        assertTrue(service.topKFrequent(new int[0], 3).isEmpty());
    }

    @Test
    void testNegativeKRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.topKFrequent(new int[]{1}, -1));
    }
}
