package com.github.rudygunawan.adaptivecache.policy;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SizeEstimatorTest {

    @Test
    void testScalarSizes() {
        assertEquals(0, SizeEstimator.estimateSize(null));
        assertEquals(1, SizeEstimator.estimateSize(true));
        assertEquals(8, SizeEstimator.estimateSize(42));
        assertEquals(8, SizeEstimator.estimateSize(3.14d));
        assertEquals(8, SizeEstimator.estimateSize('x'));
        assertEquals(10, SizeEstimator.estimateSize("hello"));
        assertEquals(0, SizeEstimator.estimateSize(""));
        assertEquals(100, SizeEstimator.estimateSize(new Object()));
    }

    @Test
    void testContainersAreSizedRecursively() {
        assertEquals(24 + 2 + 4, SizeEstimator.estimateSize(List.of("a", "bb")));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", 7);
        map.put("tags", Arrays.asList("x", null));
        // 24 + ("id" 4 + 8) + ("tags" 8 + (24 + 2 + 0))
        assertEquals(24 + 12 + 8 + 26, SizeEstimator.estimateSize(map));

        assertEquals(24 + 8 * 3, SizeEstimator.estimateSize(new int[] {1, 2, 3}));
        assertEquals(24, SizeEstimator.estimateSize(new String[0]));
    }

    @Test
    void testSelfReferencingContainerTerminates() {
        List<Object> list = new ArrayList<>();
        list.add("ab");
        list.add(list);
        assertEquals(24 + 4, SizeEstimator.estimateSize(list));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("me", map);
        assertEquals(24 + 4, SizeEstimator.estimateSize(map));

        // a shared element is counted once
        List<String> shared = List.of("a");
        assertEquals(24 + (24 + 2), SizeEstimator.estimateSize(List.of(shared, shared)));
    }

    @Test
    void testReasonableSize() {
        assertFalse(SizeEstimator.isReasonableSize(0));
        assertFalse(SizeEstimator.isReasonableSize(-1));
        assertTrue(SizeEstimator.isReasonableSize(1024));
        assertTrue(SizeEstimator.isReasonableSize(1024 * 1024));
        assertFalse(SizeEstimator.isReasonableSize(1024 * 1024 + 1));
        assertFalse(SizeEstimator.isReasonableSize(20L * 1024 * 1024));

        assertTrue(SizeEstimator.isReasonableSize(100 * 1024, 1));
        assertFalse(SizeEstimator.isReasonableSize(110 * 1024, 1));
    }

    @Test
    void testFormatSize() {
        assertEquals("500B", SizeEstimator.formatSize(500));
        assertEquals("1.0KB", SizeEstimator.formatSize(1024));
        assertEquals("1.5MB", SizeEstimator.formatSize(1536L * 1024));
        assertEquals("2.0GB", SizeEstimator.formatSize(2L * 1024 * 1024 * 1024));
    }
}
