package com.github.rudygunawan.adaptivecache.impl;

import com.github.rudygunawan.adaptivecache.model.CacheStats;
import com.github.rudygunawan.adaptivecache.time.FakeTicker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CacheStatisticsTest {

    private final FakeTicker ticker = new FakeTicker();

    @Test
    void testHitRateIsZeroWithoutRequests() {
        CacheStats stats = new CacheStatistics(ticker).snapshot(0, 0, -1);
        assertEquals(0.0, stats.hitRate());
        assertEquals(0.0, stats.missRate());
        assertEquals(Duration.ZERO, stats.averageAccessTime());
        assertTrue(stats.lastCleanupNanos().isEmpty());
    }

    @Test
    void testCountersAndRates() {
        CacheStatistics statistics = new CacheStatistics(ticker);
        statistics.recordSet("a");
        statistics.recordSet("b");
        statistics.recordHit("a");
        statistics.recordHit("a");
        statistics.recordHit("b");
        statistics.recordMiss("c");
        statistics.recordRemove("b");
        statistics.recordEviction();

        CacheStats stats = statistics.snapshot(1, 10, 42);
        assertEquals(3, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.75, stats.hitRate(), 1e-9);
        assertEquals(0.25, stats.missRate(), 1e-9);
        assertEquals(2, stats.setCount());
        assertEquals(1, stats.removeCount());
        assertEquals(0.5, stats.evictionRate(), 1e-9);
        assertEquals(2.0, stats.readWriteRatio(), 1e-9);
        assertEquals(42, stats.lastCleanupNanos().getAsLong());
    }

    @Test
    void testAverageAccessTimeOverTrackedKeys() {
        CacheStatistics statistics = new CacheStatistics(ticker);
        statistics.recordSet("a");
        ticker.advance(2, TimeUnit.SECONDS);
        statistics.recordSet("b");
        ticker.advance(2, TimeUnit.SECONDS);

        // a: 4s, b: 2s
        assertEquals(Duration.ofSeconds(3), statistics.averageAccessTime());

        statistics.recordRemove("a");
        assertEquals(Duration.ofSeconds(2), statistics.averageAccessTime());
        assertEquals(1, statistics.trackedKeyCount());
    }

    @Test
    void testHitOnRemovedEntryIsNotTracked() {
        CacheStatistics statistics = new CacheStatistics(ticker);
        statistics.recordSet("a");
        statistics.recordRemove("a");

        statistics.recordHit();

        assertEquals(1, statistics.hitCount());
        assertEquals(0, statistics.trackedKeyCount());
    }

    @Test
    void testRetainTracked() {
        CacheStatistics statistics = new CacheStatistics(ticker);
        statistics.recordSet("a");
        statistics.recordSet("b");
        statistics.recordHit("c");

        assertEquals(2, statistics.retainTracked(Set.of("a")));
        assertEquals(1, statistics.trackedKeyCount());
    }

    @Test
    void testLoadPenalty() {
        CacheStatistics statistics = new CacheStatistics(ticker);
        statistics.recordLoadSuccess(100);
        statistics.recordLoadFailure(300);

        CacheStats stats = statistics.snapshot(0, 0, -1);
        assertEquals(1, stats.loadSuccessCount());
        assertEquals(1, stats.loadFailureCount());
        assertEquals(200.0, stats.averageLoadPenalty(), 1e-9);
    }

    @Test
    void testReset() {
        CacheStatistics statistics = new CacheStatistics(ticker);
        statistics.recordSet("a");
        statistics.recordHit("a");
        statistics.recordMiss("b");

        statistics.reset();

        assertEquals(new CacheStatistics(ticker).snapshot(0, 0, -1), statistics.snapshot(0, 0, -1));
        assertEquals(0, statistics.trackedKeyCount());
    }
}
