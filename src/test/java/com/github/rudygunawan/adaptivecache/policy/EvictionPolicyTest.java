package com.github.rudygunawan.adaptivecache.policy;

import com.github.rudygunawan.adaptivecache.model.CacheEntry;
import com.github.rudygunawan.adaptivecache.time.FakeTicker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EvictionPolicyTest {

    private final FakeTicker ticker = new FakeTicker();

    @Test
    void testAdaptiveRanksLowestScoreFirst() {
        CacheEntry important = new CacheEntry("a", 8, null, 80, ticker);
        CacheEntry plain = new CacheEntry("b", 8, null, 0, ticker);

        List<CacheEntry> entries = new ArrayList<>(List.of(important, plain));
        entries.sort(EvictionPolicy.ADAPTIVE.ranking());

        assertSame(plain, entries.get(0));
    }

    @Test
    void testLruRanksOldestAccessFirst() {
        CacheEntry first = new CacheEntry("a", 8, null, 0, ticker);
        ticker.advance(1, TimeUnit.SECONDS);
        CacheEntry second = new CacheEntry("b", 8, null, 0, ticker);
        ticker.advance(1, TimeUnit.SECONDS);
        first.updateAccess();

        assertTrue(EvictionPolicy.LRU.ranking().compare(second, first) < 0);
    }

    @Test
    void testLfuRanksLeastFrequentFirst() {
        CacheEntry popular = new CacheEntry("a", 8, null, 0, ticker);
        popular.incrementFrequency();
        popular.incrementFrequency();
        CacheEntry rare = new CacheEntry("b", 8, null, 0, ticker);

        assertTrue(EvictionPolicy.LFU.ranking().compare(rare, popular) < 0);
    }

    @Test
    void testTtlRanksSoonestExpiryFirstAndEternalLast() {
        CacheEntry soon = new CacheEntry("a", 8, Duration.ofSeconds(5), 0, ticker);
        CacheEntry later = new CacheEntry("b", 8, Duration.ofMinutes(5), 0, ticker);
        CacheEntry never = new CacheEntry("c", 8, null, 0, ticker);

        List<CacheEntry> entries = new ArrayList<>(List.of(never, later, soon));
        entries.sort(EvictionPolicy.TTL.ranking());

        assertEquals(List.of(soon, later, never), entries);
    }

    @Test
    void testTiesBrokenByLastAccess() {
        CacheEntry older = new CacheEntry("a", 8, null, 0, ticker);
        ticker.advance(10, TimeUnit.MILLISECONDS);
        CacheEntry newer = new CacheEntry("b", 8, null, 0, ticker);

        // same age bucket, priority, frequency and size
        assertEquals(older.calculateAdaptiveScore(), newer.calculateAdaptiveScore(), 1e-9);
        assertTrue(EvictionPolicy.ADAPTIVE.ranking().compare(older, newer) < 0);
    }
}
