package com.github.rudygunawan.adaptivecache.policy;

import com.github.rudygunawan.adaptivecache.model.CacheEntry;

import java.util.Comparator;

/**
 * Eviction policy for determining which entries to remove when the cache exceeds its maximum
 * size. Each policy ranks entries so that the first entry in ranking order is evicted first.
 *
 * <p>Available policies:
 * <ul>
 *   <li>{@link #ADAPTIVE} - lowest adaptive score first (default)
 *   <li>{@link #LRU} - Least Recently Used
 *   <li>{@link #LFU} - Least Frequently Used
 *   <li>{@link #TTL} - soonest expiration first
 * </ul>
 *
 * <p>Every ranking breaks ties by the oldest {@link CacheEntry#getLastAccessed() last access}.
 */
public enum EvictionPolicy {
    /**
     * Evicts the entry with the lowest {@link CacheEntry#calculateAdaptiveScore() adaptive score},
     * which combines priority, access frequency, freshness and size.
     */
    ADAPTIVE(Comparator.comparingDouble(CacheEntry::calculateAdaptiveScore)),

    /**
     * Least Recently Used (LRU) - evicts entries that haven't been accessed recently.
     */
    LRU(Comparator.comparingLong(CacheEntry::getLastAccessed)),

    /**
     * Least Frequently Used (LFU) - evicts entries with the lowest access count.
     */
    LFU(Comparator.comparingInt(CacheEntry::getFrequency)),

    /**
     * Evicts the entry closest to expiring. Entries without an expiration are ranked last.
     */
    TTL(Comparator.comparingLong(CacheEntry::getExpiresAt));

    private final Comparator<CacheEntry> ranking;

    EvictionPolicy(Comparator<CacheEntry> primary) {
        this.ranking = primary.thenComparingLong(CacheEntry::getLastAccessed);
    }

    /**
     * Returns the comparator ordering entries from the first to the last eviction candidate.
     */
    public Comparator<CacheEntry> ranking() {
        return ranking;
    }
}
