package com.github.rudygunawan.adaptivecache.impl;

import com.github.rudygunawan.adaptivecache.model.CacheStats;
import com.github.rudygunawan.adaptivecache.time.Ticker;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe accumulator of cache counters and per-key access times.
 */
final class CacheStatistics {
    private final Ticker ticker;

    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong setCount = new AtomicLong(0);
    private final AtomicLong removeCount = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);
    private final AtomicLong loadSuccessCount = new AtomicLong(0);
    private final AtomicLong loadFailureCount = new AtomicLong(0);
    private final AtomicLong totalLoadTime = new AtomicLong(0);

    // key -> ticker time of the last hit or set
    private final ConcurrentHashMap<String, Long> lastAccess = new ConcurrentHashMap<>();

    CacheStatistics(Ticker ticker) {
        this.ticker = ticker;
    }

    void recordHit(String key) {
        hitCount.incrementAndGet();
        lastAccess.put(key, ticker.read());
    }

    /**
     * Counts a hit on an entry removed while it was being read; its access is not tracked.
     */
    void recordHit() {
        hitCount.incrementAndGet();
    }

    void recordMiss(String key) {
        missCount.incrementAndGet();
    }

    void recordSet(String key) {
        setCount.incrementAndGet();
        lastAccess.put(key, ticker.read());
    }

    void recordRemove(String key) {
        removeCount.incrementAndGet();
        lastAccess.remove(key);
    }

    void recordEviction() {
        evictionCount.incrementAndGet();
    }

    void recordLoadSuccess(long loadTimeNanos) {
        loadSuccessCount.incrementAndGet();
        totalLoadTime.addAndGet(loadTimeNanos);
    }

    void recordLoadFailure(long loadTimeNanos) {
        loadFailureCount.incrementAndGet();
        totalLoadTime.addAndGet(loadTimeNanos);
    }

    long hitCount() {
        return hitCount.get();
    }

    long missCount() {
        return missCount.get();
    }

    long setCount() {
        return setCount.get();
    }

    long removeCount() {
        return removeCount.get();
    }

    long evictionCount() {
        return evictionCount.get();
    }

    long loadSuccessCount() {
        return loadSuccessCount.get();
    }

    long loadFailureCount() {
        return loadFailureCount.get();
    }

    long totalLoadTimeNanos() {
        return totalLoadTime.get();
    }

    int trackedKeyCount() {
        return lastAccess.size();
    }

    /**
     * Returns the mean time since the last access over all tracked keys, or zero when no key is
     * tracked.
     */
    Duration averageAccessTime() {
        long now = ticker.read();
        long total = 0;
        int count = 0;
        for (Long accessed : lastAccess.values()) {
            total += Math.max(0, now - accessed);
            count++;
        }
        return count == 0 ? Duration.ZERO : Duration.ofNanos(total / count);
    }

    /**
     * Forgets the access times of keys not in {@code liveKeys}.
     *
     * @return the number of keys forgotten
     */
    int retainTracked(Set<String> liveKeys) {
        int before = lastAccess.size();
        lastAccess.keySet().retainAll(liveKeys);
        return Math.max(0, before - lastAccess.size());
    }

    CacheStats snapshot(long totalEntries, long totalSizeBytes, long lastCleanupNanos) {
        return new CacheStats(
                totalEntries,
                totalSizeBytes,
                hitCount.get(),
                missCount.get(),
                setCount.get(),
                removeCount.get(),
                evictionCount.get(),
                loadSuccessCount.get(),
                loadFailureCount.get(),
                totalLoadTime.get(),
                averageAccessTime(),
                lastCleanupNanos);
    }

    void reset() {
        hitCount.set(0);
        missCount.set(0);
        setCount.set(0);
        removeCount.set(0);
        evictionCount.set(0);
        loadSuccessCount.set(0);
        loadFailureCount.set(0);
        totalLoadTime.set(0);
        lastAccess.clear();
    }
}
