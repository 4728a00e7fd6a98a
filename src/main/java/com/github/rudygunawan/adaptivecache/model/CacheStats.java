package com.github.rudygunawan.adaptivecache.model;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Statistics about the performance of an adaptive cache. Instances of this class are immutable.
 *
 * <p>Counters are incremented according to the following rules:
 * <ul>
 *   <li>A lookup that finds a live entry increments {@code hitCount}.
 *   <li>A lookup that finds nothing, or finds an expired entry, increments {@code missCount}.
 *   <li>Every stored value increments {@code setCount}.
 *   <li>Every removed entry, whatever the reason, increments {@code removeCount}; removals
 *       caused by capacity or expiry also increment {@code evictionCount}.
 *   <li>A {@code getOrCompute} computation increments {@code loadSuccessCount} or
 *       {@code loadFailureCount}.
 * </ul>
 */
public final class CacheStats {
    private final long totalEntries;
    private final long totalSizeBytes;
    private final long hitCount;
    private final long missCount;
    private final long setCount;
    private final long removeCount;
    private final long evictionCount;
    private final long loadSuccessCount;
    private final long loadFailureCount;
    private final long totalLoadTimeNanos;
    private final Duration averageAccessTime;
    private final long lastCleanupNanos;

    /**
     * Constructs a new {@code CacheStats} instance.
     *
     * @param lastCleanupNanos ticker time of the last cleanup pass, or a negative value if no
     *                         cleanup has run
     */
    public CacheStats(
            long totalEntries,
            long totalSizeBytes,
            long hitCount,
            long missCount,
            long setCount,
            long removeCount,
            long evictionCount,
            long loadSuccessCount,
            long loadFailureCount,
            long totalLoadTimeNanos,
            Duration averageAccessTime,
            long lastCleanupNanos) {
        this.totalEntries = totalEntries;
        this.totalSizeBytes = totalSizeBytes;
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.setCount = setCount;
        this.removeCount = removeCount;
        this.evictionCount = evictionCount;
        this.loadSuccessCount = loadSuccessCount;
        this.loadFailureCount = loadFailureCount;
        this.totalLoadTimeNanos = totalLoadTimeNanos;
        this.averageAccessTime = Objects.requireNonNull(averageAccessTime, "averageAccessTime cannot be null");
        this.lastCleanupNanos = lastCleanupNanos;
    }

    /**
     * Returns the number of entries in the table when the snapshot was taken.
     */
    public long totalEntries() {
        return totalEntries;
    }

    /**
     * Returns the sum of the estimated sizes of all entries, in bytes.
     */
    public long totalSizeBytes() {
        return totalSizeBytes;
    }

    public long hitCount() {
        return hitCount;
    }

    public long missCount() {
        return missCount;
    }

    public long setCount() {
        return setCount;
    }

    public long removeCount() {
        return removeCount;
    }

    public long evictionCount() {
        return evictionCount;
    }

    /**
     * Returns {@code hitCount + missCount}.
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * Returns the ratio of lookups which were hits, or {@code 0.0} when there were no lookups.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) hitCount / requestCount;
    }

    /**
     * Returns the ratio of lookups which were misses, or {@code 0.0} when there were no lookups.
     */
    public double missRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
    }

    /**
     * Returns the share of stored values that were later evicted, or {@code 0.0} without sets.
     */
    public double evictionRate() {
        return (setCount == 0) ? 0.0 : (double) evictionCount / setCount;
    }

    /**
     * Returns how many lookups were served per stored value, or {@code 0.0} without sets.
     */
    public double readWriteRatio() {
        return (setCount == 0) ? 0.0 : (double) requestCount() / setCount;
    }

    public long loadSuccessCount() {
        return loadSuccessCount;
    }

    public long loadFailureCount() {
        return loadFailureCount;
    }

    public long totalLoadTimeNanos() {
        return totalLoadTimeNanos;
    }

    /**
     * Returns the average time spent computing values, in nanoseconds.
     */
    public double averageLoadPenalty() {
        long totalLoadCount = loadSuccessCount + loadFailureCount;
        return (totalLoadCount == 0) ? 0.0 : (double) totalLoadTimeNanos / totalLoadCount;
    }

    /**
     * Returns the mean time elapsed since the last access of every tracked key.
     */
    public Duration averageAccessTime() {
        return averageAccessTime;
    }

    /**
     * Returns the ticker time of the last cleanup pass, if any has run.
     */
    public OptionalLong lastCleanupNanos() {
        return lastCleanupNanos < 0 ? OptionalLong.empty() : OptionalLong.of(lastCleanupNanos);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalEntries, totalSizeBytes, hitCount, missCount, setCount, removeCount,
                evictionCount, loadSuccessCount, loadFailureCount, totalLoadTimeNanos,
                averageAccessTime, lastCleanupNanos);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return totalEntries == other.totalEntries
                && totalSizeBytes == other.totalSizeBytes
                && hitCount == other.hitCount
                && missCount == other.missCount
                && setCount == other.setCount
                && removeCount == other.removeCount
                && evictionCount == other.evictionCount
                && loadSuccessCount == other.loadSuccessCount
                && loadFailureCount == other.loadFailureCount
                && totalLoadTimeNanos == other.totalLoadTimeNanos
                && averageAccessTime.equals(other.averageAccessTime)
                && lastCleanupNanos == other.lastCleanupNanos;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "totalEntries=" + totalEntries
                + ", totalSizeBytes=" + totalSizeBytes
                + ", hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", setCount=" + setCount
                + ", removeCount=" + removeCount
                + ", evictionCount=" + evictionCount
                + ", averageAccessTime=" + averageAccessTime.toMillis() + "ms"
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}
