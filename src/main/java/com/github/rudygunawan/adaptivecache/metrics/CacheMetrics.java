package com.github.rudygunawan.adaptivecache.metrics;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by MicrometerCacheMetrics to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries in the cache.
     */
    long size();

    long hitCount();

    long missCount();

    /**
     * Returns the total number of stored values.
     */
    long setCount();

    /**
     * Returns the total number of removed entries, evictions included.
     */
    long removeCount();

    /**
     * Returns the number of entries removed because the cache was full or they expired.
     */
    long evictionCount();

    long loadSuccessCount();

    long loadFailureCount();

    /**
     * Returns the total time spent in {@code getOrCompute} computations, in nanoseconds.
     */
    long totalLoadTimeNanos();

    /**
     * Returns the sum of the estimated sizes of all entries, in bytes.
     */
    long estimatedMemoryUsageBytes();

    /**
     * Returns the mean time since the last access of the tracked keys, in nanoseconds.
     */
    long averageAccessAgeNanos();

    /**
     * Returns the number of tags that have at least one key.
     */
    long tagCount();

    /**
     * Returns the number of background cleanup passes run so far.
     */
    long cleanupRunCount();

    /**
     * Returns the number of expired entries removed by cleanup passes.
     */
    long cleanupExpiredCount();

    /**
     * Returns the cache size in megabytes.
     * This is a convenience method that converts estimatedMemoryUsageBytes to MB.
     */
    default double cacheSizeMB() {
        return estimatedMemoryUsageBytes() / (1024.0 * 1024.0);
    }
}
