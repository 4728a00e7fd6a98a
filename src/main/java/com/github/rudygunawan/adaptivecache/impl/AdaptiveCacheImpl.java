package com.github.rudygunawan.adaptivecache.impl;

import com.github.rudygunawan.adaptivecache.api.AdaptiveCache;
import com.github.rudygunawan.adaptivecache.api.MaintainableCache;
import com.github.rudygunawan.adaptivecache.api.Optimizable;
import com.github.rudygunawan.adaptivecache.builder.CacheBuilder;
import com.github.rudygunawan.adaptivecache.metrics.CacheMetrics;
import com.github.rudygunawan.adaptivecache.model.CacheStats;
import com.github.rudygunawan.adaptivecache.model.CleanupReport;
import com.github.rudygunawan.adaptivecache.model.CleanupResult;
import com.github.rudygunawan.adaptivecache.model.CleanupStats;
import com.github.rudygunawan.adaptivecache.time.Ticker;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adaptive cache coordinating the operations service, the tag index, the statistics and the
 * cleanup service of one cache instance.
 *
 * <p>Logging: This class uses java.util.logging. See {@link #LOGGER} for the logger name.
 */
public class AdaptiveCacheImpl implements AdaptiveCache, MaintainableCache, Optimizable, CacheMetrics {
    /**
     * Logger for cache operations. Logger name: "com.github.rudygunawan.adaptivecache.Cache"
     *
     * <p>Log levels used:
     * <ul>
     *   <li>WARNING: Errors in listeners, the persistent store or timers (operations continue)</li>
     *   <li>FINE: Evictions, optimizations, failed computations</li>
     *   <li>FINER: Entry-level operations</li>
     * </ul>
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptivecache.Cache");

    private static final double OPTIMIZE_TARGET_RATIO = 0.9;

    private final String name;
    private final long maximumSize;
    private final CacheState state;
    private final CacheStatistics statistics;
    private final CacheOperations operations;
    private final CacheCleanupService cleanupService;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    public AdaptiveCacheImpl(CacheBuilder builder) {
        this.name = builder.getName();
        this.maximumSize = builder.getMaximumSize();
        Ticker ticker = builder.getTicker();
        this.state = new CacheState();
        this.statistics = new CacheStatistics(ticker);

        if (builder.getScheduler() != null) {
            this.scheduler = builder.getScheduler();
            this.ownsScheduler = false;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, name + "-maintenance");
                t.setDaemon(true);
                return t;
            });
            this.ownsScheduler = true;
        }

        this.operations = new CacheOperations(state, statistics, builder, scheduler);
        this.cleanupService = new CacheCleanupService(List.of(this), builder.getCleanupInterval(), scheduler, ticker);
        if (builder.isBackgroundCleanupEnabled()) {
            cleanupService.startBackgroundCleanup();
        }
    }

    @Override
    public <T> T get(String key) {
        return operations.get(key);
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        Object value = operations.get(key);
        return type.cast(value);
    }

    @Override
    public <T> T peek(String key) {
        return operations.peek(key);
    }

    @Override
    public void set(String key, Object value) {
        operations.set(key, value, null, null);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        operations.set(key, value, ttl, null);
    }

    @Override
    public void set(String key, Object value, Duration ttl, int priority) {
        operations.set(key, value, ttl, priority);
    }

    @Override
    public void setWithTags(String key, Object value, Collection<String> tags) {
        operations.setWithTags(key, value, tags, null);
    }

    @Override
    public void setWithTags(String key, Object value, Collection<String> tags, Duration ttl) {
        operations.setWithTags(key, value, tags, ttl);
    }

    @Override
    public <T> T getOrCompute(String key, Callable<? extends T> compute) throws Exception {
        return operations.getOrCompute(key, compute);
    }

    @Override
    public <T> CompletableFuture<T> getOrComputeAsync(String key,
                                                      Supplier<? extends CompletionStage<? extends T>> compute) {
        return operations.getOrComputeAsync(key, compute);
    }

    @Override
    public boolean invalidate(String key) {
        return operations.invalidate(key);
    }

    @Override
    public int invalidateByTag(String tag) {
        return operations.invalidateByTag(tag);
    }

    @Override
    public int invalidatePattern(String pattern) {
        return operations.invalidatePattern(pattern);
    }

    @Override
    public void invalidateAll() {
        operations.invalidateAll();
    }

    @Override
    public List<String> getKeysByTag(String tag) {
        return operations.getKeysByTag(tag);
    }

    @Override
    public Set<String> getTags() {
        return operations.getTags();
    }

    @Override
    public long size() {
        return state.table.size();
    }

    @Override
    public Set<String> keys() {
        return operations.keys();
    }

    @Override
    public CacheStats getStats() {
        return statistics.snapshot(state.table.size(), operations.totalSizeBytes(), cleanupService.lastCleanupNanos());
    }

    @Override
    public void resetStats() {
        statistics.reset();
    }

    @Override
    public CleanupStats getCleanupStats() {
        return cleanupService.getCleanupStats();
    }

    @Override
    public CleanupReport getCleanupReport() {
        return cleanupService.getCleanupReport();
    }

    @Override
    public CleanupResult forceCleanup(boolean includeOptimization) {
        state.checkNotDisposed();
        return cleanupService.forceCleanup(includeOptimization);
    }

    @Override
    public void startBackgroundCleanup() {
        state.checkNotDisposed();
        cleanupService.startBackgroundCleanup();
    }

    @Override
    public void stopBackgroundCleanup() {
        cleanupService.stopBackgroundCleanup();
    }

    @Override
    public boolean isBackgroundCleanupRunning() {
        return cleanupService.isBackgroundCleanupRunning();
    }

    @Override
    public int persistToStorage() {
        return operations.persistToStorage();
    }

    @Override
    public int restoreFromStorage() {
        return operations.restoreFromStorage();
    }

    @Override
    public void dispose() {
        if (!state.markDisposed()) {
            return;
        }
        cleanupService.stopBackgroundCleanup();
        operations.clear();
        if (ownsScheduler) {
            scheduler.shutdown();
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Disposed cache: " + name);
        }
    }

    // MaintainableCache and Optimizable

    @Override
    public String name() {
        return name;
    }

    @Override
    public long expiredEntryCount() {
        return operations.expiredEntryCount();
    }

    @Override
    public double utilization() {
        long size = state.table.size();
        if (maximumSize == 0) {
            return size > 0 ? 1.0 : 0.0;
        }
        return Math.min(1.0, (double) size / maximumSize);
    }

    @Override
    public int removeExpiredEntries() {
        if (state.isDisposed()) {
            return 0;
        }
        return operations.removeExpiredEntries();
    }

    /**
     * Removes expired entries, trims the cache to 90% of its capacity when it is fuller than that,
     * and forgets access times of keys that are gone.
     */
    @Override
    public void optimize() {
        if (state.isDisposed()) {
            return;
        }
        int expired = operations.removeExpiredEntries();
        long target = (long) (maximumSize * OPTIMIZE_TARGET_RATIO);
        int trimmed = state.table.size() > target ? operations.trimTo(target) : 0;
        int forgotten = statistics.retainTracked(state.table.keySet());
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Optimized cache " + name + ": expired=" + expired + ", trimmed=" + trimmed
                    + ", staleAccessRecords=" + forgotten);
        }
    }

    // CacheMetrics interface implementation for Micrometer integration

    @Override
    public long hitCount() {
        return statistics.hitCount();
    }

    @Override
    public long missCount() {
        return statistics.missCount();
    }

    @Override
    public long setCount() {
        return statistics.setCount();
    }

    @Override
    public long removeCount() {
        return statistics.removeCount();
    }

    @Override
    public long evictionCount() {
        return statistics.evictionCount();
    }

    @Override
    public long loadSuccessCount() {
        return statistics.loadSuccessCount();
    }

    @Override
    public long loadFailureCount() {
        return statistics.loadFailureCount();
    }

    @Override
    public long totalLoadTimeNanos() {
        return statistics.totalLoadTimeNanos();
    }

    @Override
    public long estimatedMemoryUsageBytes() {
        return operations.totalSizeBytes();
    }

    @Override
    public long averageAccessAgeNanos() {
        return statistics.averageAccessTime().toNanos();
    }

    @Override
    public long tagCount() {
        return operations.tagCount();
    }

    @Override
    public long cleanupRunCount() {
        return cleanupService.backgroundRunCount();
    }

    @Override
    public long cleanupExpiredCount() {
        return cleanupService.totalExpiredRemoved();
    }

    @Override
    public String toString() {
        return "AdaptiveCache{name=" + name + ", size=" + size() + ", maximumSize=" + maximumSize + '}';
    }
}
