package com.github.rudygunawan.adaptivecache.metrics;

import com.github.rudygunawan.adaptivecache.api.AdaptiveCache;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.FunctionTimer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer integration for adaptive cache metrics.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics, each tagged with {@code cache=<name>}:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.puts - Total number of stored values
 *   <li>cache.removals - Total number of removed entries
 *   <li>cache.evictions - Entries removed because of capacity or expiry
 *   <li>cache.loads - Computations, tagged {@code result=success|failure}
 *   <li>cache.load.duration - Time spent in computations
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 *   <li>cache.memory.estimated - Estimated memory usage in bytes
 *   <li>cache.size.mb - Estimated memory usage in megabytes
 *   <li>cache.access.age.average - Mean time since the last access of each key
 *   <li>cache.tags - Number of tags in use
 *   <li>cache.cleanup.runs - Background cleanup passes
 *   <li>cache.cleanup.expired - Expired entries removed by cleanup passes
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * AdaptiveCache cache = CacheBuilder.newBuilder()
 *     .maximumSize(1000)
 *     .build();
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "userCache");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @return the cache (for chaining)
     * @throws IllegalArgumentException if the cache does not expose metrics
     */
    public static AdaptiveCache monitor(MeterRegistry registry, AdaptiveCache cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @return the cache (for chaining)
     * @throws IllegalArgumentException if the cache does not expose metrics
     */
    public static AdaptiveCache monitor(MeterRegistry registry, AdaptiveCache cache, String cacheName,
                                        Iterable<Tag> tags) {
        if (!(cache instanceof CacheMetrics)) {
            throw new IllegalArgumentException("cache does not expose metrics: " + cache.getClass().getName());
        }
        new MicrometerCacheMetrics((CacheMetrics) cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.puts", cache, CacheMetrics::setCount)
                .tags(allTags)
                .description("Total number of values stored in the cache")
                .register(registry);

        FunctionCounter.builder("cache.removals", cache, CacheMetrics::removeCount)
                .tags(allTags)
                .description("Total number of entries removed from the cache")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Entries removed because the cache was full or they expired")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadSuccessCount)
                .tags(allTags.and("result", "success"))
                .description("Number of successful computations")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadFailureCount)
                .tags(allTags.and("result", "failure"))
                .description("Number of failed computations")
                .register(registry);

        FunctionTimer.builder("cache.load.duration", cache,
                        c -> c.loadSuccessCount() + c.loadFailureCount(),
                        CacheMetrics::totalLoadTimeNanos,
                        TimeUnit.NANOSECONDS)
                .tags(allTags)
                .description("Time spent computing missing values")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, c -> {
                    long hits = c.hitCount();
                    long total = hits + c.missCount();
                    return total == 0 ? 0.0 : (double) hits / total;
                })
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);

        Gauge.builder("cache.memory.estimated", cache, CacheMetrics::estimatedMemoryUsageBytes)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Estimated memory usage of the cache")
                .register(registry);

        Gauge.builder("cache.size.mb", cache, CacheMetrics::cacheSizeMB)
                .tags(allTags)
                .baseUnit("megabytes")
                .description("Estimated memory usage in megabytes")
                .register(registry);

        Gauge.builder("cache.access.age.average", cache,
                        c -> c.averageAccessAgeNanos() / 1_000_000_000.0)
                .tags(allTags)
                .baseUnit("seconds")
                .description("Mean time since the last access of each key")
                .register(registry);

        Gauge.builder("cache.tags", cache, CacheMetrics::tagCount)
                .tags(allTags)
                .description("Number of tags in use")
                .register(registry);

        FunctionCounter.builder("cache.cleanup.runs", cache, CacheMetrics::cleanupRunCount)
                .tags(allTags)
                .description("Number of background cleanup passes")
                .register(registry);

        FunctionCounter.builder("cache.cleanup.expired", cache, CacheMetrics::cleanupExpiredCount)
                .tags(allTags)
                .description("Expired entries removed by cleanup passes")
                .register(registry);
    }
}
