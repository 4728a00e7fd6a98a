package com.github.rudygunawan.adaptivecache.builder;

import com.github.rudygunawan.adaptivecache.api.AdaptiveCache;
import com.github.rudygunawan.adaptivecache.api.PersistentStore;
import com.github.rudygunawan.adaptivecache.impl.AdaptiveCacheImpl;
import com.github.rudygunawan.adaptivecache.listener.RemovalListener;
import com.github.rudygunawan.adaptivecache.model.CacheEntry;
import com.github.rudygunawan.adaptivecache.policy.EvictionPolicy;
import com.github.rudygunawan.adaptivecache.policy.SizeEstimator;
import com.github.rudygunawan.adaptivecache.time.Ticker;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * A builder of {@link AdaptiveCache} instances having any combination of the following features:
 *
 * <ul>
 *   <li>a maximum number of entries, enforced by evicting the entry with the lowest score
 *   <li>a default time-to-live for entries stored without one
 *   <li>periodic background removal of expired entries
 *   <li>optional timers removing each entry as soon as it expires
 *   <li>notification of removed entries
 *   <li>a persistent store consulted on misses
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * AdaptiveCache cache = CacheBuilder.newBuilder()
 *     .name("products")
 *     .maximumSize(2000)
 *     .defaultTtl(Duration.ofMinutes(10))
 *     .cleanupInterval(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public class CacheBuilder {
    private static final long DEFAULT_MAXIMUM_SIZE = 1000;
    private static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(1);
    private static final String DEFAULT_NAME = "adaptive-cache";

    private long maximumSize = DEFAULT_MAXIMUM_SIZE;
    private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
    private boolean backgroundCleanup = true;
    private Duration defaultTtl;
    private int maxEntrySizeMB = SizeEstimator.DEFAULT_MAX_SIZE_MB;
    private int defaultPriority = CacheEntry.MIN_PRIORITY;
    private EvictionPolicy evictionPolicy = EvictionPolicy.ADAPTIVE;
    private boolean eagerExpiration = false;
    private Ticker ticker = Ticker.systemTicker();
    private ScheduledExecutorService scheduler;
    private RemovalListener removalListener;
    private PersistentStore persistentStore;
    private String name = DEFAULT_NAME;

    private CacheBuilder() {
    }

    /**
     * Constructs a new {@code CacheBuilder} instance with default settings.
     */
    public static CacheBuilder newBuilder() {
        return new CacheBuilder();
    }

    /**
     * Specifies the maximum number of entries the cache may contain. When a {@code set} makes the
     * cache exceed this size, entries are evicted in the order of the configured
     * {@link EvictionPolicy}; the entry just written is never evicted by its own {@code set}.
     *
     * <p>When {@code size} is zero, entries are evicted immediately after being stored.
     *
     * <p>This option is not required; by default the cache holds up to 1000 entries.
     *
     * @param size the maximum size of the cache
     * @return this builder instance
     * @throws IllegalArgumentException if {@code size} is negative
     */
    public CacheBuilder maximumSize(long size) {
        if (size < 0) {
            throw new IllegalArgumentException("maximum size must not be negative");
        }
        this.maximumSize = size;
        return this;
    }

    /**
     * Sets the period of the background cleanup pass. Defaults to one minute.
     *
     * @throws IllegalArgumentException if {@code interval} is zero or negative
     */
    public CacheBuilder cleanupInterval(Duration interval) {
        if (interval == null) {
            throw new NullPointerException("cleanup interval cannot be null");
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("cleanup interval must be positive");
        }
        this.cleanupInterval = interval;
        return this;
    }

    /**
     * Controls whether background cleanup starts when the cache is built. It can still be started
     * and stopped later. Enabled by default.
     */
    public CacheBuilder enableBackgroundCleanup(boolean enabled) {
        this.backgroundCleanup = enabled;
        return this;
    }

    /**
     * Specifies the time-to-live of entries stored without an explicit one. By default such
     * entries never expire.
     *
     * @throws IllegalArgumentException if {@code ttl} is negative
     */
    public CacheBuilder defaultTtl(Duration ttl) {
        if (ttl == null) {
            throw new NullPointerException("default ttl cannot be null");
        }
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("default ttl must not be negative");
        }
        this.defaultTtl = ttl;
        return this;
    }

    /**
     * Sets the size budget used to reject oversized values. A value is rejected when its estimated
     * size exceeds 10% of this budget. Defaults to 10MB.
     *
     * @throws IllegalArgumentException if {@code megabytes} is not positive
     */
    public CacheBuilder maxEntrySizeMB(int megabytes) {
        if (megabytes <= 0) {
            throw new IllegalArgumentException("max entry size must be positive");
        }
        this.maxEntrySizeMB = megabytes;
        return this;
    }

    /**
     * Sets the priority of entries stored without an explicit one. Defaults to 0.
     *
     * @throws IllegalArgumentException if {@code priority} is outside [0, 100]
     */
    public CacheBuilder defaultPriority(int priority) {
        if (priority < CacheEntry.MIN_PRIORITY || priority > CacheEntry.MAX_PRIORITY) {
            throw new IllegalArgumentException("default priority must be between 0 and 100");
        }
        this.defaultPriority = priority;
        return this;
    }

    /**
     * Specifies the order in which entries are evicted when the cache is full. Defaults to
     * {@link EvictionPolicy#ADAPTIVE}.
     */
    public CacheBuilder evictionPolicy(EvictionPolicy policy) {
        if (policy == null) {
            throw new NullPointerException("eviction policy cannot be null");
        }
        this.evictionPolicy = policy;
        return this;
    }

    /**
     * When enabled, every entry with a time-to-live gets a timer that removes it as soon as it
     * expires. Otherwise expired entries are removed when read or by the background cleanup.
     * Disabled by default.
     */
    public CacheBuilder eagerExpiration(boolean enabled) {
        this.eagerExpiration = enabled;
        return this;
    }

    /**
     * Specifies a nanosecond-precision time source for this cache. By default,
     * {@link System#nanoTime} is used.
     *
     * <p>The primary intent of this method is to facilitate testing of caches with a fake
     * ticker.
     */
    public CacheBuilder ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Specifies the scheduler running background cleanup and expiration timers. A scheduler given
     * here is not shut down when the cache is disposed. By default each cache owns a
     * single-threaded daemon scheduler.
     */
    public CacheBuilder scheduler(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new NullPointerException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
        return this;
    }

    /**
     * Specifies a listener notified each time an entry is removed from the cache.
     */
    public CacheBuilder removalListener(RemovalListener listener) {
        if (listener == null) {
            throw new NullPointerException("removal listener cannot be null");
        }
        this.removalListener = listener;
        return this;
    }

    /**
     * Specifies a store consulted after misses and kept in step with invalidations.
     */
    public CacheBuilder persistentStore(PersistentStore store) {
        if (store == null) {
            throw new NullPointerException("persistent store cannot be null");
        }
        this.persistentStore = store;
        return this;
    }

    /**
     * Names the cache in logs, cleanup reports and scheduler threads.
     */
    public CacheBuilder name(String name) {
        if (name == null) {
            throw new NullPointerException("name cannot be null");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        return this;
    }

    /**
     * Builds a cache having the requested features.
     */
    public AdaptiveCache build() {
        return new AdaptiveCacheImpl(this);
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public boolean isBackgroundCleanupEnabled() {
        return backgroundCleanup;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public int getMaxEntrySizeMB() {
        return maxEntrySizeMB;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    public boolean isEagerExpiration() {
        return eagerExpiration;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public RemovalListener getRemovalListener() {
        return removalListener;
    }

    public PersistentStore getPersistentStore() {
        return persistentStore;
    }

    public String getName() {
        return name;
    }
}
