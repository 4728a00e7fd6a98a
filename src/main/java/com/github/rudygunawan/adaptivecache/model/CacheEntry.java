package com.github.rudygunawan.adaptivecache.model;

import com.github.rudygunawan.adaptivecache.time.Ticker;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A cache entry that wraps a value with the metadata used for expiration and adaptive eviction.
 *
 * <p>All timestamps are {@link Ticker} readings in nanoseconds. An entry without a TTL reports
 * {@link #NEVER_EXPIRES} as its expiration time.
 *
 * <p><b>Adaptive score:</b>
 * <pre>
 * score = priority * 2.0 + frequency * 1.5 + freshness * 1.0 - sizePenalty * 0.1
 * freshness   = 100 / (ageInSeconds + 1)
 * sizePenalty = min(sizeBytes / 1024, 100)
 * </pre>
 * A higher priority, a higher frequency, a younger entry and a smaller entry each raise the
 * score. The size penalty is capped at 100KB so that very large values don't dominate.
 */
public final class CacheEntry {
    public static final long NEVER_EXPIRES = Long.MAX_VALUE;
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 100;

    static final double PRIORITY_WEIGHT = 2.0;
    static final double FREQUENCY_WEIGHT = 1.5;
    static final double FRESHNESS_WEIGHT = 1.0;
    static final double SIZE_WEIGHT = 0.1;
    private static final double MAX_SIZE_PENALTY = 100.0;

    private final Object value;
    private final long sizeBytes;
    private final int priority;
    private final long createdAt;
    private final long expiresAt;
    private final AtomicInteger frequency;
    private final AtomicLong lastAccessed;
    private final Ticker ticker;

    /**
     * Creates a new entry with a frequency of one.
     *
     * @param value the value to cache
     * @param sizeBytes the estimated size of the value
     * @param ttl the time-to-live, or {@code null} for no expiration
     * @param priority the eviction priority, clamped to [0, 100]
     * @param ticker the time source
     */
    public CacheEntry(Object value, long sizeBytes, Duration ttl, int priority, Ticker ticker) {
        this(value, sizeBytes, priority, 1, ticker.read(), ttl, ticker);
    }

    private CacheEntry(Object value, long sizeBytes, int priority, int frequency,
                       long createdAt, Duration ttl, Ticker ticker) {
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("size must not be negative");
        }
        this.value = Objects.requireNonNull(value, "value cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.sizeBytes = sizeBytes;
        this.priority = clampPriority(priority);
        this.createdAt = createdAt;
        long now = ticker.read();
        this.expiresAt = expirationTime(now, ttl);
        this.frequency = new AtomicInteger(Math.max(1, frequency));
        this.lastAccessed = new AtomicLong(now);
    }

    /**
     * Returns the cached value.
     *
     * <p>The cast is unchecked: reading a value as the wrong type is a caller error and fails
     * with a {@link ClassCastException} at the call site.
     */
    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) value;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public int getPriority() {
        return priority;
    }

    public int getFrequency() {
        return frequency.get();
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastAccessed() {
        return lastAccessed.get();
    }

    /**
     * Returns the ticker time at which this entry expires, or {@link #NEVER_EXPIRES}.
     */
    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean hasExpiration() {
        return expiresAt != NEVER_EXPIRES;
    }

    /**
     * Returns true once the ticker has reached the expiration time.
     */
    public boolean isExpired() {
        return isExpiredAt(ticker.read());
    }

    public boolean isExpiredAt(long nowNanos) {
        return expiresAt != NEVER_EXPIRES && nowNanos >= expiresAt;
    }

    /**
     * Returns the nanoseconds left before expiration, zero when already expired, or
     * {@link Long#MAX_VALUE} when the entry never expires.
     */
    public long getTimeToLiveNanos() {
        if (expiresAt == NEVER_EXPIRES) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, expiresAt - ticker.read());
    }

    /**
     * Returns the age in whole seconds, rounded up and never less than one.
     */
    public long getAgeInSeconds() {
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(ticker.read() - createdAt);
        long seconds = (elapsedMillis + 999) / 1000;
        return Math.max(1, seconds);
    }

    public long getTimeSinceLastAccessNanos() {
        return Math.max(0, ticker.read() - lastAccessed.get());
    }

    /**
     * Sets the last access time to now.
     */
    public void updateAccess() {
        lastAccessed.set(ticker.read());
    }

    /**
     * Increments the access frequency and updates the access time.
     */
    public void incrementFrequency() {
        frequency.incrementAndGet();
        updateAccess();
    }

    /**
     * Returns the composite score used to rank eviction candidates; lower scores are evicted
     * first.
     */
    public double calculateAdaptiveScore() {
        double freshness = 100.0 / (getAgeInSeconds() + 1);
        double sizePenalty = Math.min(sizeBytes / 1024.0, MAX_SIZE_PENALTY);
        return priority * PRIORITY_WEIGHT
                + frequency.get() * FREQUENCY_WEIGHT
                + freshness * FRESHNESS_WEIGHT
                - sizePenalty * SIZE_WEIGHT;
    }

    /**
     * Returns a copy with the same value, size, priority and frequency whose expiration is
     * measured from now.
     *
     * @param ttl the new time-to-live, or {@code null} for no expiration
     */
    public CacheEntry copyWithNewTTL(Duration ttl) {
        CacheEntry copy = new CacheEntry(value, sizeBytes, priority, frequency.get(), createdAt, ttl, ticker);
        copy.lastAccessed.set(lastAccessed.get());
        return copy;
    }

    static int clampPriority(int priority) {
        return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority));
    }

    /**
     * Returns {@code now + ttl}, or {@link #NEVER_EXPIRES} for a {@code null} ttl or one too long
     * to represent in nanoseconds.
     */
    static long expirationTime(long now, Duration ttl) {
        if (ttl == null) {
            return NEVER_EXPIRES;
        }
        long ttlNanos;
        try {
            ttlNanos = ttl.toNanos();
        } catch (ArithmeticException e) {
            return NEVER_EXPIRES;
        }
        return saturatedAdd(now, ttlNanos);
    }

    private static long saturatedAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return NEVER_EXPIRES;
        }
        return result;
    }

    @Override
    public String toString() {
        return "CacheEntry{"
                + "size=" + sizeBytes
                + ", priority=" + priority
                + ", frequency=" + frequency.get()
                + ", ageSeconds=" + getAgeInSeconds()
                + ", expired=" + isExpired()
                + '}';
    }
}
