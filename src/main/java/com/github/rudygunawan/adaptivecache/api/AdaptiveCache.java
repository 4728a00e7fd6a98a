package com.github.rudygunawan.adaptivecache.api;

import com.github.rudygunawan.adaptivecache.model.CacheStats;
import com.github.rudygunawan.adaptivecache.model.CleanupReport;
import com.github.rudygunawan.adaptivecache.model.CleanupResult;
import com.github.rudygunawan.adaptivecache.model.CleanupStats;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * An in-memory mapping from string keys to values of any type. Entries are added with
 * {@code set}, and stay in the cache until they expire, are invalidated, or are evicted because
 * the cache is full. When the cache is full, the entry with the lowest adaptive score (a blend of
 * priority, access frequency, freshness and size) is evicted first.
 *
 * <p>Entries can be grouped under tags so that related entries are invalidated together.
 *
 * <p>Implementations of this interface are expected to be thread-safe, and can be safely accessed
 * by multiple concurrent threads.
 *
 * <p>Usage example:
 * <pre>{@code
 * try (AdaptiveCache cache = CacheBuilder.newBuilder()
 *         .maximumSize(500)
 *         .defaultTtl(Duration.ofMinutes(5))
 *         .build()) {
 *   cache.setWithTags("user:42", user, List.of("users"));
 *   User cached = cache.get("user:42");
 *   cache.invalidateByTag("users");
 * }
 * }</pre>
 */
public interface AdaptiveCache extends AutoCloseable {

    /**
     * Returns the value associated with {@code key}, or {@code null} if there is no live entry.
     *
     * <p>A hit increments the entry's access frequency and makes it the most recently used. A miss
     * removes the entry if it has expired and, when a {@link PersistentStore} is configured, tries
     * to restore the value from it.
     *
     * <p>The result is cast to the type expected by the caller; a mismatch fails with a
     * {@link ClassCastException} at the call site.
     *
     * @param key the key whose associated value is to be returned
     * @return the cached value, or {@code null}
     */
    <T> T get(String key);

    /**
     * Returns the value associated with {@code key} if it is an instance of {@code type}.
     *
     * @throws ClassCastException if the cached value is not an instance of {@code type}
     */
    <T> T get(String key, Class<T> type);

    /**
     * Returns the live value associated with {@code key} without recording a hit or a miss and
     * without changing the entry's access state.
     */
    <T> T peek(String key);

    /**
     * Associates {@code value} with {@code key}, using the configured default time-to-live and
     * priority. An existing entry for {@code key} is replaced and loses its tags.
     *
     * @throws OversizedEntryException if the estimated size of {@code value} is too large
     */
    void set(String key, Object value);

    /**
     * Associates {@code value} with {@code key} for the given time-to-live.
     *
     * @param ttl the time-to-live, or {@code null} to use the configured default
     * @throws OversizedEntryException if the estimated size of {@code value} is too large
     */
    void set(String key, Object value, Duration ttl);

    /**
     * Associates {@code value} with {@code key} for the given time-to-live and eviction priority.
     *
     * @param ttl the time-to-live, or {@code null} to use the configured default
     * @param priority the eviction priority, clamped to [0, 100]; higher values are kept longer
     * @throws OversizedEntryException if the estimated size of {@code value} is too large
     */
    void set(String key, Object value, Duration ttl, int priority);

    /**
     * Stores {@code value} and registers {@code key} under every tag in {@code tags}.
     */
    void setWithTags(String key, Object value, Collection<String> tags);

    /**
     * Stores {@code value} for the given time-to-live and registers {@code key} under every tag in
     * {@code tags}.
     */
    void setWithTags(String key, Object value, Collection<String> tags, Duration ttl);

    /**
     * Returns the value associated with {@code key}, obtaining it from {@code compute} if there is
     * no live entry. While a computation for a key is running, other callers for the same key wait
     * for its result instead of starting another one. A successful result is stored with the
     * default time-to-live; a failure is rethrown to every waiting caller and nothing is stored.
     *
     * @param key the key whose associated value is to be returned
     * @param compute the function computing a missing value; must not return {@code null}
     * @return the cached or computed value
     * @throws Exception if {@code compute} throws an exception
     */
    <T> T getOrCompute(String key, Callable<? extends T> compute) throws Exception;

    /**
     * Asynchronous variant of {@link #getOrCompute}. The returned future completes with the cached
     * value immediately on a hit, and otherwise with the result of the single running
     * computation for {@code key}.
     */
    <T> CompletableFuture<T> getOrComputeAsync(String key,
                                               Supplier<? extends CompletionStage<? extends T>> compute);

    /**
     * Discards the entry for {@code key}, if any.
     *
     * @return {@code true} if an entry was removed
     */
    boolean invalidate(String key);

    /**
     * Discards every entry registered under {@code tag}. The tag is forgotten afterwards.
     *
     * @return the number of entries removed
     */
    int invalidateByTag(String tag);

    /**
     * Discards every entry whose key matches {@code pattern}. A pattern containing {@code *} or
     * {@code ?} is a glob matched against the whole key; any other pattern matches keys that
     * contain it.
     *
     * @return the number of entries removed
     */
    int invalidatePattern(String pattern);

    /**
     * Discards all entries. Statistics are kept.
     */
    void invalidateAll();

    /**
     * Returns a snapshot of the keys registered under {@code tag}, in registration order.
     */
    List<String> getKeysByTag(String tag);

    /**
     * Returns a snapshot of every tag that currently has at least one key.
     */
    Set<String> getTags();

    /**
     * Returns the number of entries in this cache, expired ones included until they are removed.
     */
    long size();

    /**
     * Returns a snapshot of the keys of the live entries.
     */
    Set<String> keys();

    /**
     * Returns a snapshot of this cache's statistics.
     */
    CacheStats getStats();

    /**
     * Zeroes every counter and forgets per-key access times. Entries are kept.
     */
    void resetStats();

    CleanupStats getCleanupStats();

    CleanupReport getCleanupReport();

    /**
     * Runs a cleanup pass on the calling thread.
     *
     * @param includeOptimization whether to also optimize the cache
     */
    CleanupResult forceCleanup(boolean includeOptimization);

    void startBackgroundCleanup();

    void stopBackgroundCleanup();

    boolean isBackgroundCleanupRunning();

    /**
     * Writes every live entry to the configured {@link PersistentStore}.
     *
     * @return the number of entries written, zero without a store
     */
    int persistToStorage();

    /**
     * Loads every key of the configured {@link PersistentStore} into the cache.
     *
     * @return the number of entries restored, zero without a store
     */
    int restoreFromStorage();

    /**
     * Stops background work, cancels expiration timers and discards all state. Later data
     * operations fail with {@link IllegalStateException}. Calling this method more than once has
     * no effect.
     */
    void dispose();

    /**
     * Same as {@link #dispose()}.
     */
    @Override
    default void close() {
        dispose();
    }
}
