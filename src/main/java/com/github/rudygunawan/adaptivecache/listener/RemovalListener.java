package com.github.rudygunawan.adaptivecache.listener;

import com.github.rudygunawan.adaptivecache.policy.RemovalCause;

/**
 * A listener that receives notification when an entry is removed from an adaptive cache.
 *
 * <p>The listener is called synchronously while the cache holds its lock, so implementations
 * must be fast and must not call back into the cache. Exceptions thrown by the listener are
 * logged and otherwise ignored.
 *
 * <p>Usage example:
 * <pre>{@code
 * AdaptiveCache cache = CacheBuilder.newBuilder()
 *     .removalListener((key, value, cause) -> {
 *       if (cause.wasEvicted()) {
 *         evictions.increment();
 *       }
 *     })
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface RemovalListener {

    /**
     * Notifies the listener that an entry was removed.
     *
     * @param key the key of the removed entry
     * @param value the value of the removed entry
     * @param cause the reason for the removal
     */
    void onRemoval(String key, Object value, RemovalCause cause);
}
