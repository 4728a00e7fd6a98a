package com.github.rudygunawan.adaptivecache.api;

import java.util.Set;

/**
 * Durable storage consulted by the cache as a fallback.
 *
 * <p>The cache calls {@link #load} after a miss and re-inserts what it returns, deletes from the
 * store whenever a key is invalidated, and copies its contents in either direction on
 * {@code persistToStorage()} and {@code restoreFromStorage()}. Any exception thrown by the store
 * is logged by the cache and treated as a miss.
 *
 * <p>Usage example:
 * <pre>{@code
 * AdaptiveCache cache = CacheBuilder.newBuilder()
 *     .persistentStore(new PersistentStore() {
 *       public Object load(String key) throws Exception {
 *         return database.find(key);
 *       }
 *       ...
 *     })
 *     .build();
 * }</pre>
 */
public interface PersistentStore {

    /**
     * Returns the stored value, or {@code null} if the store has none for {@code key}.
     */
    Object load(String key) throws Exception;

    void store(String key, Object value) throws Exception;

    void delete(String key) throws Exception;

    /**
     * Returns every key the store holds.
     */
    Set<String> keys() throws Exception;

    void clear() throws Exception;
}
