package com.github.rudygunawan.adaptivecache.impl;

import com.github.rudygunawan.adaptivecache.model.CacheEntry;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one cache instance.
 *
 * <p>The table and the in-flight map are concurrent and may be read without the lock. Every
 * mutation of the table, and every access to the access order, the tag index and the expiration
 * timers, happens while {@link #lock} is held.
 */
final class CacheState {
    final ConcurrentHashMap<String, CacheEntry> table = new ConcurrentHashMap<>();

    // least recently used first
    final LinkedHashSet<String> accessOrder = new LinkedHashSet<>();

    final TagIndex tagIndex = new TagIndex();

    final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    final Map<String, ScheduledFuture<?>> expirationTimers = new HashMap<>();

    final ReentrantLock lock = new ReentrantLock();

    private volatile boolean disposed;

    /**
     * Moves {@code key} to the most recently used position.
     */
    void touch(String key) {
        accessOrder.remove(key);
        accessOrder.add(key);
    }

    void checkNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("cache has been disposed");
        }
    }

    boolean isDisposed() {
        return disposed;
    }

    /**
     * Marks the state as disposed.
     *
     * @return {@code false} if it was already disposed
     */
    boolean markDisposed() {
        lock.lock();
        try {
            if (disposed) {
                return false;
            }
            disposed = true;
            return true;
        } finally {
            lock.unlock();
        }
    }
}
