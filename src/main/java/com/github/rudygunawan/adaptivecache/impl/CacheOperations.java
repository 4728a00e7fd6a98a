package com.github.rudygunawan.adaptivecache.impl;

import com.github.rudygunawan.adaptivecache.api.OversizedEntryException;
import com.github.rudygunawan.adaptivecache.api.PersistentStore;
import com.github.rudygunawan.adaptivecache.builder.CacheBuilder;
import com.github.rudygunawan.adaptivecache.listener.RemovalListener;
import com.github.rudygunawan.adaptivecache.model.CacheEntry;
import com.github.rudygunawan.adaptivecache.policy.EvictionPolicy;
import com.github.rudygunawan.adaptivecache.policy.RemovalCause;
import com.github.rudygunawan.adaptivecache.policy.SizeEstimator;
import com.github.rudygunawan.adaptivecache.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Read, write, compute and invalidation operations over a {@link CacheState}.
 *
 * <p>Every removal, whatever its cause, goes through {@link #removeEntry} so that the table, the
 * access order, the tag index, the expiration timers, the statistics and the removal listener
 * stay consistent.
 */
final class CacheOperations {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptivecache.Cache");

    private final CacheState state;
    private final CacheStatistics statistics;
    private final Ticker ticker;
    private final long maximumSize;
    private final Duration defaultTtl;
    private final int defaultPriority;
    private final int maxEntrySizeMB;
    private final EvictionPolicy evictionPolicy;
    private final boolean eagerExpiration;
    private final RemovalListener removalListener;
    private final PersistentStore persistentStore;
    private final ScheduledExecutorService timerScheduler;

    CacheOperations(CacheState state, CacheStatistics statistics, CacheBuilder builder,
                    ScheduledExecutorService timerScheduler) {
        this.state = state;
        this.statistics = statistics;
        this.ticker = builder.getTicker();
        this.maximumSize = builder.getMaximumSize();
        this.defaultTtl = builder.getDefaultTtl();
        this.defaultPriority = builder.getDefaultPriority();
        this.maxEntrySizeMB = builder.getMaxEntrySizeMB();
        this.evictionPolicy = builder.getEvictionPolicy();
        this.eagerExpiration = builder.isEagerExpiration();
        this.removalListener = builder.getRemovalListener();
        this.persistentStore = builder.getPersistentStore();
        this.timerScheduler = timerScheduler;
    }

    // Reads

    <T> T get(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        state.checkNotDisposed();

        CacheEntry entry = state.table.get(key);
        if (entry != null && !entry.isExpired()) {
            state.lock.lock();
            try {
                entry.incrementFrequency();
                if (state.table.get(key) == entry) {
                    state.touch(key);
                    statistics.recordHit(key);
                } else {
                    statistics.recordHit();
                }
            } finally {
                state.lock.unlock();
            }
            return entry.getValue();
        }

        statistics.recordMiss(key);
        if (entry != null) {
            removeIfExpired(key);
        }
        return loadFromStore(key);
    }

    <T> T peek(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        state.checkNotDisposed();
        CacheEntry entry = state.table.get(key);
        if (entry == null || entry.isExpired()) {
            return null;
        }
        return entry.getValue();
    }

    // Writes

    void set(String key, Object value, Duration ttl, Integer priority) {
        CacheEntry entry = newEntry(key, value, ttl, priority);
        state.lock.lock();
        try {
            state.checkNotDisposed();
            putEntry(key, entry, null);
        } finally {
            state.lock.unlock();
        }
    }

    void setWithTags(String key, Object value, Collection<String> tags, Duration ttl) {
        Objects.requireNonNull(tags, "tags cannot be null");
        for (String tag : tags) {
            Objects.requireNonNull(tag, "tag cannot be null");
        }
        CacheEntry entry = newEntry(key, value, ttl, null);
        state.lock.lock();
        try {
            state.checkNotDisposed();
            putEntry(key, entry, tags);
        } finally {
            state.lock.unlock();
        }
    }

    private CacheEntry newEntry(String key, Object value, Duration ttl, Integer priority) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        state.checkNotDisposed();
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }

        long sizeBytes = SizeEstimator.estimateSize(value);
        if (sizeBytes > 0 && !SizeEstimator.isReasonableSize(sizeBytes, maxEntrySizeMB)) {
            throw new OversizedEntryException(key, sizeBytes, maxEntrySizeMB);
        }
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        int effectivePriority = priority != null ? priority : defaultPriority;
        return new CacheEntry(value, sizeBytes, effectiveTtl, effectivePriority, ticker);
    }

    private void putEntry(String key, CacheEntry entry, Collection<String> tags) {
        CacheEntry old = state.table.put(key, entry);
        state.tagIndex.removeKey(key);
        cancelExpirationTimer(key);
        if (old != null) {
            fireRemovalEvent(key, old.getValue(), RemovalCause.REPLACED);
        }

        state.touch(key);
        if (tags != null) {
            state.tagIndex.add(key, tags);
        }
        scheduleExpiration(key, entry);
        statistics.recordSet(key);

        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Stored entry: key=" + key + ", size=" + SizeEstimator.formatSize(entry.getSizeBytes())
                    + ", priority=" + entry.getPriority());
        }
        evictIfNeeded(key);
    }

    // Computation

    <T> T getOrCompute(String key, Callable<? extends T> compute) throws Exception {
        Objects.requireNonNull(compute, "compute cannot be null");
        CompletableFuture<T> future = getOrComputeAsync(key, () -> {
            try {
                return CompletableFuture.completedFuture(compute.call());
            } catch (Throwable e) {
                return CompletableFuture.failedFuture(e);
            }
        });

        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RuntimeException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    <T> CompletableFuture<T> getOrComputeAsync(String key,
                                               Supplier<? extends CompletionStage<? extends T>> compute) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(compute, "compute cannot be null");

        T cached = get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }

        // Only one computation per key; later callers share its outcome
        CompletableFuture<Object> promise = new CompletableFuture<>();
        CompletableFuture<Object> existing = state.inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            return existing.thenApply(value -> (T) value);
        }

        // Another computation may have stored the value between our miss and registration
        T stored = peek(key);
        if (stored != null) {
            state.inFlight.remove(key, promise);
            promise.complete(stored);
            return CompletableFuture.completedFuture(stored);
        }

        long startTime = ticker.read();
        CompletionStage<? extends T> stage;
        try {
            stage = Objects.requireNonNull(compute.get(), "compute returned null for key: " + key);
        } catch (Throwable e) {
            // the slot must be released whatever the supplier throws
            stage = CompletableFuture.failedFuture(e);
        }
        stage.whenComplete((value, error) -> completeComputation(key, promise, startTime, value, error));
        return promise.thenApply(value -> (T) value);
    }

    private void completeComputation(String key, CompletableFuture<Object> promise, long startTime,
                                     Object value, Throwable error) {
        Throwable failure = unwrap(error);
        if (failure == null && value == null) {
            failure = new NullPointerException("compute returned null value for key: " + key);
        }
        if (failure == null) {
            try {
                set(key, value, null, null);
            } catch (RuntimeException e) {
                failure = e;
            }
        }

        long loadTime = ticker.read() - startTime;
        state.inFlight.remove(key, promise);
        if (failure == null) {
            statistics.recordLoadSuccess(loadTime);
            promise.complete(value);
        } else {
            statistics.recordLoadFailure(loadTime);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "Computation failed for key: " + key, failure);
            }
            promise.completeExceptionally(failure);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    // Invalidation

    boolean invalidate(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        boolean removed;
        state.lock.lock();
        try {
            state.checkNotDisposed();
            CacheEntry entry = state.table.get(key);
            removed = entry != null && removeEntry(key, entry, RemovalCause.EXPLICIT);
        } finally {
            state.lock.unlock();
        }
        deleteFromStore(key);
        return removed;
    }

    int invalidateByTag(String tag) {
        Objects.requireNonNull(tag, "tag cannot be null");
        List<String> removedKeys = new ArrayList<>();
        state.lock.lock();
        try {
            state.checkNotDisposed();
            for (String key : state.tagIndex.keysFor(tag)) {
                CacheEntry entry = state.table.get(key);
                if (entry != null && removeEntry(key, entry, RemovalCause.TAG)) {
                    removedKeys.add(key);
                }
            }
        } finally {
            state.lock.unlock();
        }
        removedKeys.forEach(this::deleteFromStore);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Invalidated tag '" + tag + "': " + removedKeys.size() + " entries");
        }
        return removedKeys.size();
    }

    int invalidatePattern(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Pattern glob = compileGlob(pattern);
        List<String> removedKeys = new ArrayList<>();
        state.lock.lock();
        try {
            state.checkNotDisposed();
            for (String key : new ArrayList<>(state.table.keySet())) {
                boolean matches = glob != null ? glob.matcher(key).matches() : key.contains(pattern);
                if (!matches) {
                    continue;
                }
                CacheEntry entry = state.table.get(key);
                if (entry != null && removeEntry(key, entry, RemovalCause.EXPLICIT)) {
                    removedKeys.add(key);
                }
            }
        } finally {
            state.lock.unlock();
        }
        removedKeys.forEach(this::deleteFromStore);
        return removedKeys.size();
    }

    /**
     * Returns an anchored regex for a pattern containing {@code *} or {@code ?}, or {@code null}
     * for a plain substring pattern.
     */
    static Pattern compileGlob(String pattern) {
        if (pattern.indexOf('*') < 0 && pattern.indexOf('?') < 0) {
            return null;
        }
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    void invalidateAll() {
        state.lock.lock();
        try {
            state.checkNotDisposed();
            for (String key : new ArrayList<>(state.accessOrder)) {
                CacheEntry entry = state.table.get(key);
                if (entry != null) {
                    removeEntry(key, entry, RemovalCause.EXPLICIT);
                }
            }
        } finally {
            state.lock.unlock();
        }
        clearStore();
    }

    // Removal and eviction

    /**
     * Removes {@code key} if it is still mapped to {@code entry}. Must be called with the lock
     * held.
     */
    private boolean removeEntry(String key, CacheEntry entry, RemovalCause cause) {
        if (!state.table.remove(key, entry)) {
            return false;
        }
        state.accessOrder.remove(key);
        state.tagIndex.removeKey(key);
        cancelExpirationTimer(key);
        statistics.recordRemove(key);
        if (cause.wasEvicted()) {
            statistics.recordEviction();
        }
        fireRemovalEvent(key, entry.getValue(), cause);
        return true;
    }

    private boolean removeIfExpired(String key) {
        state.lock.lock();
        try {
            CacheEntry entry = state.table.get(key);
            return entry != null && entry.isExpired() && removeEntry(key, entry, RemovalCause.EXPIRED);
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Evicts entries until the table fits {@code maximumSize}. Must be called with the lock held.
     *
     * @param protectedKey the key just written, or {@code null}
     */
    private void evictIfNeeded(String protectedKey) {
        while (state.table.size() > maximumSize) {
            String victim = selectVictim(maximumSize > 0 ? protectedKey : null);
            if (victim == null) {
                return;
            }
            CacheEntry entry = state.table.get(victim);
            if (entry == null) {
                // access order out of step with the table
                state.accessOrder.remove(victim);
                continue;
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry due to size limit: key=" + victim
                        + ", policy=" + evictionPolicy + ", score=" + entry.calculateAdaptiveScore());
            }
            removeEntry(victim, entry, RemovalCause.SIZE);
        }
    }

    /**
     * Returns the first eviction candidate by the configured policy. Equal candidates are broken
     * by access order, least recently used first.
     */
    private String selectVictim(String excludedKey) {
        Comparator<CacheEntry> ranking = evictionPolicy.ranking();
        String victim = null;
        CacheEntry victimEntry = null;
        for (String key : state.accessOrder) {
            if (key.equals(excludedKey)) {
                continue;
            }
            CacheEntry entry = state.table.get(key);
            if (entry == null) {
                return key;
            }
            if (victimEntry == null || ranking.compare(entry, victimEntry) < 0) {
                victim = key;
                victimEntry = entry;
            }
        }
        return victim;
    }

    /**
     * Evicts entries by the configured policy until at most {@code targetSize} remain.
     *
     * @return the number of entries evicted
     */
    int trimTo(long targetSize) {
        int evicted = 0;
        state.lock.lock();
        try {
            while (state.table.size() > targetSize) {
                String victim = selectVictim(null);
                if (victim == null) {
                    break;
                }
                CacheEntry entry = state.table.get(victim);
                if (entry == null) {
                    state.accessOrder.remove(victim);
                } else if (removeEntry(victim, entry, RemovalCause.SIZE)) {
                    evicted++;
                }
            }
        } finally {
            state.lock.unlock();
        }
        return evicted;
    }

    /**
     * Removes every expired entry. Candidates are collected from a snapshot of the table without
     * the lock and checked again under it.
     *
     * @return the number of entries removed
     */
    int removeExpiredEntries() {
        long now = ticker.read();
        List<String> candidates = new ArrayList<>();
        for (Map.Entry<String, CacheEntry> entry : state.table.entrySet()) {
            if (entry.getValue().isExpiredAt(now)) {
                candidates.add(entry.getKey());
            }
        }
        if (candidates.isEmpty()) {
            return 0;
        }

        int removed = 0;
        state.lock.lock();
        try {
            for (String key : candidates) {
                CacheEntry entry = state.table.get(key);
                if (entry != null && entry.isExpired() && removeEntry(key, entry, RemovalCause.EXPIRED)) {
                    removed++;
                }
            }
        } finally {
            state.lock.unlock();
        }
        return removed;
    }

    long expiredEntryCount() {
        long now = ticker.read();
        return state.table.values().stream().filter(entry -> entry.isExpiredAt(now)).count();
    }

    // Expiration timers

    private void scheduleExpiration(String key, CacheEntry entry) {
        if (!eagerExpiration || !entry.hasExpiration() || timerScheduler == null) {
            return;
        }
        try {
            ScheduledFuture<?> timer = timerScheduler.schedule(
                    () -> expireEntry(key, entry), entry.getTimeToLiveNanos(), TimeUnit.NANOSECONDS);
            state.expirationTimers.put(key, timer);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.WARNING, "Could not schedule expiration timer for key: " + key, e);
        }
    }

    private void expireEntry(String key, CacheEntry entry) {
        state.lock.lock();
        try {
            if (state.isDisposed() || state.table.get(key) != entry) {
                return;
            }
            state.expirationTimers.remove(key);
            if (entry.isExpired()) {
                removeEntry(key, entry, RemovalCause.EXPIRED);
            } else {
                // timer fired before the ticker reached the expiration time
                scheduleExpiration(key, entry);
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Expiration timer failed for key: " + key, e);
        } finally {
            state.lock.unlock();
        }
    }

    private void cancelExpirationTimer(String key) {
        ScheduledFuture<?> timer = state.expirationTimers.remove(key);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    // Persistent store

    @SuppressWarnings("unchecked")
    private <T> T loadFromStore(String key) {
        if (persistentStore == null) {
            return null;
        }
        try {
            Object value = persistentStore.load(key);
            if (value == null) {
                return null;
            }
            set(key, value, null, null);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Restored entry from persistent store: key=" + key);
            }
            return (T) value;
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "PersistentStore failed to load key: " + key, e);
            return null;
        }
    }

    private void deleteFromStore(String key) {
        if (persistentStore == null) {
            return;
        }
        try {
            persistentStore.delete(key);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "PersistentStore failed to delete key: " + key, e);
        }
    }

    private void clearStore() {
        if (persistentStore == null) {
            return;
        }
        try {
            persistentStore.clear();
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "PersistentStore failed to clear", e);
        }
    }

    int persistToStorage() {
        state.checkNotDisposed();
        if (persistentStore == null) {
            return 0;
        }
        int written = 0;
        for (Map.Entry<String, Object> entry : liveEntries().entrySet()) {
            try {
                persistentStore.store(entry.getKey(), entry.getValue());
                written++;
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "PersistentStore failed to store key: " + entry.getKey(), e);
            }
        }
        return written;
    }

    int restoreFromStorage() {
        state.checkNotDisposed();
        if (persistentStore == null) {
            return 0;
        }
        Set<String> storedKeys;
        try {
            storedKeys = persistentStore.keys();
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "PersistentStore failed to list keys", e);
            return 0;
        }

        int restored = 0;
        for (String key : storedKeys) {
            try {
                Object value = persistentStore.load(key);
                if (value != null) {
                    set(key, value, null, null);
                    restored++;
                }
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "PersistentStore failed to restore key: " + key, e);
            }
        }
        return restored;
    }

    // Snapshots

    Map<String, Object> liveEntries() {
        long now = ticker.read();
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, CacheEntry> entry : state.table.entrySet()) {
            if (!entry.getValue().isExpiredAt(now)) {
                result.put(entry.getKey(), entry.getValue().getValue());
            }
        }
        return result;
    }

    Set<String> keys() {
        return new LinkedHashSet<>(liveEntries().keySet());
    }

    long totalSizeBytes() {
        long total = 0;
        for (CacheEntry entry : state.table.values()) {
            total += entry.getSizeBytes();
        }
        return total;
    }

    List<String> getKeysByTag(String tag) {
        Objects.requireNonNull(tag, "tag cannot be null");
        state.lock.lock();
        try {
            return state.tagIndex.keysFor(tag);
        } finally {
            state.lock.unlock();
        }
    }

    Set<String> getTags() {
        state.lock.lock();
        try {
            return state.tagIndex.tags();
        } finally {
            state.lock.unlock();
        }
    }

    int tagCount() {
        state.lock.lock();
        try {
            return state.tagIndex.tagCount();
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Discards all state without notifying the listener. Pending computations fail with
     * {@link IllegalStateException}.
     */
    void clear() {
        state.lock.lock();
        try {
            for (ScheduledFuture<?> timer : state.expirationTimers.values()) {
                timer.cancel(false);
            }
            state.expirationTimers.clear();
            state.table.clear();
            state.accessOrder.clear();
            state.tagIndex.clear();
        } finally {
            state.lock.unlock();
        }
        IllegalStateException disposed = new IllegalStateException("cache has been disposed");
        for (String key : new ArrayList<>(state.inFlight.keySet())) {
            CompletableFuture<Object> pending = state.inFlight.remove(key);
            if (pending != null) {
                pending.completeExceptionally(disposed);
            }
        }
    }

    private void fireRemovalEvent(String key, Object value, RemovalCause cause) {
        if (removalListener != null) {
            try {
                removalListener.onRemoval(key, value, cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + key
                        + ", cause: " + cause, e);
            }
        }
    }
}
