package com.github.rudygunawan.adaptivecache.impl;

import com.github.rudygunawan.adaptivecache.api.MaintainableCache;
import com.github.rudygunawan.adaptivecache.api.Optimizable;
import com.github.rudygunawan.adaptivecache.model.CleanupEvent;
import com.github.rudygunawan.adaptivecache.model.CleanupReport;
import com.github.rudygunawan.adaptivecache.model.CleanupResult;
import com.github.rudygunawan.adaptivecache.model.CleanupStats;
import com.github.rudygunawan.adaptivecache.time.Ticker;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic maintenance of one or more caches.
 *
 * <p>While running, each pass removes expired entries from every registered cache, optimizes the
 * caches that implement {@link Optimizable} on every tenth pass or when ten minutes have gone by
 * without an optimization, and prunes diagnostic events older than one hour. A failing pass is
 * logged and recorded as an {@link CleanupEvent.Type#ERROR} event; later passes still run.
 *
 * <p>Logger name: "com.github.rudygunawan.adaptivecache.Cleanup"
 */
public final class CacheCleanupService {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptivecache.Cleanup");

    static final int MAX_EVENTS = 100;
    static final int REPORT_EVENTS = 20;
    static final int OPTIMIZE_EVERY_RUNS = 10;
    static final long OPTIMIZE_AFTER_NANOS = TimeUnit.MINUTES.toNanos(10);
    static final long EVENT_RETENTION_NANOS = TimeUnit.HOURS.toNanos(1);

    private static final double HIGH_AVERAGE_EXPIRED = 100;
    private static final double HIGH_ERROR_RATE = 0.1;
    private static final double HIGH_UTILIZATION = 0.9;
    private static final double LOW_UTILIZATION = 0.2;

    private final List<MaintainableCache> caches;
    private final Duration cleanupInterval;
    private final ScheduledExecutorService scheduler;
    private final Ticker ticker;

    // guarded by itself
    private final ArrayDeque<CleanupEvent> events = new ArrayDeque<>();

    private final AtomicLong totalExpiredRemoved = new AtomicLong(0);
    private final AtomicLong totalOptimizations = new AtomicLong(0);
    private final AtomicLong backgroundRuns = new AtomicLong(0);
    private volatile long lastCleanupNanos = -1;
    private volatile long lastOptimizationNanos = -1;
    private volatile long startedAtNanos = -1;

    // guarded by this
    private ScheduledFuture<?> backgroundTask;

    /**
     * Creates a stopped service.
     *
     * @param caches the caches to maintain
     * @param cleanupInterval the period of background passes
     * @param scheduler runs the background passes; not shut down by this service
     * @param ticker the time source for events and durations
     */
    public CacheCleanupService(List<? extends MaintainableCache> caches, Duration cleanupInterval,
                               ScheduledExecutorService scheduler, Ticker ticker) {
        this.caches = List.copyOf(caches);
        this.cleanupInterval = Objects.requireNonNull(cleanupInterval, "cleanup interval cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            throw new IllegalArgumentException("cleanup interval must be positive");
        }
    }

    /**
     * Removes expired entries from every registered cache.
     *
     * @return the total number of entries removed
     */
    public int removeExpiredEntries() {
        return sweepExpired(new ArrayList<>());
    }

    /**
     * Optimizes every registered cache that implements {@link Optimizable}.
     */
    public void optimizeCache() {
        optimize(new ArrayList<>());
    }

    private int sweepExpired(List<String> errors) {
        int removed = 0;
        for (MaintainableCache cache : caches) {
            try {
                removed += cache.removeExpiredEntries();
            } catch (Throwable e) {
                String message = "Error removing expired entries from " + cache.name() + ": " + e;
                errors.add(message);
                recordEvent(CleanupEvent.Type.ERROR, message);
                LOGGER.log(Level.WARNING, message, e);
            }
        }
        totalExpiredRemoved.addAndGet(removed);
        lastCleanupNanos = ticker.read();
        recordEvent(CleanupEvent.Type.EXPIRED_REMOVAL,
                "Removed " + removed + " expired entries from " + caches.size() + " caches");
        return removed;
    }

    private void optimize(List<String> errors) {
        int failures = 0;
        for (MaintainableCache cache : caches) {
            if (!(cache instanceof Optimizable)) {
                continue;
            }
            try {
                ((Optimizable) cache).optimize();
            } catch (Throwable e) {
                failures++;
                String message = "Error optimizing " + cache.name() + ": " + e;
                errors.add(message);
                recordEvent(CleanupEvent.Type.ERROR, message);
                LOGGER.log(Level.WARNING, message, e);
            }
        }
        long now = ticker.read();
        totalOptimizations.incrementAndGet();
        lastOptimizationNanos = now;
        lastCleanupNanos = now;
        recordEvent(CleanupEvent.Type.OPTIMIZATION, failures == 0
                ? "Cache optimization completed"
                : "Cache optimization completed with " + failures + " errors");
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Optimized " + caches.size() + " caches, failures=" + failures);
        }
    }

    /**
     * Starts periodic passes at the configured interval. Does nothing if already running.
     */
    public synchronized void startBackgroundCleanup() {
        if (backgroundTask != null && !backgroundTask.isDone()) {
            return;
        }
        long periodNanos = cleanupInterval.toNanos();
        backgroundTask = scheduler.scheduleAtFixedRate(
                this::performBackgroundCleanup, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        startedAtNanos = ticker.read();
        recordEvent(CleanupEvent.Type.BACKGROUND,
                "Background cleanup started with " + cleanupInterval.toSeconds() + "s interval");
    }

    public synchronized void stopBackgroundCleanup() {
        if (backgroundTask == null) {
            return;
        }
        backgroundTask.cancel(false);
        backgroundTask = null;
        startedAtNanos = -1;
        recordEvent(CleanupEvent.Type.BACKGROUND, "Background cleanup stopped");
    }

    public synchronized boolean isBackgroundCleanupRunning() {
        return backgroundTask != null && !backgroundTask.isDone();
    }

    /**
     * Runs one background pass. Never throws.
     */
    void performBackgroundCleanup() {
        long runs = backgroundRuns.incrementAndGet();
        long startTime = ticker.read();
        try {
            List<String> errors = new ArrayList<>();
            int removed = sweepExpired(errors);
            if (shouldOptimize(runs, ticker.read())) {
                optimize(errors);
            }
            pruneOldEvents();

            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(ticker.read() - startTime);
            recordEvent(CleanupEvent.Type.BACKGROUND,
                    "Background cleanup completed in " + elapsedMillis + "ms, removed " + removed + " entries");
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Background cleanup run " + runs + ": removed=" + removed
                        + ", errors=" + errors.size() + ", elapsed=" + elapsedMillis + "ms");
            }
        } catch (Throwable e) {
            // an exception escaping here would cancel the periodic task
            recordEvent(CleanupEvent.Type.ERROR, "Background cleanup failed: " + e);
            LOGGER.log(Level.WARNING, "Background cleanup failed", e);
        }
    }

    boolean shouldOptimize(long runs, long now) {
        if (runs % OPTIMIZE_EVERY_RUNS == 0) {
            return true;
        }
        long reference = lastOptimizationNanos >= 0 ? lastOptimizationNanos : startedAtNanos;
        return reference >= 0 && now - reference >= OPTIMIZE_AFTER_NANOS;
    }

    /**
     * Runs a pass on the calling thread.
     *
     * @param includeOptimization whether to also optimize the caches
     */
    public CleanupResult forceCleanup(boolean includeOptimization) {
        long startTime = ticker.read();
        List<String> errors = new ArrayList<>();
        int removed = sweepExpired(errors);
        if (includeOptimization) {
            optimize(errors);
        }
        Duration duration = Duration.ofNanos(Math.max(0, ticker.read() - startTime));
        return new CleanupResult(errors.isEmpty(), removed, duration, errors);
    }

    private void recordEvent(CleanupEvent.Type type, String message) {
        synchronized (events) {
            events.addLast(new CleanupEvent(type, ticker.read(), message));
            while (events.size() > MAX_EVENTS) {
                events.removeFirst();
            }
        }
    }

    private void pruneOldEvents() {
        long cutoff = ticker.read() - EVENT_RETENTION_NANOS;
        synchronized (events) {
            Iterator<CleanupEvent> it = events.iterator();
            while (it.hasNext()) {
                if (it.next().getTimestampNanos() < cutoff) {
                    it.remove();
                }
            }
        }
    }

    /**
     * Returns a copy of the retained events, oldest first.
     */
    public List<CleanupEvent> recentEvents() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    /**
     * Returns the ticker time of the last expired-entry sweep or optimization, or {@code -1}.
     */
    public long lastCleanupNanos() {
        return lastCleanupNanos;
    }

    public long backgroundRunCount() {
        return backgroundRuns.get();
    }

    public long totalExpiredRemoved() {
        return totalExpiredRemoved.get();
    }

    public CleanupStats getCleanupStats() {
        long now = ticker.read();
        List<CleanupEvent> snapshot = recentEvents();

        Map<CleanupEvent.Type, Integer> summary = new EnumMap<>(CleanupEvent.Type.class);
        int errorEvents = 0;
        int eventsLastHour = 0;
        int errorsLastHour = 0;
        for (CleanupEvent event : snapshot) {
            summary.merge(event.getType(), 1, Integer::sum);
            boolean error = event.getType() == CleanupEvent.Type.ERROR;
            if (error) {
                errorEvents++;
            }
            if (now - event.getTimestampNanos() < EVENT_RETENTION_NANOS) {
                eventsLastHour++;
                if (error) {
                    errorsLastHour++;
                }
            }
        }
        double errorRate = eventsLastHour == 0 ? 0.0 : (double) errorsLastHour / eventsLastHour;

        long runs = backgroundRuns.get();
        long expired = totalExpiredRemoved.get();
        double efficiency = 0.0;
        if (runs > 0) {
            double removalEfficiency = expired > 0 ? 1.0 : 0.5;
            double errorPenalty = (double) errorEvents / (snapshot.size() + 1);
            efficiency = Math.max(0.0, Math.min(1.0, removalEfficiency - errorPenalty));
        }

        boolean running = isBackgroundCleanupRunning();
        long started = startedAtNanos;
        Duration uptime = running && started >= 0 ? Duration.ofNanos(Math.max(0, now - started)) : Duration.ZERO;

        return new CleanupStats(
                expired,
                totalOptimizations.get(),
                runs,
                lastCleanupNanos,
                running,
                cleanupInterval,
                uptime,
                caches.size(),
                snapshot.size(),
                summary,
                eventsLastHour,
                errorRate,
                efficiency);
    }

    public CleanupReport getCleanupReport() {
        CleanupStats stats = getCleanupStats();

        List<CleanupReport.CacheSummary> summaries = new ArrayList<>();
        for (MaintainableCache cache : caches) {
            summaries.add(new CleanupReport.CacheSummary(
                    cache.name(), cache.size(), cache.expiredEntryCount(), cache.utilization()));
        }

        List<CleanupEvent> snapshot = recentEvents();
        List<CleanupEvent> latest = snapshot.subList(Math.max(0, snapshot.size() - REPORT_EVENTS), snapshot.size());

        return new CleanupReport(stats, summaries, latest, recommendations(stats, summaries, snapshot));
    }

    private List<String> recommendations(CleanupStats stats, List<CleanupReport.CacheSummary> summaries,
                                         List<CleanupEvent> snapshot) {
        List<String> recommendations = new ArrayList<>();

        if (stats.getAverageExpiredPerCleanup() > HIGH_AVERAGE_EXPIRED) {
            recommendations.add("High number of expired entries detected. Consider shortening TTL values.");
        }

        if (stats.getErrorRate() > HIGH_ERROR_RATE) {
            recommendations.add(String.format(Locale.ROOT,
                    "Error rate is high (%.1f%%). Check cache system health.", stats.getErrorRate() * 100));
        }

        if (stats.getBackgroundRuns() < OPTIMIZE_EVERY_RUNS && !snapshot.isEmpty()
                && ticker.read() - snapshot.get(0).getTimestampNanos() > EVENT_RETENTION_NANOS) {
            recommendations.add("Low cleanup activity. Verify background cleanup is properly configured.");
        }

        if (!summaries.isEmpty()) {
            double utilization = 0.0;
            for (CleanupReport.CacheSummary summary : summaries) {
                utilization += summary.getUtilization();
            }
            utilization /= summaries.size();
            if (utilization > HIGH_UTILIZATION) {
                recommendations.add("High cache utilization detected. Consider increasing cache sizes.");
            } else if (utilization < LOW_UTILIZATION) {
                recommendations.add("Low cache utilization. Consider optimizing cache strategies or reducing sizes.");
            }
        }

        if (recommendations.isEmpty()) {
            recommendations.add("Cache cleanup is operating optimally!");
        }
        return recommendations;
    }
}
