package com.github.rudygunawan.adaptivecache.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Snapshot of the cleanup service's counters and derived health metrics.
 */
public final class CleanupStats {
    private final long totalExpiredRemoved;
    private final long totalOptimizations;
    private final long backgroundRuns;
    private final long lastCleanupNanos;
    private final boolean backgroundActive;
    private final Duration cleanupInterval;
    private final Duration uptime;
    private final int managedCaches;
    private final int recentEvents;
    private final Map<CleanupEvent.Type, Integer> eventSummary;
    private final int eventsLastHour;
    private final double errorRate;
    private final double cleanupEfficiency;

    public CleanupStats(
            long totalExpiredRemoved,
            long totalOptimizations,
            long backgroundRuns,
            long lastCleanupNanos,
            boolean backgroundActive,
            Duration cleanupInterval,
            Duration uptime,
            int managedCaches,
            int recentEvents,
            Map<CleanupEvent.Type, Integer> eventSummary,
            int eventsLastHour,
            double errorRate,
            double cleanupEfficiency) {
        this.totalExpiredRemoved = totalExpiredRemoved;
        this.totalOptimizations = totalOptimizations;
        this.backgroundRuns = backgroundRuns;
        this.lastCleanupNanos = lastCleanupNanos;
        this.backgroundActive = backgroundActive;
        this.cleanupInterval = cleanupInterval;
        this.uptime = uptime;
        this.managedCaches = managedCaches;
        this.recentEvents = recentEvents;
        EnumMap<CleanupEvent.Type, Integer> summary = new EnumMap<>(CleanupEvent.Type.class);
        summary.putAll(eventSummary);
        this.eventSummary = Collections.unmodifiableMap(summary);
        this.eventsLastHour = eventsLastHour;
        this.errorRate = errorRate;
        this.cleanupEfficiency = cleanupEfficiency;
    }

    public long getTotalExpiredRemoved() {
        return totalExpiredRemoved;
    }

    public long getTotalOptimizations() {
        return totalOptimizations;
    }

    public long getBackgroundRuns() {
        return backgroundRuns;
    }

    /**
     * Returns the ticker time at which expired entries were last swept or an optimization last
     * finished, if either has happened.
     */
    public OptionalLong getLastCleanupNanos() {
        return lastCleanupNanos < 0 ? OptionalLong.empty() : OptionalLong.of(lastCleanupNanos);
    }

    public boolean isBackgroundActive() {
        return backgroundActive;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    /**
     * Returns how long background cleanup has been running, or zero when it is stopped.
     */
    public Duration getUptime() {
        return uptime;
    }

    public int getManagedCaches() {
        return managedCaches;
    }

    public int getRecentEvents() {
        return recentEvents;
    }

    /**
     * Returns the number of retained events per type.
     */
    public Map<CleanupEvent.Type, Integer> getEventSummary() {
        return eventSummary;
    }

    public double getAverageExpiredPerCleanup() {
        return backgroundRuns == 0 ? 0.0 : (double) totalExpiredRemoved / backgroundRuns;
    }

    public int getEventsLastHour() {
        return eventsLastHour;
    }

    /**
     * Returns the share of error events among the events of the last hour.
     */
    public double getErrorRate() {
        return errorRate;
    }

    /**
     * Returns a score in [0, 1]; 0 before the first background run.
     */
    public double getCleanupEfficiency() {
        return cleanupEfficiency;
    }

    @Override
    public String toString() {
        return "CleanupStats{"
                + "totalExpiredRemoved=" + totalExpiredRemoved
                + ", totalOptimizations=" + totalOptimizations
                + ", backgroundRuns=" + backgroundRuns
                + ", backgroundActive=" + backgroundActive
                + ", managedCaches=" + managedCaches
                + ", eventSummary=" + eventSummary
                + ", errorRate=" + String.format("%.2f", errorRate)
                + '}';
    }
}
