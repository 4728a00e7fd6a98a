package com.github.rudygunawan.adaptivecache.model;

import java.util.List;
import java.util.Objects;

/**
 * Detailed cleanup report: the service statistics, a snapshot of every managed cache, the most
 * recent events and tuning recommendations.
 */
public final class CleanupReport {

    /**
     * Point-in-time view of one managed cache.
     */
    public static final class CacheSummary {
        private final String name;
        private final long entries;
        private final long expiredEntries;
        private final double utilization;

        public CacheSummary(String name, long entries, long expiredEntries, double utilization) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
            this.entries = entries;
            this.expiredEntries = expiredEntries;
            this.utilization = utilization;
        }

        public String getName() {
            return name;
        }

        public long getEntries() {
            return entries;
        }

        public long getExpiredEntries() {
            return expiredEntries;
        }

        /**
         * Returns the filled share of the cache's capacity, from 0.0 to 1.0.
         */
        public double getUtilization() {
            return utilization;
        }

        @Override
        public String toString() {
            return name + "{entries=" + entries + ", expired=" + expiredEntries
                    + ", utilization=" + String.format("%.2f", utilization) + '}';
        }
    }

    private final CleanupStats summary;
    private final List<CacheSummary> caches;
    private final List<CleanupEvent> recentEvents;
    private final List<String> recommendations;

    public CleanupReport(CleanupStats summary, List<CacheSummary> caches,
                         List<CleanupEvent> recentEvents, List<String> recommendations) {
        this.summary = Objects.requireNonNull(summary, "summary cannot be null");
        this.caches = List.copyOf(caches);
        this.recentEvents = List.copyOf(recentEvents);
        this.recommendations = List.copyOf(recommendations);
    }

    public CleanupStats getSummary() {
        return summary;
    }

    public List<CacheSummary> getCaches() {
        return caches;
    }

    /**
     * Returns up to the 20 most recent events, oldest first.
     */
    public List<CleanupEvent> getRecentEvents() {
        return recentEvents;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Cleanup Report\n");
        sb.append("  ").append(summary).append('\n');
        for (CacheSummary cache : caches) {
            sb.append("  cache ").append(cache).append('\n');
        }
        for (String recommendation : recommendations) {
            sb.append("  - ").append(recommendation).append('\n');
        }
        return sb.toString();
    }
}
