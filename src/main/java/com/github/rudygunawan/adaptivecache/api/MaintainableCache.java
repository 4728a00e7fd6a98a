package com.github.rudygunawan.adaptivecache.api;

/**
 * A cache that can be registered with a cleanup service.
 */
public interface MaintainableCache {

    /**
     * Returns the name used in cleanup reports.
     */
    String name();

    /**
     * Returns the number of entries currently held, expired ones included.
     */
    long size();

    /**
     * Returns the number of held entries whose time-to-live has elapsed.
     */
    long expiredEntryCount();

    /**
     * Returns the filled share of the capacity, from 0.0 to 1.0.
     */
    double utilization();

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    int removeExpiredEntries();
}
