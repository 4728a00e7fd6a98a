package com.github.rudygunawan.adaptivecache.api;

/**
 * Capability of a cache to tune its own contents on request.
 *
 * <p>The cleanup service only optimizes registered caches that implement this interface.
 */
public interface Optimizable {

    /**
     * Removes expired entries, trims the cache below its capacity and drops bookkeeping for keys
     * that are no longer present.
     */
    void optimize();
}
