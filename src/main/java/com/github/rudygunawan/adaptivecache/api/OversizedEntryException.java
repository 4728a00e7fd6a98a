package com.github.rudygunawan.adaptivecache.api;

import com.github.rudygunawan.adaptivecache.policy.SizeEstimator;

/**
 * Thrown by {@code set} when the estimated size of a value is not acceptable for a single entry.
 */
public class OversizedEntryException extends CacheException {
    private static final long serialVersionUID = 1L;

    private final long sizeBytes;

    public OversizedEntryException(String key, long sizeBytes, int maxEntrySizeMB) {
        super("set", key, "Value for key '" + key + "' is too large to cache: "
                + SizeEstimator.formatSize(sizeBytes) + " (limit is 10% of " + maxEntrySizeMB + "MB)");
        this.sizeBytes = sizeBytes;
    }

    /**
     * Returns the estimated size of the rejected value.
     */
    public long getSizeBytes() {
        return sizeBytes;
    }
}
