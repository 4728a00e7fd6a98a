package com.github.rudygunawan.adaptivecache.policy;

/**
 * The reason why a cached entry was removed.
 */
public enum RemovalCause {
    /**
     * The entry was manually removed using {@code invalidate}, {@code invalidatePattern} or
     * {@code invalidateAll}.
     */
    EXPLICIT,

    /**
     * The entry was removed because one of its tags was invalidated.
     */
    TAG,

    /**
     * The entry was removed automatically because its value was replaced by a new value.
     */
    REPLACED,

    /**
     * The entry was removed because the cache exceeded its maximum size.
     */
    SIZE,

    /**
     * The entry's expiration timestamp has passed.
     */
    EXPIRED;

    /**
     * Returns {@code true} if the removal was caused by eviction (either SIZE or EXPIRED),
     * rather than manual removal or replacement.
     */
    public boolean wasEvicted() {
        return this == SIZE || this == EXPIRED;
    }
}
