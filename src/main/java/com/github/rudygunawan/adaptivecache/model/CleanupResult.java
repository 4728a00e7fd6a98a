package com.github.rudygunawan.adaptivecache.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a forced cleanup pass.
 */
public final class CleanupResult {
    private final boolean success;
    private final int expiredRemoved;
    private final Duration duration;
    private final List<String> errors;

    public CleanupResult(boolean success, int expiredRemoved, Duration duration, List<String> errors) {
        this.success = success;
        this.expiredRemoved = expiredRemoved;
        this.duration = Objects.requireNonNull(duration, "duration cannot be null");
        this.errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return success;
    }

    public int getExpiredRemoved() {
        return expiredRemoved;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Returns the messages of the failures that stopped the pass; empty on success.
     */
    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "CleanupResult{"
                + "success=" + success
                + ", expiredRemoved=" + expiredRemoved
                + ", durationMs=" + duration.toMillis()
                + ", errors=" + errors
                + '}';
    }
}
