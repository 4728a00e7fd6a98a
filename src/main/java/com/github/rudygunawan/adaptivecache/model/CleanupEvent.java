package com.github.rudygunawan.adaptivecache.model;

import java.util.Objects;

/**
 * One entry of the cleanup service's diagnostic event log.
 */
public final class CleanupEvent {

    /**
     * Kinds of cleanup events.
     */
    public enum Type {
        EXPIRED_REMOVAL,
        OPTIMIZATION,
        BACKGROUND,
        ERROR
    }

    private final Type type;
    private final long timestampNanos;
    private final String message;

    public CleanupEvent(Type type, long timestampNanos, String message) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.timestampNanos = timestampNanos;
        this.message = Objects.requireNonNull(message, "message cannot be null");
    }

    public Type getType() {
        return type;
    }

    /**
     * Returns the ticker time at which the event was recorded.
     */
    public long getTimestampNanos() {
        return timestampNanos;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return type + "@" + timestampNanos + ": " + message;
    }
}
