package com.github.rudygunawan.adaptivecache.api;

/**
 * Thrown when a cache operation is rejected.
 *
 * <p>Carries the name of the operation and the key it was applied to so that callers can report
 * the failure without parsing the message.
 */
public class CacheException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String operation;
    private final String key;

    public CacheException(String operation, String key, String message) {
        super(message);
        this.operation = operation;
        this.key = key;
    }

    public CacheException(String operation, String key, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.key = key;
    }

    /**
     * Returns the name of the operation that failed, such as {@code "set"}.
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Returns the key the failed operation was applied to, or {@code null} for whole-cache
     * operations.
     */
    public String getKey() {
        return key;
    }
}
