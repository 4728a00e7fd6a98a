package com.github.rudygunawan.adaptivecache.policy;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Estimates the memory footprint of cached values for capacity accounting.
 *
 * <p>The estimate is coarse and has no side effects:
 * <ul>
 *   <li>{@code null}: 0 bytes</li>
 *   <li>{@link Boolean}: 1 byte</li>
 *   <li>{@link Number} and {@link Character}: 8 bytes</li>
 *   <li>{@link CharSequence}: 2 bytes per UTF-16 code unit</li>
 *   <li>{@link Collection}, arrays and {@link Map}: 24 bytes of container overhead plus the
 *       estimated size of every element (every key and value for maps); a container reached
 *       more than once, including through a cycle, is counted once</li>
 *   <li>anything else: 100 bytes</li>
 * </ul>
 */
public final class SizeEstimator {

    public static final int CONTAINER_OVERHEAD_BYTES = 24;
    public static final int NUMERIC_BYTES = 8;
    public static final int DEFAULT_OBJECT_BYTES = 100;
    public static final int DEFAULT_MAX_SIZE_MB = 10;

    private static final long BYTES_PER_MB = 1024L * 1024L;

    // A single entry may not take more than this share of the configured maximum
    private static final double MAX_ENTRY_SHARE = 0.1;

    private SizeEstimator() {
    }

    /**
     * Returns the estimated size of {@code value} in bytes.
     *
     * @param value the value to measure, may be {@code null}
     * @return the estimated size, never negative
     */
    public static long estimateSize(Object value) {
        return estimateSize(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static long estimateSize(Object value, Set<Object> visited) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Boolean) {
            return 1;
        }
        if (value instanceof Number || value instanceof Character) {
            return NUMERIC_BYTES;
        }
        if (value instanceof CharSequence) {
            return 2L * ((CharSequence) value).length();
        }
        boolean container = value instanceof Map || value instanceof Collection || value.getClass().isArray();
        if (container && !visited.add(value)) {
            return 0;
        }
        if (value instanceof Map) {
            long size = CONTAINER_OVERHEAD_BYTES;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                size += estimateSize(entry.getKey(), visited);
                size += estimateSize(entry.getValue(), visited);
            }
            return size;
        }
        if (value instanceof Collection) {
            long size = CONTAINER_OVERHEAD_BYTES;
            for (Object element : (Collection<?>) value) {
                size += estimateSize(element, visited);
            }
            return size;
        }
        if (value.getClass().isArray()) {
            long size = CONTAINER_OVERHEAD_BYTES;
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                size += estimateSize(Array.get(value, i), visited);
            }
            return size;
        }
        return DEFAULT_OBJECT_BYTES;
    }

    /**
     * Returns whether an entry of {@code bytes} may be stored under the default limit of
     * {@value #DEFAULT_MAX_SIZE_MB} MB.
     *
     * @see #isReasonableSize(long, int)
     */
    public static boolean isReasonableSize(long bytes) {
        return isReasonableSize(bytes, DEFAULT_MAX_SIZE_MB);
    }

    /**
     * Returns whether an entry of {@code bytes} may be stored in a cache limited to
     * {@code maxSizeMB}. Sizes that are not positive, exceed the limit, or exceed 10% of it are
     * rejected so that one entry cannot monopolize the cache.
     *
     * @param bytes the estimated entry size
     * @param maxSizeMB the configured maximum in megabytes
     * @return {@code true} if the size is acceptable
     */
    public static boolean isReasonableSize(long bytes, int maxSizeMB) {
        if (bytes <= 0) {
            return false;
        }
        long maxBytes = maxSizeMB * BYTES_PER_MB;
        if (bytes > maxBytes) {
            return false;
        }
        return bytes <= maxBytes * MAX_ENTRY_SHARE;
    }

    /**
     * Formats a byte count for diagnostics, e.g. {@code 500B}, {@code 1.5KB}, {@code 2.0MB}.
     */
    public static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + "B";
        }
        if (bytes < BYTES_PER_MB) {
            return String.format(Locale.ROOT, "%.1fKB", bytes / 1024.0);
        }
        if (bytes < BYTES_PER_MB * 1024) {
            return String.format(Locale.ROOT, "%.1fMB", bytes / (double) BYTES_PER_MB);
        }
        return String.format(Locale.ROOT, "%.1fGB", bytes / (double) (BYTES_PER_MB * 1024));
    }
}
